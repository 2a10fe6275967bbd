package naturaldate.domain.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The first standalone run of four digits is the year.
 */
public class YearRule implements ExtractionRule {
    private static final Pattern YEAR_PATTERN = Pattern.compile("\\b\\d{4}\\b");

    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        final Matcher matcher = YEAR_PATTERN.matcher(input.text());
        if (matcher.find()) {
            fields.setYear(Integer.parseInt(matcher.group()));
        }
    }
}
