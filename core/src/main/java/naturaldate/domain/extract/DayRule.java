package naturaldate.domain.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The first standalone run of one or two digits before "at" is the day of the month.
 */
public class DayRule implements ExtractionRule {
    private static final Pattern DAY_PATTERN = Pattern.compile("\\b\\d{1,2}\\b");

    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        final Matcher matcher = DAY_PATTERN.matcher(input.beforeAt());
        if (matcher.find()) {
            fields.setDay(Integer.parseInt(matcher.group()));
        }
    }
}
