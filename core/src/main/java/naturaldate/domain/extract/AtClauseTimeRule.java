package naturaldate.domain.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Up to three runs of one or two digits after "at" become the hour, minute and second.
 * Runs are not word bounded, so "at 2025" reads as 20:25.
 */
public class AtClauseTimeRule implements ExtractionRule {
    private static final Pattern NUMBERS_PATTERN = Pattern.compile("\\d{1,2}");

    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        if (!input.hasAt()) {
            return;
        }

        final Matcher matcher = NUMBERS_PATTERN.matcher(input.afterAt());

        if (matcher.find()) {
            fields.setHour(Integer.parseInt(matcher.group()));
        }

        if (matcher.find()) {
            fields.setMinute(Integer.parseInt(matcher.group()));
        }

        if (matcher.find()) {
            fields.setSecond(Integer.parseInt(matcher.group()));
        }
    }
}
