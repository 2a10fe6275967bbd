package naturaldate.domain.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordinal days like "3rd" or "21st". The literal checks match inside longer ordinals, the regex that
 * runs after them overwrites with the full number.
 */
public class OrdinalDayRule implements ExtractionRule {
    private static final Pattern ORDINAL_PATTERN = Pattern.compile("\\b(\\d{1,2})(st|nd|rd|th)\\b");

    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        final String text = input.text();

        if (text.contains("1st")) {
            fields.setDay(1);
        }

        if (text.contains("2nd")) {
            fields.setDay(2);
        }

        if (text.contains("3rd")) {
            fields.setDay(3);
        }

        final Matcher matcher = ORDINAL_PATTERN.matcher(text);
        if (matcher.find()) {
            fields.setDay(Integer.parseInt(matcher.group(1)));
        }
    }
}
