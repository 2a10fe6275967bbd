package naturaldate.domain.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An explicit H:M or H:M:S time. Without seconds the second field keeps its previous value.
 */
public class ClockTimeRule implements ExtractionRule {
    private static final Pattern TIME_PATTERN = Pattern.compile("\\b(\\d{1,2}):(\\d{1,2})(?::(\\d{1,2}))?\\b");

    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        final Matcher matcher = TIME_PATTERN.matcher(input.text());
        if (!matcher.find()) {
            return;
        }

        fields.setHour(Integer.parseInt(matcher.group(1)));
        fields.setMinute(Integer.parseInt(matcher.group(2)));

        if (matcher.group(3) != null) {
            fields.setSecond(Integer.parseInt(matcher.group(3)));
        }
    }
}
