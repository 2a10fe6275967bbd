package naturaldate.domain.timeofday;

import naturaldate.domain.extract.DateTimeFields;
import naturaldate.domain.extract.ExtractionInput;
import naturaldate.domain.extract.ExtractionRule;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sets the UTC offset from an abbreviation preceded by a space, then from an explicit gmt+N or utc-N.
 * Explicit offsets are applied last and so override any abbreviation.
 */
public class TimeZoneRule implements ExtractionRule {
    private static final List<Pattern> EXPLICIT_OFFSET_PATTERNS = List.of(
            Pattern.compile("gmt([+-]\\d{1,2})"),
            Pattern.compile("utc([+-]\\d{1,2})"));

    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        final String text = input.text();

        TimeZoneTable.ENTRIES.forEach((abbreviation, offset) -> {
            if (text.contains(" " + abbreviation)) {
                fields.setUtcOffsetHours(offset);
            }
        });

        for (final Pattern pattern : EXPLICIT_OFFSET_PATTERNS) {
            final Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                fields.setUtcOffsetHours(Integer.parseInt(matcher.group(1)));
            }
        }
    }
}
