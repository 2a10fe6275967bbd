package naturaldate.domain.extract;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric date literals. The constants are declared in the order they are applied, and as every match
 * overwrites the date, the last literal form that matches wins.
 */
public enum StructuredDateRule implements ExtractionRule {
    /**
     * 01/31/2025, read month first.
     */
    SLASH("\\b\\d{1,2}/\\d{1,2}/\\d{4}\\b", '/', 2, 0, 1),
    /**
     * 31.01, no year.
     */
    SHORT_DOT("\\b\\d{1,2}\\.\\d{1,2}\\b", '.', -1, 1, 0),
    /**
     * 31.01.2025
     */
    DOT("\\b\\d{1,2}\\.\\d{1,2}\\.\\d{4}\\b", '.', 2, 1, 0),
    /**
     * 2025.01.31
     */
    REVERSE_DOT("\\b\\d{4}\\.\\d{1,2}\\.\\d{1,2}\\b", '.', 0, 1, 2),
    /**
     * 2025-01-31
     */
    HYPHENATED("\\b\\d{4}-\\d{1,2}-\\d{1,2}\\b", '-', 0, 1, 2),
    /**
     * 31-01-2025
     */
    REVERSE_HYPHENATED("\\b\\d{1,2}-\\d{1,2}-\\d{4}\\b", '-', 2, 1, 0);

    private final Pattern pattern;
    private final char separator;
    private final int yearIndex;
    private final int monthIndex;
    private final int dayIndex;

    StructuredDateRule(final String regex, final char separator, final int yearIndex, final int monthIndex, final int dayIndex) {
        this.pattern = Pattern.compile(regex);
        this.separator = separator;
        this.yearIndex = yearIndex;
        this.monthIndex = monthIndex;
        this.dayIndex = dayIndex;
    }

    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        final Matcher matcher = pattern.matcher(input.text());
        if (!matcher.find()) {
            return;
        }

        final String[] parts = StringUtils.split(matcher.group(), separator);

        fields.setDay(Integer.parseInt(parts[dayIndex]));
        fields.setMonth(Integer.parseInt(parts[monthIndex]));

        if (yearIndex != -1) {
            fields.setYear(Integer.parseInt(parts[yearIndex]));
        }
    }
}
