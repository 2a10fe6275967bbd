package naturaldate.domain.relative;

import naturaldate.domain.extract.DateTimeFields;
import naturaldate.domain.extract.ExtractionInput;
import naturaldate.domain.extract.ExtractionRule;

/**
 * "yesterday", "today" and "tomorrow", each relative to the current day of the month. The day may
 * leave the month here; the date normalizer rolls it into the neighbouring month.
 */
public class RelativeDayRule implements ExtractionRule {
    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        final String text = input.text();
        final int today = input.now().getDayOfMonth();

        if (text.contains("yesterday")) {
            fields.setDay(today - 1);
        }

        if (text.contains("today")) {
            fields.setDay(today);
        }

        if (text.contains("tomorrow")) {
            fields.setDay(today + 1);
        }
    }
}
