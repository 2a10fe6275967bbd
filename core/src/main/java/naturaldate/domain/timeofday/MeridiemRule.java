package naturaldate.domain.timeofday;

import naturaldate.domain.extract.DateTimeFields;
import naturaldate.domain.extract.ExtractionInput;
import naturaldate.domain.extract.ExtractionRule;

/**
 * Converts a 12-hour clock value. " am" and " pm" are searched for anywhere in the text, not next to the
 * time, so "pm" as an unrelated word still moves the hour into the afternoon.
 */
public class MeridiemRule implements ExtractionRule {
    private static final int HALF_DAY = 12;

    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        if (input.text().contains(" am") && fields.getHour() == HALF_DAY) {
            fields.setHour(0);
        }

        if (input.text().contains(" pm") && fields.getHour() < HALF_DAY) {
            fields.setHour(fields.getHour() + HALF_DAY);
        }
    }
}
