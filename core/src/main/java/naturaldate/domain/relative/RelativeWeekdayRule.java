package naturaldate.domain.relative;

import naturaldate.domain.extract.DateTimeFields;
import naturaldate.domain.extract.ExtractionInput;
import naturaldate.domain.extract.ExtractionRule;

import java.time.DayOfWeek;
import java.util.Map;

/**
 * Moves the day to a named weekday of the current week (Monday first), a week back with "last" or a
 * week ahead with "next". Only the first weekday name found in table order is used.
 */
public class RelativeWeekdayRule implements ExtractionRule {
    private static final int DAYS_PER_WEEK = 7;

    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        final String text = input.text();
        final boolean isLast = text.contains("last");
        final boolean isNext = text.contains("next");

        WeekdayTable.ENTRIES.entrySet().stream()
                .filter(entry -> text.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .ifPresent(target -> fields.setDay(input.now().getDayOfMonth()
                        + difference(input.now().getDayOfWeek(), target)
                        + weekShift(isLast, isNext)));
    }

    private int difference(final DayOfWeek current, final DayOfWeek target) {
        return target.ordinal() - current.ordinal();
    }

    private int weekShift(final boolean isLast, final boolean isNext) {
        if (isLast) {
            return -DAYS_PER_WEEK;
        }

        if (isNext) {
            return DAYS_PER_WEEK;
        }

        return 0;
    }
}
