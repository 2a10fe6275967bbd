package naturaldate.domain.normalize;

import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Rolls days past the end of the month into the following months, and days before the first of the
 * month back into the preceding months. Day 45 of January is February 14th, day 0 of March is the
 * last day of February.
 */
@ApplicationScoped
public class RollingDateNormalizer implements DateNormalizer {
    public static final String POLICY = "roll";

    @Override
    public String getPolicy() {
        return POLICY;
    }

    @Override
    public LocalDate normalize(final int year, final int month, final int day) {
        YearMonth yearMonth = YearMonth.of(year, month);
        int dayOfMonth = day;

        while (dayOfMonth > yearMonth.lengthOfMonth()) {
            dayOfMonth -= yearMonth.lengthOfMonth();
            yearMonth = yearMonth.plusMonths(1);
        }

        while (dayOfMonth < 1) {
            yearMonth = yearMonth.minusMonths(1);
            dayOfMonth += yearMonth.lengthOfMonth();
        }

        return yearMonth.atDay(dayOfMonth);
    }
}
