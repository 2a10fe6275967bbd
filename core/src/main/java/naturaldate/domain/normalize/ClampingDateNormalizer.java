package naturaldate.domain.normalize;

import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Keeps the date inside the given month: day 45 of January is January 31st, day 0 is January 1st.
 */
@ApplicationScoped
public class ClampingDateNormalizer implements DateNormalizer {
    public static final String POLICY = "clamp";

    @Override
    public String getPolicy() {
        return POLICY;
    }

    @Override
    public LocalDate normalize(final int year, final int month, final int day) {
        final YearMonth yearMonth = YearMonth.of(year, month);
        return yearMonth.atDay(Math.max(1, Math.min(day, yearMonth.lengthOfMonth())));
    }
}
