package naturaldate.domain.format;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Formats timestamps for display relative to now, for example "Today, 13:37" or "Mon, 09:00".
 * The offset is a whole number of hours from UTC and is applied to both the timestamp and now before
 * their calendar dates are compared.
 */
@ApplicationScoped
public class NaturalDateFormatter {
    private static final int NEARBY_DAYS = 7;

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm", Locale.ENGLISH);
    private static final DateTimeFormatter WEEKDAY = DateTimeFormatter.ofPattern("EEE", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH);
    private static final DateTimeFormatter FULL_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ENGLISH);

    @Inject
    private Clock clock;

    public String toNaturalString(final OffsetDateTime time, final int offset, final boolean includeTime) {
        return toNaturalString(time, offset, includeTime, clock.instant());
    }

    /**
     * @param time        The timestamp to format
     * @param offset      Hours from UTC to display the timestamp in
     * @param includeTime Whether to add the time of day
     * @param now         The instant the timestamp is described relative to
     * @return Today/Yesterday/Tomorrow, a weekday within a week, "MMM dd" within the year, otherwise "yyyy-MM-dd"
     */
    public String toNaturalString(final OffsetDateTime time, final int offset, final boolean includeTime, final Instant now) {
        checkNotNull(time);
        checkNotNull(now);

        final ZoneOffset zoneOffset = ZoneOffset.ofHours(offset);
        final OffsetDateTime target = time.withOffsetSameInstant(zoneOffset);
        final OffsetDateTime current = now.atOffset(zoneOffset);

        final String date = naturalDate(target, current);

        if (!includeTime) {
            return date;
        }

        final String clockTime = target.format(TIME);

        if (target.toLocalDate().equals(current.toLocalDate())) {
            return target.isAfter(current) ? date + ", " + clockTime : clockTime;
        }

        return date + ", " + clockTime;
    }

    private String naturalDate(final OffsetDateTime target, final OffsetDateTime current) {
        final LocalDate targetDate = target.toLocalDate();
        final LocalDate currentDate = current.toLocalDate();

        if (targetDate.equals(currentDate)) {
            return "Today";
        }

        if (targetDate.equals(currentDate.minusDays(1))) {
            return "Yesterday";
        }

        if (targetDate.equals(currentDate.plusDays(1))) {
            return "Tomorrow";
        }

        if (!targetDate.isBefore(currentDate.minusDays(NEARBY_DAYS)) && !targetDate.isAfter(currentDate.plusDays(NEARBY_DAYS))) {
            return target.format(WEEKDAY);
        }

        if (target.getYear() == current.getYear()) {
            return target.format(MONTH_DAY);
        }

        return target.format(FULL_DATE);
    }
}
