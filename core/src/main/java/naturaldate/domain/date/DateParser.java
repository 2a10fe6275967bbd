package naturaldate.domain.date;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Defines a service for parsing dates
 */
public interface DateParser {
    /**
     * Parse a date relative to the current time.
     *
     * @param date The date string
     * @return The parsed date
     */
    OffsetDateTime parseDate(@Nullable String date);

    /**
     * Parse a date relative to the supplied instant.
     *
     * @param date The date string
     * @param now  The instant that relative expressions like "tomorrow" are resolved against
     * @return The parsed date
     */
    OffsetDateTime parseDate(@Nullable String date, Instant now);
}
