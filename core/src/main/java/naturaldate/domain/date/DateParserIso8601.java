package naturaldate.domain.date;

import io.smallrye.common.annotation.Identifier;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.Locale;

/**
 * A service for parsing complete ISO8601 timestamps. Input is matched case-insensitively, so lower-cased text
 * like "2025-01-31t10:00:00z" is accepted. A space may replace the "T" separator. Timestamps without an offset
 * are read as UTC.
 */
@ApplicationScoped
@Identifier("iso8601")
public class DateParserIso8601 implements DateParser {
    private static final DateTimeFormatter OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_OFFSET_DATE_TIME)
            .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter SPACED_OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .appendOffsetId()
            .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter SPACED_LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter(Locale.ROOT);

    @Inject
    private Clock clock;

    @Override
    public OffsetDateTime parseDate(@Nullable final String date) {
        return parseDate(date, clock.instant());
    }

    /**
     * The timestamp is absolute, so now is ignored.
     */
    @Override
    public OffsetDateTime parseDate(@Nullable final String date, final Instant now) {
        return Try.of(() -> OffsetDateTime.parse(date, OFFSET_DATE_TIME))
                .recoverWith(error -> Try.of(() -> OffsetDateTime.parse(date, SPACED_OFFSET_DATE_TIME)))
                .recoverWith(error -> Try.of(() -> parseLocalDate(date)))
                .get();
    }

    private OffsetDateTime parseLocalDate(@Nullable final String date) {
        return Try.of(() -> LocalDateTime.parse(date, LOCAL_DATE_TIME))
                .recoverWith(error -> Try.of(() -> LocalDateTime.parse(date, SPACED_LOCAL_DATE_TIME)))
                .map(localDateTime -> localDateTime.atOffset(ZoneOffset.UTC))
                .get();
    }
}
