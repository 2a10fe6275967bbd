package naturaldate.domain.date;

import io.smallrye.common.annotation.Identifier;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import naturaldate.domain.exceptionhandling.ExceptionMapping;
import naturaldate.domain.extract.DateTimeFields;
import naturaldate.domain.extract.ExtractionInput;
import naturaldate.domain.normalize.DateNormalizerSelector;
import naturaldate.domain.translate.KeywordTranslatorSelector;
import naturaldate.domain.validate.ValidateString;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Parses free-form date expressions such as "next monday at 14:30", "31.01.2025", "jutro o 9" or
 * "yesterday evening utc+2".
 * <p>
 * The expression is translated to canonical English first. A complete ISO8601 timestamp is returned as is,
 * and "now" returns the current instant. Anything else starts from the current date and hour in UTC and is
 * run through the extraction rules, then the day of the month is normalized.
 * <p>
 * Failures are reported as {@link naturaldate.domain.exceptions.InternalFailure}, with
 * {@link naturaldate.domain.exceptions.InvalidDateExpression} for blank expressions and expressions that
 * resolve to an impossible date or time.
 */
@ApplicationScoped
public class NaturalDateParser implements DateParser {
    private static final String NOW = "now";

    @Inject
    @Identifier("iso8601")
    private DateParser isoDateParser;

    @Inject
    private KeywordTranslatorSelector keywordTranslatorSelector;

    @Inject
    private ExtractionPipeline extractionPipeline;

    @Inject
    private DateNormalizerSelector dateNormalizerSelector;

    @Inject
    private ExceptionMapping exceptionMapping;

    @Inject
    private ValidateString validateString;

    @Inject
    private Clock clock;

    @Inject
    private Logger logger;

    @Override
    public OffsetDateTime parseDate(@Nullable final String date) {
        return parseDate(date, clock.instant());
    }

    @Override
    public OffsetDateTime parseDate(@Nullable final String date, final Instant now) {
        checkNotNull(now);

        final Try<OffsetDateTime> result = Try.of(() -> validateString.throwIfBlank(date))
                .map(keywordTranslatorSelector.getKeywordTranslator()::translate)
                .peek(translated -> logger.fine(() -> "Translated \"" + date + "\" to \"" + translated + "\""))
                .flatMap(translated -> resolve(translated, now.atOffset(ZoneOffset.UTC)));

        return exceptionMapping.map(result)
                .onFailure(ex -> logger.fine(() -> "Failed to parse \"" + date + "\": " + ex.getMessage()))
                .get();
    }

    private Try<OffsetDateTime> resolve(final String translated, final OffsetDateTime now) {
        return Try.of(() -> isoDateParser.parseDate(translated, now.toInstant()))
                .recoverWith(error -> Try.of(() -> NOW.equals(translated) ? now : extract(translated, now)));
    }

    private OffsetDateTime extract(final String translated, final OffsetDateTime now) {
        final DateTimeFields fields = extractionPipeline.extract(new ExtractionInput(translated, now));

        logger.fine(() -> "Extracted " + fields + " from \"" + translated + "\"");

        final LocalDate date = dateNormalizerSelector.getDateNormalizer()
                .normalize(fields.getYear(), fields.getMonth(), fields.getDay());

        return OffsetDateTime.of(
                date,
                LocalTime.of(fields.getHour(), fields.getMinute(), fields.getSecond()),
                ZoneOffset.ofHours(fields.getUtcOffsetHours()));
    }
}
