package naturaldate.domain.clock;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Produces the clock that "now" is read from. Setting nd.clock.fixed to an ISO8601 instant pins the clock,
 * which makes relative expressions reproducible.
 */
@ApplicationScoped
public class ClockProducer {
    @Inject
    @ConfigProperty(name = "nd.clock.fixed")
    private Optional<String> fixed;

    @Inject
    private Logger logger;

    @Produces
    public Clock getClock() {
        return fixed
                .filter(StringUtils::isNotBlank)
                .map(this::fixedClock)
                .orElseGet(Clock::systemUTC);
    }

    private Clock fixedClock(final String instant) {
        return Try.of(() -> Instant.parse(instant.trim()))
                .map(parsed -> Clock.fixed(parsed, ZoneOffset.UTC))
                .onFailure(ex -> logger.warning("Ignoring invalid nd.clock.fixed value \"" + instant + "\": " + ex.getMessage()))
                .getOrElse(Clock::systemUTC);
    }
}
