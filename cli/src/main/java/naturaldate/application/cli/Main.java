package naturaldate.application.cli;

import io.vavr.control.Try;
import jakarta.inject.Inject;
import naturaldate.Marker;
import naturaldate.domain.date.DateParser;
import naturaldate.domain.exceptionhandling.ExceptionHandler;
import naturaldate.domain.format.NaturalDateFormatter;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Parses a date expression from the command line.
 * <p>
 * Usage: {@code Main <expression> [now]}, where now is an optional ISO8601 instant the expression is
 * relative to. Prints the timestamp in ISO8601 form followed by its natural description.
 */
public class Main {
    @Inject
    private DateParser dateParser;

    @Inject
    private NaturalDateFormatter naturalDateFormatter;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Clock clock;

    @Inject
    @ConfigProperty(name = "nd.output.offset", defaultValue = "0")
    private Integer offset;

    @Inject
    @ConfigProperty(name = "nd.output.includeTime", defaultValue = "true")
    private Boolean includeTime;

    public static void main(final String[] args) {
        LogConfig.init();

        final Weld weld = new Weld();
        /*
        The marker class lives in the root package of the core module, so scanning recursively from it
        picks up the beans in the core JAR.
         */
        final int status;
        try (WeldContainer weldContainer = weld.addBeanClass(Main.class).addPackages(true, Marker.class).initialize()) {
            status = weldContainer.select(Main.class).get().entry(args);
        }

        if (status != 0) {
            System.exit(status);
        }
    }

    private String getExpression(final String[] args) {
        if (args.length > 0 && !StringUtils.isBlank(args[0])) {
            return args[0];
        }

        throw new IllegalArgumentException("No date expression specified");
    }

    /**
     * @return The instant given as the second argument, or the clock's current instant
     */
    private Instant getNow(final String[] args) {
        if (args.length > 1 && StringUtils.isNotBlank(args[1])) {
            return Instant.parse(args[1].trim());
        }

        return clock.instant();
    }

    /**
     * @return The process exit status
     */
    public int entry(final String[] args) {
        return Try.of(() -> getNow(args))
                .flatMap(now -> Try.of(() -> getExpression(args))
                        .map(expression -> dateParser.parseDate(expression, now))
                        .peek(result -> printOutput(result, now)))
                .onFailure(e -> System.err.println("Failed to parse date: " + exceptionHandler.getExceptionMessage(e)))
                .map(result -> 0)
                .getOrElse(1);
    }

    private void printOutput(final OffsetDateTime result, final Instant now) {
        System.out.println(result.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        System.out.println(naturalDateFormatter.toNaturalString(result, offset, includeTime, now));
    }
}
