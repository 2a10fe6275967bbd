package naturaldate.domain.exceptions;

/**
 * Represents a date expression that could not be turned into a timestamp, for example because it
 * resolved to month 13 or hour 25.
 */
public class InvalidDateExpression extends InternalFailure {
    public InvalidDateExpression() {
        super();
    }

    public InvalidDateExpression(final String message) {
        super(message);
    }

    public InvalidDateExpression(final String message, final Throwable cause) {
        super(message, cause);
    }

    public InvalidDateExpression(final Throwable cause) {
        super(cause);
    }
}
