package naturaldate.domain.exceptions;

/**
 * Represents a failure from an internal source. Parsing is deterministic, so if you make the same call with the
 * same text and the same "now" you'll get the same result.
 * We have a concrete class representing an internal failure (in addition to the InternalException interface)
 * to allow it to be used in methods like Try.recover() in Vavr which require a concrete class.
 */
public class InternalFailure extends RuntimeException implements InternalException {
    public InternalFailure() {
        super();
    }

    public InternalFailure(final String message) {
        super(message);
    }

    public InternalFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public InternalFailure(final Throwable cause) {
        super(cause);
    }
}
