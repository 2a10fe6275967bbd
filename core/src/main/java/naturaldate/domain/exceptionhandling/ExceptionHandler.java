package naturaldate.domain.exceptionhandling;

/**
 * Turns an exception into a message that can be shown to the user.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
