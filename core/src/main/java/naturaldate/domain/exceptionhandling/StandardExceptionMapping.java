package naturaldate.domain.exceptionhandling;

import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import naturaldate.domain.exceptions.EmptyString;
import naturaldate.domain.exceptions.InternalException;
import naturaldate.domain.exceptions.InternalFailure;
import naturaldate.domain.exceptions.InvalidDateExpression;

import java.time.DateTimeException;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Predicates.instanceOf;

/**
 * Standard implementation of exception mapping.
 * Exceptions implementing InternalException pass through, everything else is mapped to InternalFailure.
 * Problems with the expression itself become InvalidDateExpression, a subclass of InternalFailure.
 */
@ApplicationScoped
public class StandardExceptionMapping implements ExceptionMapping {
    @Override
    public <T> Try<T> map(final Try<T> tryObject) {
        checkNotNull(tryObject);

        return tryObject.mapFailure(
                // Exceptions already in the internal family pass through.
                API.Case(API.$(instanceOf(InternalException.class)), throwable -> throwable),
                API.Case(API.$(instanceOf(EmptyString.class)),
                        throwable -> new InvalidDateExpression("The date expression was empty", throwable)),
                // Thrown by java.time when the assembled fields do not form a valid timestamp.
                API.Case(API.$(instanceOf(DateTimeException.class)),
                        throwable -> new InvalidDateExpression("The date expression resolved to an invalid date or time: " + throwable.getMessage(), throwable)),
                API.Case(API.$(instanceOf(NumberFormatException.class)),
                        throwable -> new InvalidDateExpression("The date expression contained an invalid number: " + throwable.getMessage(), throwable)),
                // Map everything else to InternalFailure.
                API.Case(API.$(), throwable -> new InternalFailure(throwable)));
    }
}
