package naturaldate.domain.validate;

import org.jspecify.annotations.Nullable;

public interface ValidateString {

    String throwIfBlank(@Nullable String value);
}
