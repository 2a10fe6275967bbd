package naturaldate.domain.validate.impl;

import jakarta.enterprise.context.ApplicationScoped;
import naturaldate.domain.exceptions.EmptyString;
import naturaldate.domain.validate.ValidateString;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;


@ApplicationScoped
public class ValidateStringImpl implements ValidateString {
    @Override
    public String throwIfBlank(@Nullable final String value) {
        if (StringUtils.isBlank(value)) {
            throw new EmptyString("String is blank");
        }
        return value;
    }
}
