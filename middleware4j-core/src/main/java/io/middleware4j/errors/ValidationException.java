package io.middleware4j.errors;

import java.util.List;
import java.util.stream.Collectors;

public class ValidationException extends MiddlewareException {

    private final List<ValidationError> errors;

    public ValidationException(String attribute, String message) {
        this(List.of(new ValidationError(attribute, message)));
    }

    public ValidationException(List<ValidationError> errors) {
        super(errors.stream().map(ValidationError::toString).collect(Collectors.joining("\n")), ErrorCode.EINVAL);
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> errors() {
        return errors;
    }
}
