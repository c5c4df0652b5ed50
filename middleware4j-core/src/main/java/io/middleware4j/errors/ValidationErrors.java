package io.middleware4j.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects validation failures so they can be raised together before any mutation happens.
 */
public class ValidationErrors {

    private final List<ValidationError> errors = new ArrayList<>();

    public ValidationErrors add(String attribute, String message) {
        errors.add(new ValidationError(attribute, message));
        return this;
    }

    public ValidationErrors add(String attribute, String message, ErrorCode code) {
        errors.add(new ValidationError(attribute, message, code));
        return this;
    }

    public ValidationErrors addAll(ValidationErrors other) {
        errors.addAll(other.errors);
        return this;
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public List<ValidationError> errors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Raise a {@link ValidationException} carrying every collected error, if there are any.
     */
    public void check() {
        if (!errors.isEmpty()) {
            throw new ValidationException(List.copyOf(errors));
        }
    }
}
