package io.middleware4j.errors;

import io.middleware4j.core.Dependency;

import java.util.List;

/**
 * Raised when an entry cannot be deleted because other stores still reference it.
 */
public class DependencyConflictException extends MiddlewareException {

    private final List<Dependency> dependencies;

    public DependencyConflictException(String message, List<Dependency> dependencies) {
        super(message, ErrorCode.EBUSY);
        this.dependencies = List.copyOf(dependencies);
    }

    public List<Dependency> dependencies() {
        return dependencies;
    }
}
