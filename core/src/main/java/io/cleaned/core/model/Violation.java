package io.cleaned.core.model;

import java.util.Objects;

/**
 * One entry of a flattened error report: where the failure happened and what it was.
 *
 * @param path    location of the failure
 * @param failure message and code
 */
public record Violation(FieldPath path, Failure failure) {

    public Violation {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(failure, "failure must not be null");
    }

    public String message() {
        return failure.message();
    }

    public ErrorCode code() {
        return failure.code();
    }

    @Override
    public String toString() {
        return path.render() + " -> " + failure;
    }
}
