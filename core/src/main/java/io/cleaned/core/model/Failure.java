package io.cleaned.core.model;

import java.util.Objects;

/**
 * A single validation failure: a human-readable message plus its {@link ErrorCode}.
 *
 * @param message the description shown to callers
 * @param code    the failure kind
 */
public record Failure(String message, ErrorCode code) {

    public Failure {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(code, "code must not be null");
    }

    public static Failure of(ErrorCode code, String message) {
        return new Failure(message, code);
    }

    /** The failure reported for a missing, non-optional field. */
    public static Failure required() {
        return new Failure("this field is required", ErrorCode.REQUIRED);
    }

    public static Failure typeError(String expected, Object actual) {
        return new Failure("expected " + expected + ", got " + describe(actual), ErrorCode.TYPE_ERROR);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return code.tag() + ": " + message;
    }
}
