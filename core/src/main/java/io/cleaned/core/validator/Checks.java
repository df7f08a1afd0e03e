package io.cleaned.core.validator;

import io.cleaned.core.model.ErrorCode;
import io.cleaned.core.model.Failure;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/** Constraint checks shared by several validators. Stateless. */
final class Checks {

    private Checks() {}

    /** Checks a length or element count against optional inclusive limits. */
    static Optional<Failure> length(int length, Integer min, Integer max, String unit) {
        if (min != null && length < min) {
            return Optional.of(Failure.of(ErrorCode.MIN_LENGTH, unit + " must be ≥ " + min));
        }
        if (max != null && length > max) {
            return Optional.of(Failure.of(ErrorCode.MAX_LENGTH, unit + " must be ≤ " + max));
        }
        return Optional.empty();
    }

    /** Checks membership in a set of permitted values; {@code null} means unrestricted. */
    static <T> Optional<Failure> choice(T value, Set<T> choices) {
        if (choices == null || choices.contains(value)) {
            return Optional.empty();
        }
        return Optional.of(Failure.of(ErrorCode.INVALID_CHOICE, "must be one of " + choices));
    }

    static void requireLengthRange(Integer min, Integer max) {
        if (min != null && min < 0) {
            throw new IllegalArgumentException("minimum length must not be negative, got: " + min);
        }
        if (max != null && max < 0) {
            throw new IllegalArgumentException("maximum length must not be negative, got: " + max);
        }
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("minimum length " + min + " exceeds maximum length " + max);
        }
    }

    @SafeVarargs
    static <T> Set<T> choices(T... values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("at least one choice is required");
        }
        Set<T> set = new LinkedHashSet<>();
        Collections.addAll(set, values);
        return Collections.unmodifiableSet(set);
    }
}
