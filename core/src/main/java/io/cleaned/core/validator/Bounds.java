package io.cleaned.core.validator;

import io.cleaned.core.model.ErrorCode;
import io.cleaned.core.model.Failure;
import java.util.Optional;

/**
 * Lower and upper limits on a comparable value. Either limit may be absent ({@code null}), and
 * each is inclusive or exclusive. Violations are reported as {@code min} / {@code max}.
 */
record Bounds<T extends Comparable<? super T>>(T lower, boolean lowerInclusive, T upper, boolean upperInclusive) {

    Bounds {
        if (lower != null && upper != null) {
            int cmp = lower.compareTo(upper);
            if (cmp > 0 || (cmp == 0 && !(lowerInclusive && upperInclusive))) {
                throw new IllegalArgumentException("empty range: lower bound " + lower + " exceeds upper bound " + upper);
            }
        }
    }

    static <T extends Comparable<? super T>> Bounds<T> none() {
        return new Bounds<>(null, true, null, true);
    }

    Bounds<T> withLower(T limit, boolean inclusive) {
        return new Bounds<>(limit, inclusive, upper, upperInclusive);
    }

    Bounds<T> withUpper(T limit, boolean inclusive) {
        return new Bounds<>(lower, lowerInclusive, limit, inclusive);
    }

    Optional<Failure> check(T value) {
        if (lower != null) {
            int cmp = value.compareTo(lower);
            if (cmp < 0 || (cmp == 0 && !lowerInclusive)) {
                String op = lowerInclusive ? "≥" : ">";
                return Optional.of(Failure.of(ErrorCode.MIN, "must be " + op + " " + lower));
            }
        }
        if (upper != null) {
            int cmp = value.compareTo(upper);
            if (cmp > 0 || (cmp == 0 && !upperInclusive)) {
                String op = upperInclusive ? "≤" : "<";
                return Optional.of(Failure.of(ErrorCode.MAX, "must be " + op + " " + upper));
            }
        }
        return Optional.empty();
    }
}
