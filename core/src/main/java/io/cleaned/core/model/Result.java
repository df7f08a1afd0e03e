package io.cleaned.core.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of validating one raw value. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Valid}: the cleaned value of the validator's declared type.
 * <li>{@link Invalid}: an {@link ErrorNode} describing every failure found in the value.
 * </ul>
 *
 * <p>Validators return results instead of throwing, so containers can keep collecting failures
 * from sibling values.
 *
 * @param <T> the cleaned value type
 */
public sealed interface Result<T> {

    static <T> Result<T> valid(T value) {
        return new Valid<>(value);
    }

    static <T> Result<T> invalid(ErrorNode error) {
        return new Invalid<>(error);
    }

    static <T> Result<T> invalid(Failure failure) {
        return new Invalid<>(ErrorNode.leaf(failure));
    }

    static <T> Result<T> invalid(ErrorCode code, String message) {
        return invalid(Failure.of(code, message));
    }

    boolean isValid();

    /**
     * Returns the cleaned value.
     *
     * @throws IllegalStateException if this result is invalid
     */
    T value();

    /**
     * Returns the failure tree.
     *
     * @throws IllegalStateException if this result is valid
     */
    ErrorNode error();

    /** Transforms the cleaned value; failures pass through unchanged. */
    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    /** A successful result. The value may be {@code null} only for validators that declare it. */
    record Valid<T>(T value) implements Result<T> {

        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public ErrorNode error() {
            throw new IllegalStateException("result is valid");
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Valid<>(mapper.apply(value));
        }

        @Override
        public String toString() {
            return "Valid[" + value + "]";
        }
    }

    /** A failed result. */
    record Invalid<T>(ErrorNode error) implements Result<T> {

        public Invalid {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("result is invalid: " + error.flatten());
        }

        /** Re-types this failure for a different value type. */
        @SuppressWarnings("unchecked")
        public <U> Invalid<U> retype() {
            return (Invalid<U>) this;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return retype();
        }

        @Override
        public String toString() {
            return "Invalid" + error.flatten();
        }
    }
}
