package io.cleaned.core.spi;

import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import io.cleaned.core.validator.DefaultingValidator;
import io.cleaned.core.validator.OptionalValidator;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Checks and converts one raw value into a cleaned value of type {@code T}.
 *
 * <p>Implementations hold only immutable configuration fixed at construction time and MUST be
 * thread-safe: a validator is shared by every {@code validate} call of the schema that declares
 * it. Invalid input is reported through {@link Result.Invalid}, never by throwing; an exception
 * escaping {@link #validate} is treated as a programming error.
 *
 * @param <T> the logical type of the cleaned value
 */
public interface Validator<T> {

    /**
     * Validates a present raw value, which may be {@code null} when the input explicitly holds
     * a null.
     *
     * @param raw the raw input value
     * @return the cleaned value, or the failures found in {@code raw}
     */
    Result<T> validate(Object raw);

    /**
     * Called instead of {@link #validate} when the input has no entry for the field. Fails with
     * {@code required} unless the validator declares a meaning for absence.
     */
    default Result<T> absent() {
        return Result.invalid(Failure.required());
    }

    /** Accepts absence and {@code null} as "no value". */
    default Validator<Optional<T>> optional() {
        return new OptionalValidator<>(this, true);
    }

    /** Uses {@code value} when the input has no entry for the field. */
    default Validator<T> withDefault(T value) {
        return new DefaultingValidator<>(this, () -> value);
    }

    /** Uses a fresh value from {@code supplier} when the input has no entry for the field. */
    default Validator<T> withDefault(Supplier<? extends T> supplier) {
        return new DefaultingValidator<>(this, supplier);
    }
}
