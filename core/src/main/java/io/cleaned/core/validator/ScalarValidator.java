package io.cleaned.core.validator;

import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import io.cleaned.core.spi.Validator;
import java.util.Optional;

/**
 * Base for validators of single primitive values. Validation runs in two stages: {@link #convert}
 * checks the raw value's kind and normalizes it, then {@link #check} applies the configured
 * constraints in a fixed order and reports the first one that fails. No constraint is checked
 * when conversion fails.
 *
 * @param <T> the cleaned value type
 */
public abstract class ScalarValidator<T> implements Validator<T> {

    @Override
    public final Result<T> validate(Object raw) {
        Result<T> converted = convert(raw);
        if (!converted.isValid()) {
            return converted;
        }
        Optional<Failure> failure = check(converted.value());
        return failure.isPresent() ? Result.invalid(failure.get()) : converted;
    }

    /**
     * Converts a raw value to {@code T}, failing with {@code type_error} if it is of the wrong
     * kind.
     */
    protected abstract Result<T> convert(Object raw);

    /** Returns the first violated constraint, or empty if {@code value} satisfies all of them. */
    protected abstract Optional<Failure> check(T value);
}
