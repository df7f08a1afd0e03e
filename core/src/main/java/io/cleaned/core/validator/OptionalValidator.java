package io.cleaned.core.validator;

import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import io.cleaned.core.spi.Validator;
import java.util.Objects;
import java.util.Optional;

/**
 * Wraps a validator so that "no value" is accepted and cleaned to {@link Optional#empty()}.
 * Present values are delegated and wrapped in {@link Optional#of}; failures propagate unchanged.
 *
 * <p>An <em>omissible</em> optional (the default) treats both absence and an explicit
 * {@code null} as no value. A non-omissible one accepts only {@code null}: the field must still
 * be present in the input.
 *
 * @param <T> the wrapped validator's type
 */
public final class OptionalValidator<T> implements Validator<Optional<T>> {

    private final Validator<T> inner;
    private final boolean omissible;

    public OptionalValidator(Validator<T> inner, boolean omissible) {
        this.inner = Objects.requireNonNull(inner, "inner validator must not be null");
        this.omissible = omissible;
    }

    /** Returns a copy that still requires the field to be present (possibly {@code null}). */
    public OptionalValidator<T> omissible(boolean omissible) {
        return new OptionalValidator<>(inner, omissible);
    }

    public Validator<T> inner() {
        return inner;
    }

    @Override
    public Result<Optional<T>> validate(Object raw) {
        if (raw == null) {
            return Result.valid(Optional.empty());
        }
        return inner.validate(raw).map(Optional::ofNullable);
    }

    @Override
    public Result<Optional<T>> absent() {
        return omissible ? Result.valid(Optional.empty()) : Result.invalid(Failure.required());
    }
}
