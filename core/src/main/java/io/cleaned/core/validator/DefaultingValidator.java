package io.cleaned.core.validator;

import io.cleaned.core.model.Result;
import io.cleaned.core.spi.Validator;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Supplies a default when the field is absent from the input. Present values, including an
 * explicit {@code null}, are delegated unchanged.
 *
 * <p>A list, set or map default is copied into unmodifiable collections on every use, so records
 * never share a mutable default.
 *
 * @param <T> the cleaned value type
 */
public final class DefaultingValidator<T> implements Validator<T> {

    private final Validator<T> inner;
    private final Supplier<? extends T> defaultValue;

    public DefaultingValidator(Validator<T> inner, Supplier<? extends T> defaultValue) {
        this.inner = Objects.requireNonNull(inner, "inner validator must not be null");
        this.defaultValue = Objects.requireNonNull(defaultValue, "default supplier must not be null");
    }

    @Override
    public Result<T> validate(Object raw) {
        return inner.validate(raw);
    }

    @Override
    public Result<T> absent() {
        return Result.valid(Containers.freeze(defaultValue.get()));
    }
}
