package io.cleaned.core.validator;

import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;

/**
 * Validates finite floating-point numbers, cleaned to {@link Double}. Accepts any Java number
 * except {@link Boolean}, and decimal strings with an optional exponent ({@code "-1.5e3"}); Java
 * literal forms such as {@code "20f"} or {@code "0x1p3"} are not numbers here. NaN and infinities
 * are a {@code type_error}.
 * Constraints: bounds, then choices.
 *
 * <p>Immutable: every configuration method returns a new validator.
 */
public final class FloatValidator extends ScalarValidator<Double> {

    private final Bounds<Double> bounds;
    private final Set<Double> choices;

    FloatValidator() {
        this(Bounds.none(), null);
    }

    private FloatValidator(Bounds<Double> bounds, Set<Double> choices) {
        this.bounds = bounds;
        this.choices = choices;
    }

    public FloatValidator min(double min) {
        return new FloatValidator(bounds.withLower(min, true), choices);
    }

    public FloatValidator max(double max) {
        return new FloatValidator(bounds.withUpper(max, true), choices);
    }

    public FloatValidator greaterThan(double limit) {
        return new FloatValidator(bounds.withLower(limit, false), choices);
    }

    public FloatValidator lessThan(double limit) {
        return new FloatValidator(bounds.withUpper(limit, false), choices);
    }

    public FloatValidator oneOf(Double... values) {
        return new FloatValidator(bounds, Checks.choices(values));
    }

    @Override
    protected Result<Double> convert(Object raw) {
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            try {
                value = new BigDecimal(((String) raw).strip()).doubleValue();
            } catch (NumberFormatException e) {
                return Result.invalid(Failure.typeError("a number", raw));
            }
        } else {
            return Result.invalid(Failure.typeError("a number", raw));
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Result.invalid(Failure.typeError("a finite number", raw));
        }
        return Result.valid(value);
    }

    @Override
    protected Optional<Failure> check(Double value) {
        Optional<Failure> bound = bounds.check(value);
        return bound.isPresent() ? bound : Checks.choice(value, choices);
    }
}
