package io.cleaned.core.validator;

import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;

/**
 * Validates integers, cleaned to {@link Long}.
 *
 * <p>Accepts integral Java numbers, floating-point numbers with no fractional part, and decimal
 * strings such as {@code "20"} (surrounding whitespace ignored). Booleans, fractional numbers and
 * values outside the 64-bit range are a {@code type_error}. Constraints: bounds, then choices.
 *
 * <p>Immutable: every configuration method returns a new validator.
 */
public final class IntValidator extends ScalarValidator<Long> {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final Bounds<Long> bounds;
    private final Set<Long> choices;

    IntValidator() {
        this(Bounds.none(), null);
    }

    private IntValidator(Bounds<Long> bounds, Set<Long> choices) {
        this.bounds = bounds;
        this.choices = choices;
    }

    /** Inclusive lower bound. */
    public IntValidator min(long min) {
        return new IntValidator(bounds.withLower(min, true), choices);
    }

    /** Inclusive upper bound. */
    public IntValidator max(long max) {
        return new IntValidator(bounds.withUpper(max, true), choices);
    }

    /** Exclusive lower bound. */
    public IntValidator greaterThan(long limit) {
        return new IntValidator(bounds.withLower(limit, false), choices);
    }

    /** Exclusive upper bound. */
    public IntValidator lessThan(long limit) {
        return new IntValidator(bounds.withUpper(limit, false), choices);
    }

    public IntValidator oneOf(Long... values) {
        return new IntValidator(bounds, Checks.choices(values));
    }

    @Override
    protected Result<Long> convert(Object raw) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return Result.valid(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger) {
            return fromBigInteger((BigInteger) raw, raw);
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Result.invalid(Failure.typeError("an integer", raw));
            }
            return fromBigDecimal(BigDecimal.valueOf(d), raw);
        }
        if (raw instanceof BigDecimal) {
            return fromBigDecimal((BigDecimal) raw, raw);
        }
        if (raw instanceof String) {
            String text = ((String) raw).strip();
            try {
                return Result.valid(Long.parseLong(text));
            } catch (NumberFormatException e) {
                return Result.invalid(Failure.typeError("an integer", raw));
            }
        }
        return Result.invalid(Failure.typeError("an integer", raw));
    }

    @Override
    protected Optional<Failure> check(Long value) {
        Optional<Failure> bound = bounds.check(value);
        return bound.isPresent() ? bound : Checks.choice(value, choices);
    }

    private static Result<Long> fromBigDecimal(BigDecimal decimal, Object raw) {
        if (decimal.signum() != 0 && decimal.stripTrailingZeros().scale() > 0) {
            return Result.invalid(Failure.typeError("an integer", raw));
        }
        return fromBigInteger(decimal.toBigInteger(), raw);
    }

    private static Result<Long> fromBigInteger(BigInteger value, Object raw) {
        if (value.compareTo(LONG_MIN) < 0 || value.compareTo(LONG_MAX) > 0) {
            return Result.invalid(Failure.typeError("a 64-bit integer", raw));
        }
        return Result.valid(value.longValue());
    }
}
