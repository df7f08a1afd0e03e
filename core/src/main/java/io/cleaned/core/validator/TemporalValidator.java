package io.cleaned.core.validator;

import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Base for {@code java.time} validators: accepts the target type, a few convertible types, and
 * ISO-8601 strings. Inclusive {@code min} / {@code max} bounds.
 *
 * @param <T> the cleaned temporal type
 * @param <V> the concrete validator type, returned by the configuration methods
 */
public abstract class TemporalValidator<T extends Comparable<? super T>, V extends TemporalValidator<T, V>>
        extends ScalarValidator<T> {

    private final Bounds<T> bounds;
    private final String expected;

    TemporalValidator(Bounds<T> bounds, String expected) {
        this.bounds = bounds;
        this.expected = expected;
    }

    public V min(T min) {
        return withBounds(bounds.withLower(min, true));
    }

    public V max(T max) {
        return withBounds(bounds.withUpper(max, true));
    }

    abstract V withBounds(Bounds<T> bounds);

    /** Converts a non-string raw value, or returns empty if its type is not accepted. */
    abstract Optional<T> fromObject(Object raw);

    abstract T parse(String text);

    @Override
    protected final Result<T> convert(Object raw) {
        if (raw instanceof String) {
            try {
                return Result.valid(parse(((String) raw).strip()));
            } catch (DateTimeParseException e) {
                return Result.invalid(Failure.typeError(expected, raw));
            }
        }
        Optional<T> value = raw == null ? Optional.empty() : fromObject(raw);
        return value.isPresent() ? Result.valid(value.get()) : Result.invalid(Failure.typeError(expected, raw));
    }

    /**
     * Reads a number as seconds since the Unix epoch, fractions included, at UTC. Empty for
     * non-numbers, non-finite values and instants outside the supported range.
     */
    static Optional<LocalDateTime> fromEpochSeconds(Object raw) {
        if (!(raw instanceof Number)) {
            return Optional.empty();
        }
        try {
            BigDecimal seconds = raw instanceof BigDecimal ? (BigDecimal) raw : new BigDecimal(raw.toString());
            BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
            int nanos = seconds.subtract(whole).movePointRight(9).intValue();
            Instant instant = Instant.ofEpochSecond(whole.longValueExact(), nanos);
            return Optional.of(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
        } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
            return Optional.empty();
        }
    }

    @Override
    protected final Optional<Failure> check(T value) {
        return bounds.check(value);
    }
}
