package io.cleaned.core.validator;

import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import java.util.Locale;
import java.util.Optional;

/**
 * Validates booleans. Accepts {@link Boolean}, the strings {@code true/false/1/0} (any case,
 * surrounding whitespace ignored) and the integers {@code 1/0}.
 */
public final class BoolValidator extends ScalarValidator<Boolean> {

    BoolValidator() {}

    @Override
    protected Result<Boolean> convert(Object raw) {
        if (raw instanceof Boolean) {
            return Result.valid((Boolean) raw);
        }
        if (raw instanceof String) {
            switch (((String) raw).strip().toLowerCase(Locale.ROOT)) {
                case "true", "1" -> {
                    return Result.valid(true);
                }
                case "false", "0" -> {
                    return Result.valid(false);
                }
                default -> {
                    return Result.invalid(Failure.typeError("a boolean", raw));
                }
            }
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            long value = ((Number) raw).longValue();
            if (value == 0 || value == 1) {
                return Result.valid(value == 1);
            }
        }
        return Result.invalid(Failure.typeError("a boolean", raw));
    }

    @Override
    protected Optional<Failure> check(Boolean value) {
        return Optional.empty();
    }
}
