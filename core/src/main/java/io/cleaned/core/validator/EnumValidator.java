package io.cleaned.core.validator;

import io.cleaned.core.model.ErrorCode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import io.cleaned.core.spi.EnumValue;
import io.cleaned.core.spi.Validator;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Accepts one member of an enum: the constant itself, its name, or, for enums implementing
 * {@link EnumValue}, its underlying value. Numbers are compared by numeric value, so {@code 1}
 * and {@code 1L} select the same constant. Anything else fails with {@code invalid_choice}.
 *
 * @param <E> the enum type
 */
public final class EnumValidator<E extends Enum<E>> implements Validator<E> {

    private final Class<E> type;
    private final E[] constants;
    private final String permitted;

    public EnumValidator(Class<E> type) {
        this.type = Objects.requireNonNull(type, "enum type must not be null");
        this.constants = type.getEnumConstants();
        List<String> names = new ArrayList<>(constants.length);
        for (E constant : constants) {
            names.add(constant instanceof EnumValue ? String.valueOf(((EnumValue) constant).value()) : constant.name());
        }
        this.permitted = names.toString();
    }

    @Override
    public Result<E> validate(Object raw) {
        if (type.isInstance(raw)) {
            return Result.valid(type.cast(raw));
        }
        if (raw != null) {
            for (E constant : constants) {
                if (constant instanceof EnumValue && sameValue(((EnumValue) constant).value(), raw)) {
                    return Result.valid(constant);
                }
            }
            if (raw instanceof String) {
                for (E constant : constants) {
                    if (constant.name().equals(raw)) {
                        return Result.valid(constant);
                    }
                }
            }
        }
        return Result.invalid(Failure.of(ErrorCode.INVALID_CHOICE, "must be one of " + permitted));
    }

    private static boolean sameValue(Object declared, Object raw) {
        if (declared instanceof Number && raw instanceof Number) {
            try {
                return new BigDecimal(declared.toString()).compareTo(new BigDecimal(raw.toString())) == 0;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return Objects.equals(declared, raw);
    }
}
