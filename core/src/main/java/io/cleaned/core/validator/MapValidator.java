package io.cleaned.core.validator;

import io.cleaned.core.model.ErrorCode;
import io.cleaned.core.model.ErrorNode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.model.PathSegment;
import io.cleaned.core.model.Result;
import io.cleaned.core.spi.Validator;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a mapping entry by entry, keys and values each with their own validator.
 *
 * <p>Failures are addressed as follows:
 *
 * <ul>
 * <li>an invalid key is reported under the raw key with a {@code :key} suffix
 * ({@code field[x:key]}); its value is not examined further;
 * <li>an invalid value is reported under the cleaned key ({@code field[key]});
 * <li>a raw key that cleans to a key already seen fails with {@code duplicate_key} under its own
 * raw key ({@code field[ key:key]}), leaving any failure of the first entry's value in place.
 * </ul>
 *
 * <p>The cleaned map keeps the input's iteration order.
 *
 * @param <K> the cleaned key type
 * @param <V> the cleaned value type
 */
public final class MapValidator<K, V> implements Validator<Map<K, V>> {

    private final Validator<K> key;
    private final Validator<V> value;
    private final Integer minLength;
    private final Integer maxLength;

    public MapValidator(Validator<K> key, Validator<V> value) {
        this(key, value, null, null);
    }

    private MapValidator(Validator<K> key, Validator<V> value, Integer minLength, Integer maxLength) {
        Checks.requireLengthRange(minLength, maxLength);
        this.key = Objects.requireNonNull(key, "key validator must not be null");
        this.value = Objects.requireNonNull(value, "value validator must not be null");
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    public MapValidator<K, V> minLength(int min) {
        return new MapValidator<>(key, value, min, maxLength);
    }

    public MapValidator<K, V> maxLength(int max) {
        return new MapValidator<>(key, value, minLength, max);
    }

    @Override
    public Result<Map<K, V>> validate(Object raw) {
        if (!(raw instanceof Map)) {
            return Result.invalid(Failure.typeError("a mapping", raw));
        }
        Map<?, ?> entries = (Map<?, ?>) raw;
        Optional<Failure> count = Checks.length(entries.size(), minLength, maxLength, "entry count");
        if (count.isPresent()) {
            return Result.invalid(count.get());
        }

        Map<K, V> cleaned = new LinkedHashMap<>();
        Set<K> seen = new HashSet<>();
        ErrorNode.Builder errors = ErrorNode.branch();
        int position = 0;
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            int index = position++;
            Result<K> keyResult = key.validate(entry.getKey());
            if (!keyResult.isValid()) {
                errors.put(keySegment(errors, entry.getKey(), index), keyResult.error());
                continue;
            }
            K cleanedKey = keyResult.value();
            if (!seen.add(cleanedKey)) {
                errors.put(
                        keySegment(errors, entry.getKey(), index),
                        Failure.of(ErrorCode.DUPLICATE_KEY, "duplicate key '" + cleanedKey + "' after cleaning"));
                continue;
            }
            Result<V> valueResult = value.validate(entry.getValue());
            if (valueResult.isValid()) {
                cleaned.put(cleanedKey, valueResult.value());
            } else {
                errors.put(PathSegment.key(cleanedKey), valueResult.error());
            }
        }
        if (!errors.isEmpty()) {
            return Result.invalid(errors.build());
        }
        return Result.valid(Collections.unmodifiableMap(cleaned));
    }

    /** Distinct raw keys with the same string form ({@code 1} and {@code "1"}) are told apart by position. */
    private static PathSegment keySegment(ErrorNode.Builder errors, Object rawKey, int index) {
        PathSegment segment = PathSegment.keyOf(rawKey);
        return errors.contains(segment) ? PathSegment.keyOf(rawKey + "#" + index) : segment;
    }
}
