package io.cleaned.core.schema;

import io.cleaned.core.model.Either;
import io.cleaned.core.model.Variant;
import io.cleaned.core.spi.EnumValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Converts cleaned values back to the plain shapes validators accept as raw input. */
final class PlainValues {

    private PlainValues() {}

    static Object toPlain(Object value) {
        if (value instanceof Cleaned) {
            return ((Cleaned) value).toMap();
        }
        if (value instanceof Optional) {
            return toPlain(((Optional<?>) value).orElse(null));
        }
        if (value instanceof Either) {
            return toPlain(((Either<?, ?>) value).value());
        }
        if (value instanceof Variant) {
            return toPlain(((Variant<?>) value).value());
        }
        if (value instanceof EnumValue) {
            return ((EnumValue) value).value();
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        if (value instanceof Map) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                map.put(toPlain(entry.getKey()), toPlain(entry.getValue()));
            }
            return map;
        }
        if (value instanceof Collection) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                list.add(toPlain(element));
            }
            return list;
        }
        return value;
    }
}
