package io.cleaned.core.validator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Collection-shape helpers for the container and defaulting validators. */
final class Containers {

    private Containers() {}

    /**
     * Views a raw value as an ordered sequence: a {@link List}, any other {@link Collection} in
     * iteration order, or an object array. Anything else (strings included) is not a sequence.
     */
    static Optional<List<?>> elements(Object raw) {
        if (raw instanceof List) {
            return Optional.of((List<?>) raw);
        }
        if (raw instanceof Collection) {
            return Optional.of(new ArrayList<>((Collection<?>) raw));
        }
        if (raw instanceof Object[]) {
            return Optional.of(Arrays.asList((Object[]) raw));
        }
        return Optional.empty();
    }

    /**
     * Copies lists, sets and maps, at any depth, into unmodifiable collections that keep iteration
     * order. Other values are returned as they are.
     */
    @SuppressWarnings("unchecked")
    static <T> T freeze(T value) {
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<?>) value) {
                copy.add(freeze(element));
            }
            return (T) Collections.unmodifiableList(copy);
        }
        if (value instanceof Set) {
            Set<Object> copy = new LinkedHashSet<>();
            for (Object element : (Set<?>) value) {
                copy.add(freeze(element));
            }
            return (T) Collections.unmodifiableSet(copy);
        }
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(freeze(entry.getKey()), freeze(entry.getValue()));
            }
            return (T) Collections.unmodifiableMap(copy);
        }
        return value;
    }
}
