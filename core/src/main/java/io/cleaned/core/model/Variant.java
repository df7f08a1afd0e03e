package io.cleaned.core.model;

/**
 * Cleaned value of an n-way union over a common supertype.
 *
 * @param index zero-based position of the alternative that matched
 * @param value the value that alternative produced
 * @param <T>   the common supertype of all alternatives
 */
public record Variant<T>(int index, T value) {

    public Variant {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
    }
}
