package io.cleaned.core.model;

import java.util.Objects;

/**
 * One step of a {@link FieldPath}: a schema field name, a list position, a mapping key, or the
 * key of a mapping entry itself.
 *
 * <p>Sealed so that renderers can handle every variant. Thread-safe and immutable.
 */
public sealed interface PathSegment {

    /**
     * Appends this segment to a rendered path. Names are dot-separated, indices and keys are
     * bracketed: {@code items[2].tags[primary]}. A failed key renders with a {@code :key} suffix,
     * {@code tags[ primary:key]}, so it never shares an address with the value under that key.
     */
    void appendTo(StringBuilder path);

    static PathSegment name(String name) {
        return new Name(name);
    }

    static PathSegment index(int index) {
        return new Index(index);
    }

    static PathSegment key(Object key) {
        return new Key(String.valueOf(key));
    }

    static PathSegment keyOf(Object rawKey) {
        return new KeyOf(String.valueOf(rawKey));
    }

    /** A declared field of a schema. */
    record Name(String name) implements PathSegment {
        public Name {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public void appendTo(StringBuilder path) {
            if (path.length() > 0) {
                path.append('.');
            }
            path.append(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** A zero-based position in a sequence. */
    record Index(int index) implements PathSegment {
        public Index {
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative, got: " + index);
            }
        }

        @Override
        public void appendTo(StringBuilder path) {
            path.append('[').append(index).append(']');
        }

        @Override
        public String toString() {
            return "[" + index + "]";
        }
    }

    /** A cleaned mapping key, in its string form. */
    record Key(String key) implements PathSegment {
        public Key {
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public void appendTo(StringBuilder path) {
            path.append('[').append(key).append(']');
        }

        @Override
        public String toString() {
            return "[" + key + "]";
        }
    }

    /** The raw key of a mapping entry, addressing a failure of the key rather than its value. */
    record KeyOf(String key) implements PathSegment {
        public KeyOf {
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public void appendTo(StringBuilder path) {
            path.append('[').append(key).append(":key]");
        }

        @Override
        public String toString() {
            return "[" + key + ":key]";
        }
    }
}
