package io.cleaned.core.schema;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * The immutable result of a successful {@link Schema#validate} call. Each field holds the value
 * its validator produced, typed as the validator declares it; read it through the field's
 * {@link FieldSpec} handle for static typing, or by name.
 *
 * <p>Values are the validators' own unmodifiable copies, independent of the raw input.
 */
public final class Cleaned {

    private final String schemaName;
    private final List<FieldSpec<?>> fields;
    private final Object[] values;

    Cleaned(String schemaName, List<FieldSpec<?>> fields, Object[] values) {
        this.schemaName = schemaName;
        this.fields = fields;
        this.values = values.clone();
    }

    /** Name of the schema that produced this record. */
    public String schemaName() {
        return schemaName;
    }

    /**
     * Returns the cleaned value of {@code field}.
     *
     * @throws IllegalArgumentException if the field is not declared by this record's schema
     */
    @SuppressWarnings("unchecked")
    public <T> T get(FieldSpec<T> field) {
        Objects.requireNonNull(field, "field must not be null");
        FieldSpec<?> own = lookup(field.name());
        if (own == null || own.validator() != field.validator()) {
            throw new IllegalArgumentException(
                    "Field '" + field.name() + "' does not belong to schema '" + schemaName + "'");
        }
        return (T) values[own.index()];
    }

    /**
     * Returns the cleaned value of the named field.
     *
     * @throws IllegalArgumentException if no such field is declared
     */
    public Object get(String fieldName) {
        FieldSpec<?> own = lookup(fieldName);
        if (own == null) {
            throw new IllegalArgumentException("Schema '" + schemaName + "' has no field '" + fieldName + "'");
        }
        return values[own.index()];
    }

    public boolean has(String fieldName) {
        return lookup(fieldName) != null;
    }

    /**
     * Serializes this record to plain values: nested records become maps, {@code Optional} and
     * union values are unwrapped, enums become their name (or {@code EnumValue#value()}), sets
     * become lists. Validating the result with the same schema reproduces an equal record.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (FieldSpec<?> field : fields) {
            map.put(field.name(), PlainValues.toPlain(values[field.index()]));
        }
        return Collections.unmodifiableMap(map);
    }

    private FieldSpec<?> lookup(String fieldName) {
        for (FieldSpec<?> field : fields) {
            if (field.name().equals(fieldName)) {
                return field;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cleaned)) {
            return false;
        }
        Cleaned other = (Cleaned) o;
        return schemaName.equals(other.schemaName) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * schemaName.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", schemaName + "{", "}");
        for (FieldSpec<?> field : fields) {
            joiner.add(field.name() + "=" + values[field.index()]);
        }
        return joiner.toString();
    }
}
