package io.cleaned.core.schema;

import io.cleaned.core.spi.Validator;
import java.util.Objects;

/**
 * One declared field of a {@link Schema}, returned by {@link SchemaBuilder#field}. Also serves
 * as the typed handle for reading the field from a {@link Cleaned} record:
 *
 * <pre>{@code
 * FieldSpec<Long> age = builder.field("age", Validators.integer());
 * ...
 * long years = cleaned.get(age);
 * }</pre>
 *
 * @param name        the field name, unique within its schema
 * @param validator   the validator governing the field
 * @param index       zero-based declaration position
 * @param label       optional display label, empty if none
 * @param description optional free-text description, empty if none
 * @param <T>         the cleaned type of the field
 */
public record FieldSpec<T>(String name, Validator<T> validator, int index, String label, String description) {

    public FieldSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(validator, "validator must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("field name must not be empty");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
        label = label == null ? "" : label;
        description = description == null ? "" : description;
    }

    /** Returns a copy placed at a different declaration position. */
    FieldSpec<T> withIndex(int newIndex) {
        return new FieldSpec<>(name, validator, newIndex, label, description);
    }
}
