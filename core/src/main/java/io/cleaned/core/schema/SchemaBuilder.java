package io.cleaned.core.schema;

import io.cleaned.core.error.SchemaDefinitionException;
import io.cleaned.core.spi.Validator;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Registers the fields of a {@link Schema} in declaration order. Each {@link #field} call returns
 * the typed handle used to read that field from cleaned records.
 *
 * <pre>{@code
 * SchemaBuilder b = Schema.builder("category");
 * FieldSpec<String> name = b.field("name", Validators.str());
 * FieldSpec<List<Cleaned>> children = b.field("children", Validators.listOf(Validators.nested(b.self())));
 * Schema category = b.build();
 * }</pre>
 *
 * <p>Not thread-safe. A builder builds exactly one schema; no field can be added afterwards.
 */
public final class SchemaBuilder {

    private final String name;
    private final List<FieldSpec<?>> fields = new ArrayList<>();
    private final Set<String> names = new HashSet<>();
    private final SchemaRef self;
    private volatile Schema built;

    SchemaBuilder(String name) {
        Objects.requireNonNull(name, "schema name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("schema name must not be empty");
        }
        this.name = name;
        this.self = SchemaRef.lazy(name, () -> built);
    }

    public String name() {
        return name;
    }

    /**
     * Declares a field.
     *
     * @throws SchemaDefinitionException if the name is already declared or the schema is built
     */
    public <T> FieldSpec<T> field(String fieldName, Validator<T> validator) {
        return field(fieldName, validator, null, null);
    }

    /** Declares a field with a display label and a description. */
    public <T> FieldSpec<T> field(String fieldName, Validator<T> validator, String label, String description) {
        requireOpen();
        Objects.requireNonNull(fieldName, "field name must not be null");
        if (!names.add(fieldName)) {
            throw new SchemaDefinitionException("Duplicate field '" + fieldName + "' in schema '" + name + "'", name);
        }
        FieldSpec<T> spec = new FieldSpec<>(fieldName, validator, fields.size(), label, description);
        fields.add(spec);
        return spec;
    }

    /**
     * Copies every field of {@code parent}, in its order, at the current position. Handles
     * obtained from the parent's builder stay valid for records of the new schema.
     *
     * @throws SchemaDefinitionException if an inherited name is already declared here
     */
    public SchemaBuilder extend(Schema parent) {
        requireOpen();
        Objects.requireNonNull(parent, "parent schema must not be null");
        for (FieldSpec<?> field : parent.fields()) {
            if (!names.add(field.name())) {
                throw new SchemaDefinitionException(
                        "Field '" + field.name() + "' inherited from '" + parent.name() + "' is already declared in '"
                                + name + "'",
                        name);
            }
            fields.add(field.withIndex(fields.size()));
        }
        return this;
    }

    /** A lazy handle to the schema this builder will produce, for self-referential fields. */
    public SchemaRef self() {
        return self;
    }

    /** @throws SchemaDefinitionException if already built */
    public Schema build() {
        requireOpen();
        built = new Schema(name, fields);
        return built;
    }

    private void requireOpen() {
        if (built != null) {
            throw new SchemaDefinitionException("Schema '" + name + "' is already built", name);
        }
    }
}
