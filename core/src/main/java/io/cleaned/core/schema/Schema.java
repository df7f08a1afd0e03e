package io.cleaned.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.cleaned.core.error.ValidationError;
import io.cleaned.core.json.JsonValues;
import io.cleaned.core.model.ErrorNode;
import io.cleaned.core.model.PathSegment;
import io.cleaned.core.model.Result;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered set of named fields, each governed by a validator. {@link #validate} turns a raw
 * mapping into a {@link Cleaned} record or throws one {@link ValidationError} that lists the
 * failures of every field.
 *
 * <p>Every field is validated, in declaration order, even after an earlier field has failed.
 * Keys of the raw mapping that are not declared fields are ignored.
 *
 * <p>Thread-safe and immutable: one schema instance can serve any number of concurrent
 * {@code validate} calls.
 */
public final class Schema {

    private static final Logger LOG = LoggerFactory.getLogger(Schema.class);

    private final String name;
    private final List<FieldSpec<?>> fields;
    private final Map<String, FieldSpec<?>> byName;

    Schema(String name, List<FieldSpec<?>> fields) {
        this.name = name;
        this.fields = List.copyOf(fields);
        Map<String, FieldSpec<?>> index = new LinkedHashMap<>();
        for (FieldSpec<?> field : this.fields) {
            index.put(field.name(), field);
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    public static SchemaBuilder builder(String name) {
        return new SchemaBuilder(name);
    }

    public String name() {
        return name;
    }

    /** Declared fields in declaration order. */
    public List<FieldSpec<?>> fields() {
        return fields;
    }

    public Optional<FieldSpec<?>> field(String fieldName) {
        return Optional.ofNullable(byName.get(fieldName));
    }

    /**
     * Validates every field of {@code raw}.
     *
     * @param raw field name to raw value; must not be {@code null}
     * @return the cleaned record
     * @throws ValidationError if any field is invalid; it reports every invalid field
     */
    public Cleaned validate(Map<String, ?> raw) {
        Result<Cleaned> result = tryValidate(raw);
        if (result.isValid()) {
            LOG.trace("validation.passed: schema={}", name);
            return result.value();
        }
        ValidationError error = new ValidationError(name, (ErrorNode.Branch) result.error());
        LOG.debug(
                "validation.failed: schema={}, fields={}, violations={}",
                name,
                error.fields(),
                error.violations().size());
        throw error;
    }

    /**
     * Validates a Jackson object tree.
     *
     * @throws IllegalArgumentException if {@code raw} is not a JSON object
     * @throws ValidationError          if any field is invalid
     */
    public Cleaned validate(JsonNode raw) {
        Objects.requireNonNull(raw, "raw input must not be null");
        if (!raw.isObject()) {
            throw new IllegalArgumentException("Schema '" + name + "' expects a JSON object, got: " + raw.getNodeType());
        }
        return validate(JsonValues.toRawMap(raw));
    }

    /**
     * Validates every field of {@code raw} without throwing for invalid data. An invalid result
     * always carries an {@link ErrorNode.Branch} keyed by field name.
     */
    public Result<Cleaned> tryValidate(Map<?, ?> raw) {
        Objects.requireNonNull(raw, "raw input must not be null");
        Object[] values = new Object[fields.size()];
        ErrorNode.Builder errors = ErrorNode.branch();
        for (FieldSpec<?> field : fields) {
            Result<?> result = raw.containsKey(field.name())
                    ? field.validator().validate(raw.get(field.name()))
                    : field.validator().absent();
            if (result.isValid()) {
                values[field.index()] = result.value();
            } else {
                errors.put(PathSegment.name(field.name()), result.error());
            }
        }
        if (!errors.isEmpty()) {
            return Result.invalid(errors.build());
        }
        return Result.valid(new Cleaned(name, fields, values));
    }

    @Override
    public String toString() {
        return "Schema[" + name + ", fields=" + byName.keySet() + "]";
    }
}
