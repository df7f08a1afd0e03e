package io.cleaned.core.validator;

import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import io.cleaned.core.schema.Cleaned;
import io.cleaned.core.schema.Schema;
import io.cleaned.core.schema.SchemaRef;
import io.cleaned.core.spi.Validator;
import java.util.Map;
import java.util.Objects;

/**
 * Validates a nested record against another schema. The raw value must be a mapping, or an
 * already cleaned record (validated again through its {@link Cleaned#toMap() map form}). The inner
 * schema's failures are kept as a subtree under this field rather than flattened.
 *
 * <p>The schema is reached through a {@link SchemaRef}, resolved on first use, so a schema may
 * nest itself or a schema built later.
 */
public final class NestedValidator implements Validator<Cleaned> {

    private final SchemaRef schema;

    public NestedValidator(SchemaRef schema) {
        this.schema = Objects.requireNonNull(schema, "schema reference must not be null");
    }

    public SchemaRef schema() {
        return schema;
    }

    @Override
    public Result<Cleaned> validate(Object raw) {
        Object value = raw instanceof Cleaned ? ((Cleaned) raw).toMap() : raw;
        if (!(value instanceof Map)) {
            return Result.invalid(Failure.typeError("a mapping", raw));
        }
        Schema target = schema.resolve();
        return target.tryValidate((Map<?, ?>) value);
    }
}
