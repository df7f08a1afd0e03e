package io.cleaned.core.validator;

import io.cleaned.core.model.ErrorCode;
import io.cleaned.core.model.ErrorNode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.model.PathSegment;
import io.cleaned.core.model.Result;
import io.cleaned.core.schema.Cleaned;
import io.cleaned.core.schema.Schema;
import io.cleaned.core.schema.SchemaRef;
import io.cleaned.core.spi.Validator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Chooses the schema of a nested record from a discriminator field, e.g. {@code "kind"}:
 *
 * <pre>{@code
 * Validators.taggedUnion("kind")
 *         .variant("circle", circleSchema)
 *         .variant("square", squareSchema);
 * }</pre>
 *
 * <p>A missing tag fails with {@code required} and an unknown one with {@code invalid_choice},
 * both reported under the tag field. The chosen schema sees the whole mapping, tag included.
 */
public final class TaggedUnionValidator implements Validator<Cleaned> {

    private final String tagField;
    private final Map<String, SchemaRef> variants;

    public TaggedUnionValidator(String tagField) {
        this(tagField, Map.of());
    }

    private TaggedUnionValidator(String tagField, Map<String, SchemaRef> variants) {
        this.tagField = Objects.requireNonNull(tagField, "tag field must not be null");
        this.variants = variants;
    }

    /**
     * Returns a copy that maps {@code tag} to {@code schema}.
     *
     * @throws IllegalArgumentException if the tag is already mapped
     */
    public TaggedUnionValidator variant(String tag, SchemaRef schema) {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        if (variants.containsKey(tag)) {
            throw new IllegalArgumentException("Tag '" + tag + "' is already mapped to " + variants.get(tag));
        }
        Map<String, SchemaRef> next = new LinkedHashMap<>(variants);
        next.put(tag, schema);
        return new TaggedUnionValidator(tagField, Collections.unmodifiableMap(next));
    }

    public TaggedUnionValidator variant(String tag, Schema schema) {
        return variant(tag, SchemaRef.of(schema));
    }

    @Override
    public Result<Cleaned> validate(Object raw) {
        Object value = raw instanceof Cleaned ? ((Cleaned) raw).toMap() : raw;
        if (!(value instanceof Map)) {
            return Result.invalid(Failure.typeError("a mapping", raw));
        }
        Map<?, ?> map = (Map<?, ?>) value;
        PathSegment tagSegment = PathSegment.name(tagField);
        if (!map.containsKey(tagField)) {
            return Result.invalid(ErrorNode.branch().put(tagSegment, Failure.required()).build());
        }
        Object tag = map.get(tagField);
        SchemaRef target = tag instanceof String ? variants.get(tag) : null;
        if (target == null) {
            Failure failure = Failure.of(ErrorCode.INVALID_CHOICE, "must be one of " + variants.keySet());
            return Result.invalid(ErrorNode.branch().put(tagSegment, failure).build());
        }
        return target.resolve().tryValidate(map);
    }
}
