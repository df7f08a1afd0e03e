package io.cleaned.core.validator;

import io.cleaned.core.schema.Schema;
import io.cleaned.core.schema.SchemaRef;
import io.cleaned.core.spi.Validator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Factory for the built-in validators. Meant to be imported statically:
 *
 * <pre>{@code
 * SchemaBuilder b = Schema.builder("signup");
 * FieldSpec<String> username = b.field("username", str().pattern("^[a-zA-Z_]+$").minLength(3));
 * FieldSpec<Long> age = b.field("age", integer().min(0));
 * FieldSpec<Optional<String>> bio = b.field("bio", optional(str().multiline(true)));
 * }</pre>
 */
public final class Validators {

    private Validators() {}

    /** Non-blank, stripped, single-line string. */
    public static StrValidator str() {
        return new StrValidator();
    }

    public static IntValidator integer() {
        return new IntValidator();
    }

    public static FloatValidator floating() {
        return new FloatValidator();
    }

    public static BoolValidator bool() {
        return new BoolValidator();
    }

    public static DateValidator date() {
        return new DateValidator();
    }

    public static TimeValidator time() {
        return new TimeValidator();
    }

    public static DateTimeValidator dateTime() {
        return new DateTimeValidator();
    }

    /** Absence and {@code null} clean to {@link Optional#empty()}. */
    public static <T> OptionalValidator<T> optional(Validator<T> inner) {
        return new OptionalValidator<>(inner, true);
    }

    public static <A, B> EitherValidator<A, B> either(Validator<A> first, Validator<B> second) {
        return new EitherValidator<>(first, second);
    }

    @SafeVarargs
    public static <T> AnyOfValidator<T> anyOf(Validator<? extends T>... alternatives) {
        return new AnyOfValidator<>(List.of(alternatives));
    }

    public static <T> ListValidator<T> listOf(Validator<T> element) {
        return new ListValidator<>(element);
    }

    public static <T> SetValidator<T> setOf(Validator<T> element) {
        return new SetValidator<>(element);
    }

    /** Mapping with non-blank string keys. */
    public static <V> MapValidator<String, V> mapOf(Validator<V> value) {
        return new MapValidator<>(str(), value);
    }

    public static <K, V> MapValidator<K, V> mapOf(Validator<K> key, Validator<V> value) {
        return new MapValidator<>(key, value);
    }

    public static <E extends Enum<E>> EnumValidator<E> enumOf(Class<E> type) {
        return new EnumValidator<>(type);
    }

    public static NestedValidator nested(Schema schema) {
        return new NestedValidator(SchemaRef.of(schema));
    }

    /** Nested record whose schema is resolved on first use, e.g. {@code builder.self()}. */
    public static NestedValidator nested(SchemaRef schema) {
        return new NestedValidator(schema);
    }

    /** Nested record whose schema is declared later; {@code supplier} may return null until then. */
    public static NestedValidator nested(String name, Supplier<Schema> supplier) {
        return new NestedValidator(SchemaRef.lazy(name, supplier));
    }

    public static TaggedUnionValidator taggedUnion(String tagField) {
        return new TaggedUnionValidator(tagField);
    }
}
