package io.cleaned.core.validator;

import io.cleaned.core.model.ErrorNode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.model.PathSegment;
import io.cleaned.core.model.Result;
import io.cleaned.core.spi.Validator;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a sequence into an insertion-ordered set. Elements equal after cleaning collapse into
 * one. Element failures are reported under the raw position; size limits apply to the cleaned set.
 *
 * @param <T> the element type
 */
public final class SetValidator<T> implements Validator<Set<T>> {

    private final Validator<T> element;
    private final Integer minLength;
    private final Integer maxLength;

    public SetValidator(Validator<T> element) {
        this(element, null, null);
    }

    private SetValidator(Validator<T> element, Integer minLength, Integer maxLength) {
        Checks.requireLengthRange(minLength, maxLength);
        this.element = Objects.requireNonNull(element, "element validator must not be null");
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    public SetValidator<T> minLength(int min) {
        return new SetValidator<>(element, min, maxLength);
    }

    public SetValidator<T> maxLength(int max) {
        return new SetValidator<>(element, minLength, max);
    }

    @Override
    public Result<Set<T>> validate(Object raw) {
        Optional<List<?>> elements = Containers.elements(raw);
        if (elements.isEmpty()) {
            return Result.invalid(Failure.typeError("a set", raw));
        }
        List<?> items = elements.get();
        Set<T> cleaned = new LinkedHashSet<>();
        ErrorNode.Builder errors = ErrorNode.branch();
        for (int i = 0; i < items.size(); i++) {
            Result<T> result = element.validate(items.get(i));
            if (result.isValid()) {
                cleaned.add(result.value());
            } else {
                errors.put(PathSegment.index(i), result.error());
            }
        }
        if (!errors.isEmpty()) {
            return Result.invalid(errors.build());
        }
        Optional<Failure> count = Checks.length(cleaned.size(), minLength, maxLength, "item count");
        if (count.isPresent()) {
            return Result.invalid(count.get());
        }
        return Result.valid(Collections.unmodifiableSet(cleaned));
    }
}
