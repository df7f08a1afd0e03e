package io.cleaned.core.validator;

import io.cleaned.core.model.ErrorNode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.model.PathSegment;
import io.cleaned.core.model.Result;
import io.cleaned.core.spi.Validator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates a sequence element by element with one shared element validator. Every element is
 * visited; failures are reported under their index ({@code tags[2]}). The element count limits,
 * when set, are checked before the elements.
 *
 * <p>Immutable: every configuration method returns a new validator.
 *
 * @param <T> the element type
 */
public final class ListValidator<T> implements Validator<List<T>> {

    private final Validator<T> element;
    private final Integer minLength;
    private final Integer maxLength;

    public ListValidator(Validator<T> element) {
        this(element, null, null);
    }

    private ListValidator(Validator<T> element, Integer minLength, Integer maxLength) {
        Checks.requireLengthRange(minLength, maxLength);
        this.element = Objects.requireNonNull(element, "element validator must not be null");
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    public ListValidator<T> minLength(int min) {
        return new ListValidator<>(element, min, maxLength);
    }

    public ListValidator<T> maxLength(int max) {
        return new ListValidator<>(element, minLength, max);
    }

    public Validator<T> element() {
        return element;
    }

    @Override
    public Result<List<T>> validate(Object raw) {
        Optional<List<?>> elements = Containers.elements(raw);
        if (elements.isEmpty()) {
            return Result.invalid(Failure.typeError("a list", raw));
        }
        List<?> items = elements.get();
        Optional<Failure> count = Checks.length(items.size(), minLength, maxLength, "item count");
        if (count.isPresent()) {
            return Result.invalid(count.get());
        }

        List<T> cleaned = new ArrayList<>(items.size());
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
        return Result.valid(Collections.unmodifiableList(cleaned));
    }
}
