package io.cleaned.core.validator;

import io.cleaned.core.model.Result;
import io.cleaned.core.model.Variant;
import io.cleaned.core.spi.Validator;
import java.util.List;
import java.util.Objects;

/**
 * N-way union over alternatives sharing the supertype {@code T}. The first alternative that
 * accepts the value wins and its position is kept in the {@link Variant}. Fails with
 * {@code no_match} when none does.
 *
 * @param <T> the common supertype of the alternatives
 */
public final class AnyOfValidator<T> implements Validator<Variant<T>> {

    private final List<Validator<? extends T>> candidates;

    public AnyOfValidator(List<Validator<? extends T>> candidates) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        if (candidates.size() < 2) {
            throw new IllegalArgumentException("a union needs at least two alternatives, got: " + candidates.size());
        }
        this.candidates = List.copyOf(candidates);
    }

    public List<Validator<? extends T>> candidates() {
        return candidates;
    }

    @Override
    public Result<Variant<T>> validate(Object raw) {
        return Alternatives.tryEach(candidates, raw).map(this::tag);
    }

    @Override
    public Result<Variant<T>> absent() {
        return Alternatives.tryAbsent(candidates).map(this::tag);
    }

    @SuppressWarnings("unchecked")
    private Variant<T> tag(Alternatives.Match match) {
        return new Variant<>(match.index(), (T) match.value());
    }
}
