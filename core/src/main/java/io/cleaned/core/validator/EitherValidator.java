package io.cleaned.core.validator;

import io.cleaned.core.model.Either;
import io.cleaned.core.model.Result;
import io.cleaned.core.spi.Validator;
import java.util.List;
import java.util.Objects;

/**
 * Two-way union. Tries {@code first}, then {@code second}; the cleaned value records which one
 * matched, so callers can {@link Either#fold fold} over both types. Fails with {@code no_match}
 * when neither accepts the value.
 *
 * @param <A> the first alternative's type
 * @param <B> the second alternative's type
 */
public final class EitherValidator<A, B> implements Validator<Either<A, B>> {

    private final Validator<A> first;
    private final Validator<B> second;
    private final List<Validator<?>> candidates;

    public EitherValidator(Validator<A> first, Validator<B> second) {
        this.first = Objects.requireNonNull(first, "first alternative must not be null");
        this.second = Objects.requireNonNull(second, "second alternative must not be null");
        this.candidates = List.of(first, second);
    }

    @Override
    public Result<Either<A, B>> validate(Object raw) {
        return Alternatives.tryEach(candidates, raw).map(this::tag);
    }

    @Override
    public Result<Either<A, B>> absent() {
        return Alternatives.tryAbsent(candidates).map(this::tag);
    }

    @SuppressWarnings("unchecked")
    private Either<A, B> tag(Alternatives.Match match) {
        return match.index() == 0 ? Either.first((A) match.value()) : Either.second((B) match.value());
    }
}
