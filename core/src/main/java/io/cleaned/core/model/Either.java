package io.cleaned.core.model;

import java.util.Optional;
import java.util.function.Function;

/**
 * Cleaned value of a two-way union: which alternative matched, and its value.
 *
 * @param <A> the type produced by the first alternative
 * @param <B> the type produced by the second alternative
 */
public sealed interface Either<A, B> {

    static <A, B> Either<A, B> first(A value) {
        return new First<>(value);
    }

    static <A, B> Either<A, B> second(B value) {
        return new Second<>(value);
    }

    /** Zero-based index of the alternative that matched. */
    int index();

    /** The matched value, whichever alternative produced it. */
    Object value();

    /** Applies the function for the matched alternative. */
    <R> R fold(Function<? super A, ? extends R> ifFirst, Function<? super B, ? extends R> ifSecond);

    default Optional<A> firstValue() {
        return fold(Optional::ofNullable, b -> Optional.empty());
    }

    default Optional<B> secondValue() {
        return fold(a -> Optional.empty(), Optional::ofNullable);
    }

    record First<A, B>(A value) implements Either<A, B> {
        @Override
        public int index() {
            return 0;
        }

        @Override
        public <R> R fold(Function<? super A, ? extends R> ifFirst, Function<? super B, ? extends R> ifSecond) {
            return ifFirst.apply(value);
        }
    }

    record Second<A, B>(B value) implements Either<A, B> {
        @Override
        public int index() {
            return 1;
        }

        @Override
        public <R> R fold(Function<? super A, ? extends R> ifFirst, Function<? super B, ? extends R> ifSecond) {
            return ifSecond.apply(value);
        }
    }
}
