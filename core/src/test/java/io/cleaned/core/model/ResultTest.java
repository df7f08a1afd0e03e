package io.cleaned.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Result, Either and ErrorCode")
class ResultTest {

    @Test
    @DisplayName("Valid result exposes its value and maps it")
    void validResult() {
        Result<Integer> result = Result.valid(20);

        assertThat(result.isValid()).isTrue();
        assertThat(result.value()).isEqualTo(20);
        assertThat(result.map(v -> v * 2).value()).isEqualTo(40);
        assertThatThrownBy(result::error).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Invalid result passes its failure through map()")
    void invalidResult() {
        Result<Integer> result = Result.invalid(ErrorCode.MIN, "must be ≥ 0");
        Result<String> mapped = result.map(String::valueOf);

        assertThat(mapped.isValid()).isFalse();
        assertThat(mapped.error()).isEqualTo(result.error());
        assertThatThrownBy(mapped::value)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("min");
    }

    @Test
    @DisplayName("Failure factories carry the documented messages")
    void failureFactories() {
        assertThat(Failure.required().message()).isEqualTo("this field is required");
        assertThat(Failure.typeError("a string", 5))
                .isEqualTo(Failure.of(ErrorCode.TYPE_ERROR, "expected a string, got Integer"));
        assertThat(Failure.typeError("a string", null).message()).isEqualTo("expected a string, got null");
        assertThat(Failure.required()).hasToString("required: this field is required");
    }

    @Test
    @DisplayName("Either folds over the matched alternative")
    void eitherFold() {
        Either<Long, String> first = Either.first(5L);
        Either<Long, String> second = Either.second("five");

        assertThat(first.index()).isZero();
        assertThat(second.index()).isEqualTo(1);
        String firstKind = first.fold(n -> "number", s -> "text");
        String secondKind = second.fold(n -> "number", s -> "text");
        assertThat(firstKind).isEqualTo("number");
        assertThat(secondKind).isEqualTo("text");
        assertThat(first.firstValue()).contains(5L);
        assertThat(first.secondValue()).isEmpty();
        assertThat(second.value()).isEqualTo("five");
    }

    @Test
    @DisplayName("ErrorCode tags round-trip and unknown tags are rejected")
    void errorCodeTags() {
        for (ErrorCode code : ErrorCode.values()) {
            assertThat(ErrorCode.fromTag(code.tag())).isSameAs(code);
        }
        assertThat(ErrorCode.DUPLICATE_KEY).hasToString("duplicate_key");
        assertThatThrownBy(() -> ErrorCode.fromTag("bogus"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bogus");
    }
}
