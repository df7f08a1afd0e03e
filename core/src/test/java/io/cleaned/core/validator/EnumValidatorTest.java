package io.cleaned.core.validator;

import static io.cleaned.core.testkit.TestResults.failureOf;
import static io.cleaned.core.validator.Validators.enumOf;
import static org.assertj.core.api.Assertions.assertThat;

import io.cleaned.core.model.ErrorCode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.spi.EnumValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EnumValidator")
class EnumValidatorTest {

    enum Color {
        RED,
        GREEN
    }

    enum Size implements EnumValue {
        SMALL("S"),
        LARGE("L");

        private final String code;

        Size(String code) {
            this.code = code;
        }

        @Override
        public Object value() {
            return code;
        }
    }

    enum Level implements EnumValue {
        LOW(1),
        HIGH(2);

        private final int level;

        Level(int level) {
            this.level = level;
        }

        @Override
        public Object value() {
            return level;
        }
    }

    @Test
    @DisplayName("Constants and constant names are accepted")
    void plainEnum() {
        assertThat(enumOf(Color.class).validate("RED").value()).isEqualTo(Color.RED);
        assertThat(enumOf(Color.class).validate(Color.GREEN).value()).isEqualTo(Color.GREEN);
    }

    @Test
    @DisplayName("Names are case-sensitive; failures list the permitted set")
    void invalidChoice() {
        assertThat(failureOf(enumOf(Color.class).validate("red")))
                .isEqualTo(Failure.of(ErrorCode.INVALID_CHOICE, "must be one of [RED, GREEN]"));
        assertThat(failureOf(enumOf(Color.class).validate(null)).code()).isEqualTo(ErrorCode.INVALID_CHOICE);
    }

    @Test
    @DisplayName("Underlying values select their constant")
    void underlyingValue() {
        assertThat(enumOf(Size.class).validate("S").value()).isEqualTo(Size.SMALL);
        assertThat(enumOf(Size.class).validate("LARGE").value()).isEqualTo(Size.LARGE);
        assertThat(failureOf(enumOf(Size.class).validate("M")))
                .isEqualTo(Failure.of(ErrorCode.INVALID_CHOICE, "must be one of [S, L]"));
    }

    @Test
    @DisplayName("Numeric values compare by value, not by boxed type")
    void numericValues() {
        assertThat(enumOf(Level.class).validate(1L).value()).isEqualTo(Level.LOW);
        assertThat(enumOf(Level.class).validate(2.0).value()).isEqualTo(Level.HIGH);
        assertThat(failureOf(enumOf(Level.class).validate(3)).code()).isEqualTo(ErrorCode.INVALID_CHOICE);
        assertThat(failureOf(enumOf(Level.class).validate("1")).code()).isEqualTo(ErrorCode.INVALID_CHOICE);
    }
}
