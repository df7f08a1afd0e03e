package io.cleaned.core.validator;

import static io.cleaned.core.testkit.TestResults.failureOf;
import static io.cleaned.core.validator.Validators.floating;
import static io.cleaned.core.validator.Validators.integer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cleaned.core.model.ErrorCode;
import io.cleaned.core.model.Failure;
import java.math.BigDecimal;
import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("IntValidator and FloatValidator")
class NumericValidatorTest {

    @Nested
    @DisplayName("Integers")
    class Integers {

        @Test
        @DisplayName("Numeric strings convert to Long")
        void numericString() {
            assertThat(integer().validate("20").value()).isEqualTo(20L);
            assertThat(integer().validate(" 42 ").value()).isEqualTo(42L);
            assertThat(integer().validate("-7").value()).isEqualTo(-7L);
        }

        @Test
        @DisplayName("Integral numbers of any Java type convert to Long")
        void integralNumbers() {
            assertThat(integer().validate(7).value()).isEqualTo(7L);
            assertThat(integer().validate((short) 3).value()).isEqualTo(3L);
            assertThat(integer().validate(20.0).value()).isEqualTo(20L);
            assertThat(integer().validate(new BigDecimal("3.00")).value()).isEqualTo(3L);
            assertThat(integer().validate(BigInteger.TEN).value()).isEqualTo(10L);
        }

        @Test
        @DisplayName("Fractions, booleans and non-numeric text are a type_error")
        void typeErrors() {
            assertThat(failureOf(integer().validate(20.5)).code()).isEqualTo(ErrorCode.TYPE_ERROR);
            assertThat(failureOf(integer().validate(true)))
                    .isEqualTo(Failure.of(ErrorCode.TYPE_ERROR, "expected an integer, got Boolean"));
            assertThat(failureOf(integer().validate("abc")).code()).isEqualTo(ErrorCode.TYPE_ERROR);
            assertThat(failureOf(integer().validate("1.5")).code()).isEqualTo(ErrorCode.TYPE_ERROR);
            assertThat(failureOf(integer().validate(Double.NaN)).code()).isEqualTo(ErrorCode.TYPE_ERROR);
        }

        @Test
        @DisplayName("Values beyond 64 bits are a type_error")
        void outOfRange() {
            assertThat(failureOf(integer().validate(new BigInteger("99999999999999999999"))))
                    .isEqualTo(Failure.of(ErrorCode.TYPE_ERROR, "expected a 64-bit integer, got BigInteger"));
        }

        @Test
        @DisplayName("Inclusive and exclusive bounds report min and max")
        void bounds() {
            assertThat(failureOf(integer().min(0).validate(-1)))
                    .isEqualTo(Failure.of(ErrorCode.MIN, "must be ≥ 0"));
            assertThat(failureOf(integer().max(10).validate(11)))
                    .isEqualTo(Failure.of(ErrorCode.MAX, "must be ≤ 10"));
            assertThat(failureOf(integer().greaterThan(0).validate(0)))
                    .isEqualTo(Failure.of(ErrorCode.MIN, "must be > 0"));
            assertThat(failureOf(integer().lessThan(10).validate(10)))
                    .isEqualTo(Failure.of(ErrorCode.MAX, "must be < 10"));
            assertThat(integer().min(0).max(10).validate(10).value()).isEqualTo(10L);
        }

        @Test
        @DisplayName("Bounds are checked before choices")
        void boundsBeforeChoices() {
            IntValidator validator = integer().max(5).oneOf(1L, 2L);

            assertThat(failureOf(validator.validate(9)).code()).isEqualTo(ErrorCode.MAX);
            assertThat(failureOf(validator.validate(3)))
                    .isEqualTo(Failure.of(ErrorCode.INVALID_CHOICE, "must be one of [1, 2]"));
            assertThat(validator.validate("2").value()).isEqualTo(2L);
        }

        @Test
        @DisplayName("Empty ranges are rejected at configuration time")
        void emptyRange() {
            assertThatThrownBy(() -> integer().min(5).max(1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> integer().greaterThan(5).lessThan(5))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(integer().min(5).max(5).validate(5).isValid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Floats")
    class Floats {

        @Test
        @DisplayName("Numbers and numeric strings convert to Double")
        void converts() {
            assertThat(floating().validate("1.5").value()).isEqualTo(1.5);
            assertThat(floating().validate(3).value()).isEqualTo(3.0);
            assertThat(floating().validate(new BigDecimal("2.25")).value()).isEqualTo(2.25);
        }

        @Test
        @DisplayName("Non-finite values and booleans are a type_error")
        void typeErrors() {
            assertThat(failureOf(floating().validate(Double.NaN)).code()).isEqualTo(ErrorCode.TYPE_ERROR);
            assertThat(failureOf(floating().validate("Infinity")).code()).isEqualTo(ErrorCode.TYPE_ERROR);
            assertThat(failureOf(floating().validate(false)).code()).isEqualTo(ErrorCode.TYPE_ERROR);
        }

        @Test
        @DisplayName("Decimal strings with exponents convert, Java literal suffixes and hex do not")
        void decimalStringsOnly() {
            assertThat(floating().validate(" -1.5e3 ").value()).isEqualTo(-1500.0);
            assertThat(floating().validate("+.5").value()).isEqualTo(0.5);
            assertThat(failureOf(floating().validate("20f")))
                    .isEqualTo(Failure.typeError("a number", "20f"));
            assertThat(failureOf(floating().validate("1d")).code()).isEqualTo(ErrorCode.TYPE_ERROR);
            assertThat(failureOf(floating().validate("0x1p3")).code()).isEqualTo(ErrorCode.TYPE_ERROR);
            assertThat(failureOf(floating().validate("1e400")).code()).isEqualTo(ErrorCode.TYPE_ERROR);
        }

        @Test
        @DisplayName("Bounds")
        void bounds() {
            assertThat(failureOf(floating().min(0.5).validate(0.1)))
                    .isEqualTo(Failure.of(ErrorCode.MIN, "must be ≥ 0.5"));
            assertThat(failureOf(floating().lessThan(1.0).validate(1)))
                    .isEqualTo(Failure.of(ErrorCode.MAX, "must be < 1.0"));
        }
    }
}
