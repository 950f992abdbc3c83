package com.ryuqq.calculator.core.exception;

import com.ryuqq.calculator.core.selection.InvalidSelection;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CalculatorException 계층 테스트.
 *
 * @author Calculator Team
 * @since 1.0.0
 */
class CalculatorExceptionTest {

    @Test
    void 오류_코드는_종류별로_고유() {
        assertThat(new InvalidArityException("Division", "at least 1", 0).getErrorCode()).isEqualTo("CALC-001");
        assertThat(new InvalidArgumentException(-1, "negative").getErrorCode()).isEqualTo("CALC-002");
        assertThat(new DivisionByZeroException(1).getErrorCode()).isEqualTo("CALC-003");
        assertThat(new InvalidSelectionException(
            InvalidSelection.of("99", InvalidSelection.Reason.OUT_OF_RANGE)).getErrorCode()).isEqualTo("CALC-004");
    }

    @Test
    void 모든_예외는_unchecked() {
        assertThat(new DivisionByZeroException(1)).isInstanceOf(RuntimeException.class);
    }

    @Test
    void InvalidArity_메시지에_연산과_개수_포함() {
        // when
        InvalidArityException exception = new InvalidArityException("Square root", "exactly 1", 2);

        // then
        assertThat(exception.getMessage())
            .isEqualTo("Square root requires exactly 1 operand(s) but received 2");
    }

    @Test
    void DivisionByZero_메시지는_1부터_센_위치() {
        assertThat(new DivisionByZeroException(2).getMessage())
            .isEqualTo("Cannot divide by zero (operand #3)");
    }

    @Test
    void InvalidSelection_메시지에_입력_포함() {
        // given
        InvalidSelection selection = InvalidSelection.of("99", InvalidSelection.Reason.OUT_OF_RANGE);

        // when
        InvalidSelectionException exception = new InvalidSelectionException(selection);

        // then
        assertThat(exception.getMessage()).isEqualTo("Invalid selection: '99' is not a menu item");
        assertThat(exception.getSelection()).isSameAs(selection);
    }

    @Test
    void InvalidSelection_null이면_예외() {
        assertThatThrownBy(() -> new InvalidSelectionException(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("selection cannot be null");
    }
}
