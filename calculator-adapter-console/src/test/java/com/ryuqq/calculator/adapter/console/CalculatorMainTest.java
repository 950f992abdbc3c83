package com.ryuqq.calculator.adapter.console;

import com.ryuqq.calculator.application.menu.MenuStyle;
import com.ryuqq.calculator.core.model.Calculation;
import com.ryuqq.calculator.core.model.Operands;
import com.ryuqq.calculator.testkit.console.ScriptedConsole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 콘솔 계산기 End-to-End 테스트.
 *
 * <p>표준 레지스트리, 콘솔 메뉴, 기본 피연산자 [10, 5]로 한 번 실행하고
 * 마지막 출력 줄을 확인합니다.</p>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
class CalculatorMainTest {

    private static String run(ScriptedConsole console, CalculatorConfig config) {
        CalculatorMain.launch(console.reader(), console.out(), config);
        return console.lastLine().substring(MenuStyle.PROMPT.length());
    }

    @Nested
    @DisplayName("Successful runs")
    class SuccessfulRuns {

        @ParameterizedTest(name = "selection {0} on [10, 5] prints {1}")
        @CsvSource({
            "1, 15",
            "2, 5",
            "3, 50",
            "4, 2"
        })
        void selectionPrintsResult(String selection, String expected) {
            // given
            ScriptedConsole console = ScriptedConsole.withInput(selection);

            // when
            String lastLine = run(console, new CalculatorConfig());

            // then
            assertThat(lastLine).isEqualTo(expected);
        }

        @Test
        @DisplayName("launch returns the completed calculation")
        void launchReturnsCalculation() {
            // given
            ScriptedConsole console = ScriptedConsole.withInput("1");

            // when
            Optional<Calculation> calculation = CalculatorMain.launch(console.reader(), console.out(), new CalculatorConfig());

            // then
            assertThat(calculation).contains(new Calculation("Addition", Operands.of(10, 5), 15));
        }

        @Test
        @DisplayName("menu is printed before the result")
        void menuPrintedBeforeResult() {
            // given
            ScriptedConsole console = ScriptedConsole.withInput("2");

            // when
            CalculatorMain.launch(console.reader(), console.out(), new CalculatorConfig());

            // then
            assertThat(console.outputLines()).containsExactly(
                "....CALCULATOR....",
                "1. Addition",
                "2. Subtraction",
                "3. Multiplication",
                "4. Division",
                "5. Square root",
                "Choose an operation: 5"
            );
        }

        @Test
        @DisplayName("classic style and custom operands")
        void classicStyleWithCustomOperands() {
            // given
            ScriptedConsole console = ScriptedConsole.withInput("5");
            CalculatorConfig config = new CalculatorConfig()
                .withMenuStyle(MenuStyle.CLASSIC)
                .withOperands(Operands.of(2));

            // when
            String lastLine = run(console, config);

            // then
            assertThat(console.outputLines()).first().isEqualTo("======== CALCULATOR ========");
            assertThat(lastLine).isEqualTo("1.4142135623730951");
        }
    }

    @Nested
    @DisplayName("Reported failures")
    class ReportedFailures {

        @ParameterizedTest(name = "input ''{0}'' reports: {1}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "99  | Error [CALC-004]: Invalid selection: '99' is not a menu item",
            "0   | Error [CALC-004]: Invalid selection: '0' is not a menu item",
            "6   | Error [CALC-004]: Invalid selection: '6' is not a menu item",
            "abc | Error [CALC-004]: Invalid selection: 'abc' is not a number",
            "5   | Error [CALC-001]: Square root requires exactly 1 operand(s) but received 2"
        })
        void failureIsReportedAsLastLine(String input, String expected) {
            // given
            ScriptedConsole console = ScriptedConsole.withInput(input);

            // when
            Optional<Calculation> calculation = CalculatorMain.launch(console.reader(), console.out(), new CalculatorConfig());

            // then
            assertThat(calculation).isEmpty();
            assertThat(console.lastLine()).isEqualTo(MenuStyle.PROMPT + expected);
        }

        @Test
        @DisplayName("end of input is reported as missing selection")
        void endOfInput() {
            // given
            ScriptedConsole console = ScriptedConsole.withoutInput();

            // when
            String lastLine = run(console, new CalculatorConfig());

            // then
            assertThat(lastLine).isEqualTo("Error [CALC-004]: Invalid selection: no input was given");
        }

        @Test
        @DisplayName("division by zero operand is reported")
        void divisionByZero() {
            // given
            ScriptedConsole console = ScriptedConsole.withInput("4");

            // when
            String lastLine = run(console, new CalculatorConfig().withOperands(Operands.of(10, 0)));

            // then
            assertThat(lastLine).isEqualTo("Error [CALC-003]: Cannot divide by zero (operand #2)");
        }

        @Test
        @DisplayName("negative square root is reported")
        void negativeSquareRoot() {
            // given
            ScriptedConsole console = ScriptedConsole.withInput("5");

            // when
            String lastLine = run(console, new CalculatorConfig().withOperands(Operands.of(-4)));

            // then
            assertThat(lastLine).isEqualTo("Error [CALC-002]: Square root is undefined for negative numbers: -4.0");
        }

        @Test
        @DisplayName("unexpected failures are described, not rethrown")
        void unexpectedFailure() {
            // given
            ScriptedConsole console = ScriptedConsole.withoutInput();

            // when
            Optional<Calculation> calculation = CalculatorMain.launch(() -> {
                throw new IllegalStateException("boom");
            }, console.out());

            // then
            assertThat(calculation).isEmpty();
            assertThat(console.lastLine()).isEqualTo("Error: java.lang.IllegalStateException: boom");
        }

        @Test
        @DisplayName("null config is rejected")
        void nullConfig() {
            ScriptedConsole console = ScriptedConsole.withoutInput();

            assertThatThrownBy(() -> CalculatorMain.launch(console.reader(), console.out(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("config cannot be null");
        }
    }
}
