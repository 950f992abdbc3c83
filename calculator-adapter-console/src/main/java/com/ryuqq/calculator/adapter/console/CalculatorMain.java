package com.ryuqq.calculator.adapter.console;

import com.ryuqq.calculator.adapter.inmemory.registry.InMemoryOperationRegistry;
import com.ryuqq.calculator.application.calculator.Calculator;
import com.ryuqq.calculator.application.menu.Menu;
import com.ryuqq.calculator.core.exception.CalculatorException;
import com.ryuqq.calculator.core.model.Calculation;
import com.ryuqq.calculator.core.spi.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.util.Optional;

/**
 * 콘솔 계산기 진입점.
 *
 * <p>레지스트리, 메뉴, 계산기를 고정된 순서로 직접 생성해 한 번 실행합니다.
 * 모든 실패는 여기서 한 번만 잡아 결과와 같은 출력 스트림에 보고하고,
 * 프로세스는 정상 종료합니다.</p>
 *
 * <p><strong>보고 형식:</strong></p>
 * <ul>
 *   <li>{@link CalculatorException}: {@code Error [CALC-003]: Cannot divide by zero (operand #2)}</li>
 *   <li>그 외 예외: {@code Error: java.io.UncheckedIOException: ...} (스택 트레이스는 로그로)</li>
 * </ul>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class CalculatorMain {

    private static final Logger log = LoggerFactory.getLogger(CalculatorMain.class);

    private CalculatorMain() {
    }

    public static void main(String[] args) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset()));
        launch(in, System.out, new CalculatorConfig());
    }

    /**
     * 구성 요소를 연결하고 한 번 실행.
     *
     * @param in 사용자 입력
     * @param out 메뉴, 결과, 오류 메시지 출력
     * @param config 설정
     * @return 성공 시 계산 결과, 실패를 보고한 경우 empty
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static Optional<Calculation> launch(BufferedReader in, PrintStream out, CalculatorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        OperationRegistry registry = InMemoryOperationRegistry.standard();
        Menu menu = new ConsoleMenu(in, out, config.menuStyle());
        Calculator calculator = new MenuDrivenCalculator(registry, menu, out, config.operands());
        return launch(calculator, out);
    }

    /**
     * 계산기를 실행하고 실패를 보고.
     *
     * @param calculator 실행할 계산기
     * @param out 오류 메시지 출력
     * @return 성공 시 계산 결과, 실패를 보고한 경우 empty
     */
    static Optional<Calculation> launch(Calculator calculator, PrintStream out) {
        try {
            return Optional.of(calculator.run());
        } catch (CalculatorException e) {
            log.info("Calculation rejected [{}]: {}", e.getErrorCode(), e.getMessage());
            out.println("Error [" + e.getErrorCode() + "]: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Calculator run failed", e);
            out.println("Error: " + e);
        }
        return Optional.empty();
    }
}
