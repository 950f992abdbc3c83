package com.ryuqq.calculator.adapter.console;

import com.ryuqq.calculator.application.calculator.Calculator;
import com.ryuqq.calculator.application.menu.Menu;
import com.ryuqq.calculator.core.exception.InvalidSelectionException;
import com.ryuqq.calculator.core.model.Calculation;
import com.ryuqq.calculator.core.model.Operands;
import com.ryuqq.calculator.core.operation.Operation;
import com.ryuqq.calculator.core.selection.InvalidSelection;
import com.ryuqq.calculator.core.selection.Selected;
import com.ryuqq.calculator.core.selection.Selection;
import com.ryuqq.calculator.core.spi.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * 메뉴 기반 {@link Calculator} 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run() 호출
 *   ↓
 * registry.list() → [Addition, Subtraction, ...]
 *   ↓
 * menu.select(operations) → Selection
 *   ├─ InvalidSelection → InvalidSelectionException (연산 실행 안 함)
 *   └─ Selected → operation.compute(operands)
 *                   ↓
 *                 out.println(결과) → Calculation 반환
 * </pre>
 *
 * <p>연산이 던진 {@link com.ryuqq.calculator.core.exception.CalculatorException}은
 * 잡지 않고 호출자에게 전파합니다. 결과 줄은 성공한 경우에만 출력됩니다.</p>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class MenuDrivenCalculator implements Calculator {

    private static final Logger log = LoggerFactory.getLogger(MenuDrivenCalculator.class);

    private final OperationRegistry registry;
    private final Menu menu;
    private final PrintStream out;
    private final Operands operands;

    /**
     * 생성자.
     *
     * @param registry 연산 레지스트리
     * @param menu 메뉴
     * @param out 결과 출력 대상
     * @param operands 선택된 연산에 전달할 피연산자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MenuDrivenCalculator(OperationRegistry registry, Menu menu, PrintStream out, Operands operands) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (menu == null) {
            throw new IllegalArgumentException("menu cannot be null");
        }
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        if (operands == null) {
            throw new IllegalArgumentException("operands cannot be null");
        }
        this.registry = registry;
        this.menu = menu;
        this.out = out;
        this.operands = operands;
    }

    @Override
    public Calculation run() {
        // 1. 연산 목록 조회
        List<Operation> operations = registry.list();

        // 2. 메뉴 선택
        Selection selection = menu.select(operations);
        if (selection == null) {
            throw new IllegalStateException("menu returned no selection");
        }
        if (selection instanceof InvalidSelection invalid) {
            throw new InvalidSelectionException(invalid);
        }
        Operation operation = ((Selected) selection).operation();

        // 3. 계산
        double result = operation.compute(operands.getValues());
        log.info("{} {} = {}", operation.name(), operands, result);

        // 4. 결과 출력
        out.println(ResultFormatter.format(result));
        return new Calculation(operation.name(), operands, result);
    }
}
