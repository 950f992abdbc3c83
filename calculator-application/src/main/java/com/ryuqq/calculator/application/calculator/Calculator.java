package com.ryuqq.calculator.application.calculator;

import com.ryuqq.calculator.core.model.Calculation;

/**
 * 계산 실행 조정자.
 *
 * <p>레지스트리 → 메뉴 → 연산 실행 → 결과 출력 순서로 한 번의 실행을 수행합니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * run()
 *   1. operations = registry.list()
 *   2. selection = menu.select(operations)
 *   3. InvalidSelection → InvalidSelectionException (연산 실행 안 함)
 *   4. Selected → operation.compute(operands) → 결과 출력
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try {
 *     Calculation calculation = calculator.run();
 * } catch (CalculatorException e) {
 *     out.println("Error [" + e.getErrorCode() + "]: " + e.getMessage());
 * }
 * </pre>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public interface Calculator {

    /**
     * 한 번의 계산 실행.
     *
     * <p>재시도하지 않습니다. 실패는 호출자에게 그대로 전파됩니다.</p>
     *
     * @return 완료된 계산
     * @throws com.ryuqq.calculator.core.exception.InvalidSelectionException 선택이 유효하지 않은 경우
     * @throws com.ryuqq.calculator.core.exception.CalculatorException 연산이 실패한 경우
     */
    Calculation run();
}
