package com.ryuqq.calculator.core.operation;

import com.ryuqq.calculator.core.exception.DivisionByZeroException;

/**
 * 나눗셈: {@code numbers[0] / numbers[1] / ... / numbers[n-1]}.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>피연산자 1개 이상 필요 (1개면 그 값 반환)</li>
 *   <li>왼쪽 결합</li>
 *   <li>두 번째 이후 피연산자 중 하나라도 정확히 0이면 {@link DivisionByZeroException}
 *       (0.0, -0.0 모두 해당)</li>
 * </ul>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class Division implements Operation {

    public static final String NAME = "Division";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double compute(double... numbers) {
        Arity.requireAtLeast(this, numbers, 1);

        double result = numbers[0];
        for (int i = 1; i < numbers.length; i++) {
            if (numbers[i] == 0.0) {
                throw new DivisionByZeroException(i);
            }
            result /= numbers[i];
        }
        return result;
    }

    @Override
    public String toString() {
        return "Operation{" + NAME + '}';
    }
}
