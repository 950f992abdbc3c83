package com.ryuqq.calculator.core.operation;

import com.ryuqq.calculator.core.exception.InvalidArgumentException;

/**
 * 제곱근: 정확히 1개의 음이 아닌 피연산자.
 *
 * <p>음수 입력은 {@link InvalidArgumentException}, 그 외 개수는
 * {@link com.ryuqq.calculator.core.exception.InvalidArityException}.</p>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class SquareRoot implements Operation {

    public static final String NAME = "Square root";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double compute(double... numbers) {
        Arity.requireExactly(this, numbers, 1);

        double number = numbers[0];
        if (number < 0) {
            throw new InvalidArgumentException(number, "Square root is undefined for negative numbers: " + number);
        }
        return Math.sqrt(number);
    }

    @Override
    public String toString() {
        return "Operation{" + NAME + '}';
    }
}
