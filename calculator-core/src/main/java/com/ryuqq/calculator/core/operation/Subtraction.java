package com.ryuqq.calculator.core.operation;

/**
 * 뺄셈: {@code numbers[0] - numbers[1] - ... - numbers[n-1]}.
 *
 * <p>왼쪽 결합이며, 피연산자가 1개면 그 값을 그대로 반환합니다.
 * 피연산자가 없으면 {@link com.ryuqq.calculator.core.exception.InvalidArityException}.</p>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class Subtraction implements Operation {

    public static final String NAME = "Subtraction";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double compute(double... numbers) {
        Arity.requireAtLeast(this, numbers, 1);

        double result = numbers[0];
        for (int i = 1; i < numbers.length; i++) {
            result -= numbers[i];
        }
        return result;
    }

    @Override
    public String toString() {
        return "Operation{" + NAME + '}';
    }
}
