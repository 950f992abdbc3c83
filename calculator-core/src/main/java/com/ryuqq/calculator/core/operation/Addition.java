package com.ryuqq.calculator.core.operation;

/**
 * 덧셈: 모든 피연산자의 합.
 *
 * <p>피연산자가 없으면 0을 반환합니다.</p>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class Addition implements Operation {

    public static final String NAME = "Addition";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double compute(double... numbers) {
        double sum = 0.0;
        for (double number : Arity.requireNonNull(numbers)) {
            sum += number;
        }
        return sum;
    }

    @Override
    public String toString() {
        return "Operation{" + NAME + '}';
    }
}
