package com.ryuqq.calculator.core.operation;

/**
 * 곱셈: 모든 피연산자의 곱 (누산기 초기값 1).
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class Multiplication implements Operation {

    public static final String NAME = "Multiplication";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double compute(double... numbers) {
        double product = 1.0;
        for (double number : Arity.requireNonNull(numbers)) {
            product *= number;
        }
        return product;
    }

    @Override
    public String toString() {
        return "Operation{" + NAME + '}';
    }
}
