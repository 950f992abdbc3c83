package com.ryuqq.calculator.core.operation;

import com.ryuqq.calculator.core.exception.InvalidArityException;

/**
 * 피연산자 개수 검증 헬퍼.
 *
 * @author Calculator Team
 * @since 1.0.0
 */
final class Arity {

    private Arity() {
    }

    static double[] requireNonNull(double[] numbers) {
        if (numbers == null) {
            throw new IllegalArgumentException("numbers cannot be null");
        }
        return numbers;
    }

    static double[] requireAtLeast(Operation operation, double[] numbers, int minimum) {
        requireNonNull(numbers);
        if (numbers.length < minimum) {
            throw new InvalidArityException(operation.name(), "at least " + minimum, numbers.length);
        }
        return numbers;
    }

    static double[] requireExactly(Operation operation, double[] numbers, int expected) {
        requireNonNull(numbers);
        if (numbers.length != expected) {
            throw new InvalidArityException(operation.name(), "exactly " + expected, numbers.length);
        }
        return numbers;
    }
}
