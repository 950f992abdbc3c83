package com.ryuqq.calculator.core.exception;

/**
 * 나눗셈 단계의 제수가 정확히 0인 경우.
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class DivisionByZeroException extends CalculatorException {

    public static final String ERROR_CODE = "CALC-003";

    private final int divisorIndex;

    /**
     * 생성자.
     *
     * @param divisorIndex 0인 제수의 위치 (0-based, 항상 1 이상)
     */
    public DivisionByZeroException(int divisorIndex) {
        super(ERROR_CODE, "Cannot divide by zero (operand #" + (divisorIndex + 1) + ")");
        this.divisorIndex = divisorIndex;
    }

    public int getDivisorIndex() {
        return divisorIndex;
    }
}
