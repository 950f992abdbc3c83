package com.ryuqq.calculator.core.exception;

/**
 * 연산이 처리할 수 없는 개수의 피연산자를 받은 경우.
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class InvalidArityException extends CalculatorException {

    public static final String ERROR_CODE = "CALC-001";

    private final String operationName;
    private final int actualArity;

    /**
     * 생성자.
     *
     * @param operationName 연산 이름
     * @param expectation 허용되는 개수 설명 (예: "exactly 1", "at least 1")
     * @param actualArity 실제로 전달된 피연산자 개수
     */
    public InvalidArityException(String operationName, String expectation, int actualArity) {
        super(ERROR_CODE, operationName + " requires " + expectation
            + " operand(s) but received " + actualArity);
        this.operationName = operationName;
        this.actualArity = actualArity;
    }

    public String getOperationName() {
        return operationName;
    }

    public int getActualArity() {
        return actualArity;
    }
}
