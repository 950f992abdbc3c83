package com.ryuqq.calculator.core.exception;

/**
 * 피연산자 값이 연산의 정의역을 벗어난 경우 (예: 음수의 제곱근).
 *
 * <p>{@link IllegalArgumentException}과 달리 호출자의 프로그래밍 오류가 아니라
 * 사용자에게 보고해야 하는 계산 실패를 나타냅니다.</p>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class InvalidArgumentException extends CalculatorException {

    public static final String ERROR_CODE = "CALC-002";

    private final double argument;

    /**
     * 생성자.
     *
     * @param argument 문제가 된 피연산자
     * @param message 오류 메시지
     */
    public InvalidArgumentException(double argument, String message) {
        super(ERROR_CODE, message);
        this.argument = argument;
    }

    public double getArgument() {
        return argument;
    }
}
