package com.ryuqq.calculator.core.exception;

/**
 * 계산기 도메인 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 안정적인 오류 코드({@code CALC-xxx})를 가지며,
 * 최상위 실행 루프에서 한 번만 잡혀 사용자에게 보고됩니다.</p>
 *
 * <p><strong>오류 코드:</strong></p>
 * <ul>
 *   <li>{@code CALC-001}: {@link InvalidArityException} - 피연산자 개수 오류</li>
 *   <li>{@code CALC-002}: {@link InvalidArgumentException} - 정의역 밖의 피연산자</li>
 *   <li>{@code CALC-003}: {@link DivisionByZeroException} - 0으로 나누기</li>
 *   <li>{@code CALC-004}: {@link InvalidSelectionException} - 잘못된 메뉴 선택</li>
 * </ul>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public abstract class CalculatorException extends RuntimeException {

    private final String errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드 (예: CALC-001)
     * @param message 오류 메시지
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    protected CalculatorException(String errorCode, String message) {
        super(message);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (non-null)
     */
    public String getErrorCode() {
        return errorCode;
    }
}
