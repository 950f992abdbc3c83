package com.ryuqq.calculator.core.model;

/**
 * 완료된 한 번의 계산.
 *
 * <p>어떤 연산을 어떤 피연산자에 적용해 어떤 결과를 얻었는지 기록합니다.</p>
 *
 * @param operationName 실행된 연산 이름
 * @param operands 사용된 피연산자
 * @param result 계산 결과
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public record Calculation(
    String operationName,
    Operands operands,
    double result
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operationName 또는 operands가 null인 경우
     */
    public Calculation {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (operands == null) {
            throw new IllegalArgumentException("operands cannot be null");
        }
    }
}
