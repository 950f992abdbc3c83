package com.ryuqq.calculator.core.model;

import java.util.Arrays;

/**
 * 연산에 전달되는 피연산자 시퀀스.
 *
 * <p><strong>불변성:</strong> 생성 시와 조회 시 모두 방어적 복사를 수행합니다.</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 배열 불가</li>
 *   <li>길이 제한 없음 (허용 개수는 각 연산이 판단)</li>
 * </ul>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class Operands {

    private final double[] values;

    private Operands(double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("Operands cannot be null");
        }
        this.values = values.clone();
    }

    /**
     * Operands 생성.
     *
     * @param values 피연산자 값
     * @return Operands 인스턴스
     * @throws IllegalArgumentException values가 null인 경우
     */
    public static Operands of(double... values) {
        return new Operands(values);
    }

    /**
     * 피연산자 값 조회 (복사본).
     *
     * @return 피연산자 배열의 복사본
     */
    public double[] getValues() {
        return values.clone();
    }

    /**
     * 피연산자 개수.
     *
     * @return 피연산자 개수
     */
    public int size() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Operands operands = (Operands) o;
        return Arrays.equals(values, operands.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Operands{" + Arrays.toString(values) + '}';
    }
}
