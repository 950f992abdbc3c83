package com.ryuqq.calculator.adapter.console;

import java.math.BigDecimal;

/**
 * 계산 결과 출력 형식.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>정수 값: 소수부 없이 출력 (15.0 → "15", -0.0 → "0")</li>
 *   <li>그 외 유한 값: 지수 표기 없는 십진수 (1.0E-7 → "0.0000001")</li>
 *   <li>NaN, 무한대: "NaN", "Infinity", "-Infinity"</li>
 * </ul>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class ResultFormatter {

    private ResultFormatter() {
    }

    /**
     * 결과 값을 문자열로 변환.
     *
     * @param value 계산 결과
     * @return 출력 문자열
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
