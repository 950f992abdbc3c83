/**
 * Calculator 인터페이스.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.calculator.application.calculator.Calculator} - 한 번의 선택-계산-출력 실행</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-console 모듈의 {@code MenuDrivenCalculator}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.calculator.application.calculator;
