package com.ryuqq.calculator.core.operation;

/**
 * 이름이 있는 상태 없는 산술 연산.
 *
 * <p>Operation은 다섯 가지 경우로 닫혀 있습니다:</p>
 * <ul>
 *   <li>{@link Addition}: 모든 피연산자의 합 (빈 입력 → 0)</li>
 *   <li>{@link Subtraction}: 왼쪽부터 순서대로 뺄셈 (빈 입력 불가)</li>
 *   <li>{@link Multiplication}: 모든 피연산자의 곱 (빈 입력 → 1)</li>
 *   <li>{@link Division}: 왼쪽부터 순서대로 나눗셈 (1개 이상, 제수 0 불가)</li>
 *   <li>{@link SquareRoot}: 정확히 1개의 음이 아닌 피연산자의 제곱근</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 연산 집합이 컴파일 타임에 고정됩니다.
 * 구현체는 불변이며 프로세스 수명 동안 한 번만 생성해 재사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Operation division = new Division();
 * double result = division.compute(10, 5);   // 2.0
 * division.compute(10, 0);                   // DivisionByZeroException
 * </pre>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public sealed interface Operation permits Addition, Subtraction, Multiplication, Division, SquareRoot {

    /**
     * 메뉴에 표시되는 연산 이름.
     *
     * @return 연산 이름 (non-null, non-blank)
     */
    String name();

    /**
     * 피연산자 시퀀스에 연산 적용.
     *
     * <p>허용되는 피연산자 개수는 각 구현체의 arity 규칙을 따릅니다.</p>
     *
     * @param numbers 피연산자 (길이 제한 없음, null 불가)
     * @return 계산 결과
     * @throws IllegalArgumentException numbers가 null인 경우
     * @throws com.ryuqq.calculator.core.exception.InvalidArityException 피연산자 개수가 허용 범위를 벗어난 경우
     * @throws com.ryuqq.calculator.core.exception.InvalidArgumentException 피연산자가 정의역을 벗어난 경우
     * @throws com.ryuqq.calculator.core.exception.DivisionByZeroException 제수가 0인 경우
     */
    double compute(double... numbers);
}
