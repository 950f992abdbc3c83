package com.ryuqq.calculator.core.selection;

import com.ryuqq.calculator.core.operation.Operation;

import java.util.List;
import java.util.Optional;

/**
 * 메뉴 선택 결과.
 *
 * <p>Selection은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Selected}: 1-based 인덱스로 연산이 선택됨</li>
 *   <li>{@link InvalidSelection}: 입력이 없거나, 숫자가 아니거나, 범위 밖</li>
 * </ul>
 *
 * <p>잘못된 입력은 예외가 아니라 값으로 반환됩니다.
 * 호출자는 연산을 실행하기 전에 반드시 결과를 확인해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Selection selection = Selection.resolve(line, operations);
 * if (selection instanceof Selected selected) {
 *     double result = selected.operation().compute(10, 5);
 * }
 * </pre>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public sealed interface Selection permits Selected, InvalidSelection {

    /**
     * 원시 입력을 연산 목록에 대해 해석.
     *
     * <p><strong>해석 규칙:</strong></p>
     * <ol>
     *   <li>null (입력 종료) 또는 공백만 있는 입력 → MISSING_INPUT</li>
     *   <li>앞뒤 공백 제거 후 정수로 파싱 실패 → NOT_A_NUMBER</li>
     *   <li>[1, N] 범위 밖 → OUT_OF_RANGE</li>
     *   <li>그 외 → Selected(value, operations[value - 1])</li>
     * </ol>
     *
     * @param rawInput 사용자가 입력한 한 줄 (null 가능)
     * @param operations 메뉴에 표시된 연산 목록 (표시 순서)
     * @return 선택 결과 (non-null)
     * @throws IllegalArgumentException operations가 null인 경우
     */
    static Selection resolve(String rawInput, List<? extends Operation> operations) {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        if (rawInput == null || rawInput.isBlank()) {
            return InvalidSelection.of(rawInput, InvalidSelection.Reason.MISSING_INPUT);
        }

        int index;
        try {
            index = Integer.parseInt(rawInput.trim());
        } catch (NumberFormatException e) {
            return InvalidSelection.of(rawInput, InvalidSelection.Reason.NOT_A_NUMBER);
        }

        if (index < 1 || index > operations.size()) {
            return InvalidSelection.of(rawInput, InvalidSelection.Reason.OUT_OF_RANGE);
        }
        return new Selected(index, operations.get(index - 1));
    }

    /**
     * 선택된 연산 조회.
     *
     * @return Selected인 경우 연산, 아니면 empty
     */
    default Optional<Operation> selectedOperation() {
        if (this instanceof Selected selected) {
            return Optional.of(selected.operation());
        }
        return Optional.empty();
    }

    /**
     * 유효한 선택인지 확인.
     *
     * @return Selected인 경우 true
     */
    default boolean isSelected() {
        return this instanceof Selected;
    }
}
