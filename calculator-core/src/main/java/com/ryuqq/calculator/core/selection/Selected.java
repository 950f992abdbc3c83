package com.ryuqq.calculator.core.selection;

import com.ryuqq.calculator.core.operation.Operation;

/**
 * 유효한 선택.
 *
 * @param index 1-based 메뉴 인덱스
 * @param operation 선택된 연산
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public record Selected(
    int index,
    Operation operation
) implements Selection {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException index가 1 미만이거나 operation이 null인 경우
     */
    public Selected {
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive (current: " + index + ")");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
    }
}
