package com.ryuqq.calculator.core.exception;

import com.ryuqq.calculator.core.selection.InvalidSelection;

/**
 * 메뉴 선택이 유효하지 않아 실행을 중단하는 경우.
 *
 * <p>메뉴 자체는 {@link InvalidSelection} 값을 반환할 뿐 예외를 던지지 않습니다.
 * 이 예외는 선택 결과를 확인한 호출자가 실행을 명시적으로 중단할 때 사용합니다.</p>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class InvalidSelectionException extends CalculatorException {

    public static final String ERROR_CODE = "CALC-004";

    private final InvalidSelection selection;

    /**
     * 생성자.
     *
     * @param selection 거부된 선택
     * @throws IllegalArgumentException selection이 null인 경우
     */
    public InvalidSelectionException(InvalidSelection selection) {
        super(ERROR_CODE, describe(selection));
        this.selection = selection;
    }

    public InvalidSelection getSelection() {
        return selection;
    }

    private static String describe(InvalidSelection selection) {
        if (selection == null) {
            throw new IllegalArgumentException("selection cannot be null");
        }
        return "Invalid selection: " + selection.describe();
    }
}
