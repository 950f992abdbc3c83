package com.ryuqq.calculator.application.menu;

import com.ryuqq.calculator.core.operation.Operation;

/**
 * 메뉴 표시 형식.
 *
 * <p>선택 규칙은 동일하고 헤더와 항목 형식만 다릅니다.</p>
 *
 * <pre>
 * CLASSIC                          COMPACT
 * ======== CALCULATOR ========     ....CALCULATOR....
 * 1. OPERATION Addition            1. Addition
 * 2. OPERATION Subtraction         2. Subtraction
 * Choose an operation:             Choose an operation:
 * </pre>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public enum MenuStyle {

    /**
     * 구분선 헤더, 항목마다 OPERATION 접두어.
     */
    CLASSIC("======== CALCULATOR ========", "%d. OPERATION %s"),

    /**
     * 간결한 헤더, 연산 이름만 표시.
     */
    COMPACT("....CALCULATOR....", "%d. %s");

    /**
     * 모든 스타일이 공유하는 입력 프롬프트 (줄바꿈 없음).
     */
    public static final String PROMPT = "Choose an operation: ";

    private final String header;
    private final String itemFormat;

    MenuStyle(String header, String itemFormat) {
        this.header = header;
        this.itemFormat = itemFormat;
    }

    public String header() {
        return header;
    }

    /**
     * 메뉴 항목 한 줄 생성.
     *
     * @param index 1-based 인덱스
     * @param operation 연산
     * @return 항목 문자열
     * @throws IllegalArgumentException operation이 null인 경우
     */
    public String formatItem(int index, Operation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return String.format(itemFormat, index, operation.name());
    }
}
