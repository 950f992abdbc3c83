package com.ryuqq.calculator.core.selection;

/**
 * 유효하지 않은 선택.
 *
 * <p>연산을 가리키지 않는 입력을 나타내며, 호출자는 이 결과로 연산을 실행해서는 안 됩니다.</p>
 *
 * @param input 사용자가 입력한 원문 (입력 종료 시 null)
 * @param reason 거부 사유
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public record InvalidSelection(
    String input,
    Reason reason
) implements Selection {

    /**
     * 거부 사유.
     */
    public enum Reason {

        /**
         * 입력 없음 (EOF 또는 빈 줄).
         */
        MISSING_INPUT,

        /**
         * 정수로 해석할 수 없음.
         */
        NOT_A_NUMBER,

        /**
         * 메뉴 범위 [1, N] 밖.
         */
        OUT_OF_RANGE
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null인 경우
     */
    public InvalidSelection {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        // input은 null 허용 (입력 종료)
    }

    /**
     * InvalidSelection 생성.
     *
     * @param input 원문 입력
     * @param reason 거부 사유
     * @return InvalidSelection 인스턴스
     */
    public static InvalidSelection of(String input, Reason reason) {
        return new InvalidSelection(input, reason);
    }

    /**
     * 사용자에게 보여줄 설명.
     *
     * @return 사유와 입력을 포함한 설명
     */
    public String describe() {
        return switch (reason) {
            case MISSING_INPUT -> "no input was given";
            case NOT_A_NUMBER -> quotedInput() + " is not a number";
            case OUT_OF_RANGE -> quotedInput() + " is not a menu item";
        };
    }

    private String quotedInput() {
        return "'" + (input == null ? "" : input.trim()) + "'";
    }
}
