package com.ryuqq.calculator.testkit.console;

import com.ryuqq.calculator.application.menu.Menu;
import com.ryuqq.calculator.core.operation.Operation;
import com.ryuqq.calculator.core.selection.Selection;

import java.util.ArrayList;
import java.util.List;

/**
 * 화면 출력 없이 미리 정한 입력으로 선택하는 {@link Menu}.
 *
 * <p>입력 해석은 {@link Selection#resolve(String, List)}를 그대로 사용하므로
 * 콘솔 메뉴와 같은 선택 규칙을 따릅니다. 전달받은 목록은 기록되어 검증에 사용할 수 있습니다.</p>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class ScriptedMenu implements Menu {

    private final String rawInput;
    private final List<List<Operation>> presented = new ArrayList<>();

    private ScriptedMenu(String rawInput) {
        this.rawInput = rawInput;
    }

    /**
     * 항상 같은 입력을 돌려주는 메뉴 생성.
     *
     * @param rawInput 사용자 입력 (null이면 입력 종료)
     * @return ScriptedMenu 인스턴스
     */
    public static ScriptedMenu answering(String rawInput) {
        return new ScriptedMenu(rawInput);
    }

    @Override
    public Selection select(List<Operation> operations) {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        presented.add(List.copyOf(operations));
        return Selection.resolve(rawInput, operations);
    }

    /**
     * 지금까지 메뉴에 전달된 목록.
     *
     * @return select() 호출 순서대로의 목록
     */
    public List<List<Operation>> presented() {
        return List.copyOf(presented);
    }
}
