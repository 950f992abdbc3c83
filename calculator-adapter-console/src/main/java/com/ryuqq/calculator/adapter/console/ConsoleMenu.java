package com.ryuqq.calculator.adapter.console;

import com.ryuqq.calculator.application.menu.Menu;
import com.ryuqq.calculator.application.menu.MenuStyle;
import com.ryuqq.calculator.core.operation.Operation;
import com.ryuqq.calculator.core.selection.InvalidSelection;
import com.ryuqq.calculator.core.selection.Selection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * 콘솔 메뉴 구현체.
 *
 * <p>연산 목록을 {@link MenuStyle} 형식으로 출력하고, 입력 한 줄을 읽어 선택으로 해석합니다.</p>
 *
 * <p><strong>출력 예시 (COMPACT):</strong></p>
 * <pre>
 * ....CALCULATOR....
 * 1. Addition
 * 2. Subtraction
 * 3. Multiplication
 * 4. Division
 * 5. Square root
 * Choose an operation: _
 * </pre>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class ConsoleMenu implements Menu {

    private static final Logger log = LoggerFactory.getLogger(ConsoleMenu.class);

    private final BufferedReader in;
    private final PrintStream out;
    private final MenuStyle style;

    /**
     * 생성자.
     *
     * @param in 입력
     * @param out 출력
     * @param style 메뉴 표시 형식
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConsoleMenu(BufferedReader in, PrintStream out, MenuStyle style) {
        if (in == null) {
            throw new IllegalArgumentException("in cannot be null");
        }
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        if (style == null) {
            throw new IllegalArgumentException("style cannot be null");
        }
        this.in = in;
        this.out = out;
        this.style = style;
    }

    @Override
    public Selection select(List<Operation> operations) {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }

        display(operations);
        String line = readLine();
        Selection selection = Selection.resolve(line, operations);

        if (selection instanceof InvalidSelection invalid) {
            log.info("Rejected menu input: {} ({})", invalid.describe(), invalid.reason());
        } else {
            log.debug("Menu input '{}' selected {}", line, selection.selectedOperation().orElseThrow().name());
        }
        return selection;
    }

    private void display(List<Operation> operations) {
        out.println(style.header());
        for (int i = 0; i < operations.size(); i++) {
            out.println(style.formatItem(i + 1, operations.get(i)));
        }
        out.print(MenuStyle.PROMPT);
        out.flush();
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read menu selection", e);
        }
    }
}
