package com.ryuqq.calculator.testkit.console;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * 콘솔 입출력 테스트 픽스처.
 *
 * <p>미리 준비한 입력 줄을 {@link BufferedReader}로 제공하고,
 * {@link PrintStream}에 쓰인 출력을 문자열로 캡처합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScriptedConsole console = ScriptedConsole.withInput("4");
 * Menu menu = new ConsoleMenu(console.reader(), console.out(), MenuStyle.COMPACT);
 * menu.select(operations);
 * assertThat(console.outputLines()).contains("4. Division");
 * </pre>
 *
 * @author Calculator Team
 * @since 1.0.0
 */
public final class ScriptedConsole {

    private final BufferedReader reader;
    private final ByteArrayOutputStream buffer;
    private final PrintStream out;

    private ScriptedConsole(String input) {
        this.reader = new BufferedReader(new StringReader(input));
        this.buffer = new ByteArrayOutputStream();
        this.out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    /**
     * 입력 줄을 가진 콘솔 생성.
     *
     * @param lines 입력 줄 (각 줄 끝에 줄바꿈 추가)
     * @return ScriptedConsole 인스턴스
     * @throws IllegalArgumentException lines가 null인 경우
     */
    public static ScriptedConsole withInput(String... lines) {
        if (lines == null) {
            throw new IllegalArgumentException("lines cannot be null");
        }
        StringBuilder input = new StringBuilder();
        for (String line : lines) {
            input.append(line).append(System.lineSeparator());
        }
        return new ScriptedConsole(input.toString());
    }

    /**
     * 입력이 없는 콘솔 생성 (첫 readLine()이 null 반환).
     *
     * @return ScriptedConsole 인스턴스
     */
    public static ScriptedConsole withoutInput() {
        return new ScriptedConsole("");
    }

    public BufferedReader reader() {
        return reader;
    }

    public PrintStream out() {
        return out;
    }

    /**
     * 지금까지 캡처된 출력.
     *
     * @return 출력 전체 (UTF-8)
     */
    public String output() {
        out.flush();
        return buffer.toString(StandardCharsets.UTF_8);
    }

    /**
     * 지금까지 캡처된 출력을 줄 단위로 분리.
     *
     * @return 출력 줄 목록 (마지막 빈 줄 제외)
     */
    public List<String> outputLines() {
        return Arrays.asList(output().split("\\R"));
    }

    /**
     * 마지막 출력 줄.
     *
     * @return 마지막 줄 (출력이 없으면 빈 문자열)
     */
    public String lastLine() {
        List<String> lines = outputLines();
        return lines.get(lines.size() - 1);
    }
}
