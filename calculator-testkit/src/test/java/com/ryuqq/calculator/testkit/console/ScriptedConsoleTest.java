package com.ryuqq.calculator.testkit.console;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScriptedConsole 유닛 테스트.
 *
 * @author Calculator Team
 * @since 1.0.0
 */
class ScriptedConsoleTest {

    @Test
    void 입력_줄을_순서대로_읽음() throws IOException {
        // given
        ScriptedConsole console = ScriptedConsole.withInput("1", "abc");

        // when & then
        assertThat(console.reader().readLine()).isEqualTo("1");
        assertThat(console.reader().readLine()).isEqualTo("abc");
        assertThat(console.reader().readLine()).isNull();
    }

    @Test
    void 입력이_없으면_null() throws IOException {
        assertThat(ScriptedConsole.withoutInput().reader().readLine()).isNull();
    }

    @Test
    void 출력을_줄_단위로_캡처() {
        // given
        ScriptedConsole console = ScriptedConsole.withInput();

        // when
        console.out().println("header");
        console.out().print("prompt: ");
        console.out().println("15");

        // then
        assertThat(console.outputLines()).containsExactly("header", "prompt: 15");
        assertThat(console.lastLine()).isEqualTo("prompt: 15");
    }

    @Test
    void 출력이_없으면_마지막_줄은_빈_문자열() {
        assertThat(ScriptedConsole.withoutInput().lastLine()).isEmpty();
    }

    @Test
    void lines가_null이면_예외() {
        assertThatThrownBy(() -> ScriptedConsole.withInput((String[]) null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
