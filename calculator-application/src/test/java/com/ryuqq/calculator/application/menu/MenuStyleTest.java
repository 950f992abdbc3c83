package com.ryuqq.calculator.application.menu;

import com.ryuqq.calculator.core.operation.Addition;
import com.ryuqq.calculator.core.operation.SquareRoot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MenuStyle 유닛 테스트.
 *
 * @author Calculator Team
 * @since 1.0.0
 */
class MenuStyleTest {

    @Test
    void CLASSIC_항목은_OPERATION_접두어() {
        assertThat(MenuStyle.CLASSIC.header()).isEqualTo("======== CALCULATOR ========");
        assertThat(MenuStyle.CLASSIC.formatItem(1, new Addition())).isEqualTo("1. OPERATION Addition");
    }

    @Test
    void COMPACT_항목은_인덱스와_이름만() {
        assertThat(MenuStyle.COMPACT.header()).isEqualTo("....CALCULATOR....");
        assertThat(MenuStyle.COMPACT.formatItem(5, new SquareRoot())).isEqualTo("5. Square root");
    }

    @Test
    void 프롬프트는_줄바꿈_없음() {
        assertThat(MenuStyle.PROMPT).doesNotContain("\n").endsWith(": ");
    }

    @Test
    void operation이_null이면_예외() {
        assertThatThrownBy(() -> MenuStyle.COMPACT.formatItem(1, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("operation cannot be null");
    }
}
