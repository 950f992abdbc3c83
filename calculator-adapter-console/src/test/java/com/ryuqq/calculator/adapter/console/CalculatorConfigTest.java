package com.ryuqq.calculator.adapter.console;

import com.ryuqq.calculator.application.menu.MenuStyle;
import com.ryuqq.calculator.core.model.Operands;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CalculatorConfig 유닛 테스트.
 *
 * @author Calculator Team
 * @since 1.0.0
 */
class CalculatorConfigTest {

    @Test
    void 기본_설정은_10_5_와_COMPACT() {
        // when
        CalculatorConfig config = new CalculatorConfig();

        // then
        assertThat(config.operands()).isEqualTo(Operands.of(10, 5));
        assertThat(config.menuStyle()).isEqualTo(MenuStyle.COMPACT);
    }

    @Test
    void with_메서드는_한_항목만_바꾼_새_인스턴스() {
        // given
        CalculatorConfig config = new CalculatorConfig();

        // when
        CalculatorConfig changed = config.withMenuStyle(MenuStyle.CLASSIC);

        // then
        assertThat(changed.menuStyle()).isEqualTo(MenuStyle.CLASSIC);
        assertThat(changed.operands()).isEqualTo(config.operands());
        assertThat(config.menuStyle()).isEqualTo(MenuStyle.COMPACT);
        assertThat(config.withOperands(Operands.of(1)).operands()).isEqualTo(Operands.of(1));
    }

    @Test
    void null_값은_거부() {
        assertThatThrownBy(() -> new CalculatorConfig(null, MenuStyle.COMPACT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("operands cannot be null");
        assertThatThrownBy(() -> new CalculatorConfig(Operands.of(1), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("menuStyle cannot be null");
    }
}
