package com.ryuqq.calculator.adapter.console;

import com.ryuqq.calculator.application.menu.MenuStyle;
import com.ryuqq.calculator.core.model.Operands;

/**
 * 콘솔 계산기 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>operands: 선택된 연산에 전달할 피연산자 (기본 [10, 5])</li>
 *   <li>menuStyle: 메뉴 표시 형식 (기본 COMPACT)</li>
 * </ul>
 *
 * @author Calculator Team
 * @since 1.0.0
 * @param operands 피연산자 (null 불가)
 * @param menuStyle 메뉴 표시 형식 (null 불가)
 */
public record CalculatorConfig(
    Operands operands,
    MenuStyle menuStyle
) {

    /**
     * 기본 피연산자.
     */
    public static final Operands DEFAULT_OPERANDS = Operands.of(10, 5);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: operands=[10, 5], menuStyle=COMPACT</p>
     */
    public CalculatorConfig() {
        this(DEFAULT_OPERANDS, MenuStyle.COMPACT);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CalculatorConfig {
        if (operands == null) {
            throw new IllegalArgumentException("operands cannot be null");
        }
        if (menuStyle == null) {
            throw new IllegalArgumentException("menuStyle cannot be null");
        }
    }

    /**
     * operands만 변경한 새 인스턴스 생성.
     */
    public CalculatorConfig withOperands(Operands operands) {
        return new CalculatorConfig(operands, menuStyle);
    }

    /**
     * menuStyle만 변경한 새 인스턴스 생성.
     */
    public CalculatorConfig withMenuStyle(MenuStyle menuStyle) {
        return new CalculatorConfig(operands, menuStyle);
    }
}
