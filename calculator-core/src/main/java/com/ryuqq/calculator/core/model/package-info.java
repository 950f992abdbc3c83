/**
 * Value objects shared by every module.
 *
 * <ul>
 *   <li>{@link com.ryuqq.calculator.core.model.Operands} - immutable operand sequence</li>
 *   <li>{@link com.ryuqq.calculator.core.model.Calculation} - record of one completed run</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Calculator Team
 */
package com.ryuqq.calculator.core.model;
