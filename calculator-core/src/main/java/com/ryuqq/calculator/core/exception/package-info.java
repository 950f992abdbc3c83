/**
 * Calculator error hierarchy.
 *
 * <p>All domain failures extend {@link com.ryuqq.calculator.core.exception.CalculatorException}
 * and carry a stable error code that the console bootstrap prints next to the message.</p>
 *
 * <h2>Propagation</h2>
 * <ul>
 *   <li>Operation errors (arity, argument domain, division by zero) are thrown where the
 *       computation happens and propagate to the top-level run.</li>
 *   <li>Invalid menu input is a plain value ({@link com.ryuqq.calculator.core.selection.InvalidSelection});
 *       the caller converts it into {@link com.ryuqq.calculator.core.exception.InvalidSelectionException}.</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Calculator Team
 */
package com.ryuqq.calculator.core.exception;
