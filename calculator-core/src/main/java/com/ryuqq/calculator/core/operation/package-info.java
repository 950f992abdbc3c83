/**
 * Arithmetic operation package.
 *
 * <p>Defines the sealed {@link com.ryuqq.calculator.core.operation.Operation} capability
 * ({@code name} + {@code compute}) and its five variants.</p>
 *
 * <h2>Arity Rules</h2>
 * <ul>
 *   <li>{@link com.ryuqq.calculator.core.operation.Addition} - any count, empty → 0</li>
 *   <li>{@link com.ryuqq.calculator.core.operation.Subtraction} - at least 1</li>
 *   <li>{@link com.ryuqq.calculator.core.operation.Multiplication} - any count, empty → 1</li>
 *   <li>{@link com.ryuqq.calculator.core.operation.Division} - at least 1, no zero divisor</li>
 *   <li>{@link com.ryuqq.calculator.core.operation.SquareRoot} - exactly 1, non-negative</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Calculator Team
 */
package com.ryuqq.calculator.core.operation;
