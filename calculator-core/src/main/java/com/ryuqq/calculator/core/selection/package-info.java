/**
 * Menu selection result package.
 *
 * <p>This package defines the sealed interface hierarchy for resolving raw menu input
 * against an ordered operation listing.</p>
 *
 * <h2>Selection Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.calculator.core.selection.Selected} - valid 1-based index and its operation</li>
 *   <li>{@link com.ryuqq.calculator.core.selection.InvalidSelection} - missing, non-numeric, or out-of-range input</li>
 * </ul>
 *
 * <p>Invalid input never throws here; callers decide how to fail.</p>
 *
 * @since 1.0.0
 * @author Calculator Team
 */
package com.ryuqq.calculator.core.selection;
