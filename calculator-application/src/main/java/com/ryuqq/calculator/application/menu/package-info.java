/**
 * Menu port and presentation styles.
 *
 * <p>{@link com.ryuqq.calculator.application.menu.Menu} renders an ordered listing and
 * returns a {@link com.ryuqq.calculator.core.selection.Selection}.
 * {@link com.ryuqq.calculator.application.menu.MenuStyle} is configuration, not a separate
 * menu type: every style selects the same way.</p>
 *
 * <p>The console implementation lives in {@code calculator-adapter-console}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.calculator.application.menu;
