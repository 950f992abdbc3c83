/**
 * Console fixtures for tests.
 *
 * <ul>
 *   <li>{@link com.ryuqq.calculator.testkit.console.ScriptedConsole} - canned stdin, captured stdout</li>
 *   <li>{@link com.ryuqq.calculator.testkit.console.ScriptedMenu} - menu that answers with a fixed input</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Calculator Team
 */
package com.ryuqq.calculator.testkit.console;
