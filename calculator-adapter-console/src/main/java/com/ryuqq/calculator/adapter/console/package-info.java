/**
 * Console adapter: menu rendering, the menu-driven calculator and the process entry point.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.calculator.adapter.console.ConsoleMenu} - line-buffered {@code Menu} over a reader and a print stream</li>
 *   <li>{@link com.ryuqq.calculator.adapter.console.MenuDrivenCalculator} - registry → menu → compute → print</li>
 *   <li>{@link com.ryuqq.calculator.adapter.console.CalculatorConfig} - operands and menu style</li>
 *   <li>{@link com.ryuqq.calculator.adapter.console.CalculatorMain} - explicit wiring and top-level error reporting</li>
 * </ul>
 *
 * <h2>Output Streams</h2>
 * <p>Menu, result and error lines go to the given print stream (stdout for the real process).
 * SLF4J diagnostics go to stderr, configured by {@code simplelogger.properties}.</p>
 *
 * @since 1.0.0
 * @author Calculator Team
 */
package com.ryuqq.calculator.adapter.console;
