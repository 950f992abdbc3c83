/**
 * Contract test bases for SPI implementations.
 *
 * <p>Adapters extend these classes in their own test sources so every implementation
 * is checked against the same expectations.</p>
 *
 * @since 1.0.0
 * @author Calculator Team
 */
package com.ryuqq.calculator.testkit.contract;
