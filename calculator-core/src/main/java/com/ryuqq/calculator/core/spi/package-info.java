/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that adapters implement to supply the core with data.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.calculator.core.spi.OperationRegistry} - ordered listing of available operations</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>{@code calculator-adapter-inmemory} provides the fixed listing used by the console.
 * Implementations should extend the testkit's {@code AbstractOperationRegistryContractTest}.</p>
 *
 * @since 1.0.0
 * @author Calculator Team
 */
package com.ryuqq.calculator.core.spi;
