/**
 * In-memory OperationRegistry adapter.
 *
 * <p>This package contains the implementation of the
 * {@link com.ryuqq.calculator.core.spi.OperationRegistry} SPI that the console uses.
 * Operations are constructed once and held for the process lifetime.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.calculator.adapter.inmemory.registry.InMemoryOperationRegistry} - fixed ordered listing</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Calculator Team
 */
package com.ryuqq.calculator.adapter.inmemory.registry;
