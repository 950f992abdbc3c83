package com.ryuqq.calculator.testkit.contract;

import com.ryuqq.calculator.core.spi.OperationRegistry;

import java.util.List;

/**
 * Empty listings are legal: the contract must hold with N = 0.
 *
 * @author Calculator Team
 * @since 1.0.0
 */
class EmptyRegistryContractTest extends AbstractOperationRegistryContractTest {

    @Override
    protected OperationRegistry createRegistry() {
        return List::of;
    }
}
