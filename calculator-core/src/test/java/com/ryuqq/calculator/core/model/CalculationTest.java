package com.ryuqq.calculator.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Calculation Record 테스트.
 *
 * @author Calculator Team
 * @since 1.0.0
 */
class CalculationTest {

    @Test
    void constructor_ValidValues_CreatesCalculation() {
        // When
        Calculation calculation = new Calculation("Addition", Operands.of(10, 5), 15);

        // Then
        assertEquals("Addition", calculation.operationName());
        assertEquals(Operands.of(10, 5), calculation.operands());
        assertEquals(15.0, calculation.result());
    }

    @Test
    void constructor_BlankOperationName_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new Calculation(" ", Operands.of(1), 1));
    }

    @Test
    void constructor_NullOperands_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Calculation("Addition", null, 1)
        );
        assertTrue(exception.getMessage().contains("operands cannot be null"));
    }

    @Test
    void equals_SameValues_ReturnsTrue() {
        // When & Then
        assertEquals(
            new Calculation("Division", Operands.of(10, 5), 2),
            new Calculation("Division", Operands.of(10, 5), 2)
        );
    }
}
