package com.ryuqq.calculator.adapter.console;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ResultFormatter 유닛 테스트.
 *
 * @author Calculator Team
 * @since 1.0.0
 */
class ResultFormatterTest {

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
        "15.0, 15",
        "2.0, 2",
        "-7.0, -7",
        "0.0, 0",
        "-0.0, 0",
        "0.5, 0.5",
        "3.1622776601683795, 3.1622776601683795",
        "1.0E-7, 0.0000001",
        "1.0E20, 100000000000000000000",
        "NaN, NaN",
        "Infinity, Infinity",
        "-Infinity, -Infinity"
    })
    void format(double value, String expected) {
        assertThat(ResultFormatter.format(value)).isEqualTo(expected);
    }
}
