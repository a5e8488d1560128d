package com.pyformatter.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NumericNormalizerTest {

    @ParameterizedTest
    @CsvSource({
            "0XABCDEF, 0xABCDEF",
            "0xabcdef, 0xABCDEF",
            "0O17, 0o17",
            "0B101, 0b101",
            "1E5, 1e5",
            "1E+5, 1e5",
            "1.5E-3, 1.5e-3",
            "10J, 10j",
            "1., 1.0",
            ".5, 0.5",
            "1_000, 1_000",
            "123, 123",
    })
    void literals(String input, String expected) {
        assertEquals(expected, NumericNormalizer.normalize(input));
    }
}
