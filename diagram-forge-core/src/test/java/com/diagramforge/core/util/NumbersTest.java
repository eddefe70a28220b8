package com.diagramforge.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Numbers}.
 */
class NumbersTest {

    @ParameterizedTest
    @CsvSource({
        "100.0, 100",
        "0.0, 0",
        "-40.0, -40",
        "12.5, 12.5",
        "0.25, 0.25",
        "1.10, 1.1"
    })
    void format_writesShortestPlainForm(double value, String expected) {
        assertThat(Numbers.format(value)).isEqualTo(expected);
    }

    @Test
    void format_withNaN_returnsZero() {
        assertThat(Numbers.format(Double.NaN)).isEqualTo("0");
        assertThat(Numbers.format(Double.POSITIVE_INFINITY)).isEqualTo("0");
    }

    @Test
    void parse_withNumber_returnsValue() {
        assertThat(Numbers.parse(" 42.5 ")).isEqualTo(42.5);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "abc", "12px"})
    void parse_withMissingOrMalformedText_returnsNull(String text) {
        assertThat(Numbers.parse(text)).isNull();
    }
}
