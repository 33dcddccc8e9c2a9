package com.datatoexcel.converter.cli.output;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConvertResultsPrinter.
 */
class ConvertResultsPrinterTest {

    @Test
    void testFormatSeconds() {
        assertThat(ConvertResultsPrinter.formatSeconds(1_234_500_000L)).isEqualTo("1.2345");
        assertThat(ConvertResultsPrinter.formatSeconds(0L)).isEqualTo("0.0000");
    }
}
