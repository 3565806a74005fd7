package com.di.epistream.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NameNormalizer Tests")
class NameNormalizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Côte d'Ivoire|cote d ivoire",
        "  UNITED   Kingdom |united kingdom",
        "Bosnia & Herzegovina|bosnia and herzegovina",
        "The Bahamas|bahamas",
        "Korea, South|korea south",
        "Taiwan*|taiwan",
        "Türkiye|turkiye"
    })
    @DisplayName("Should normalize labels to alias keys")
    void testNormalize(String input, String expected) {
        assertEquals(expected, NameNormalizer.normalize(input));
    }

    @Test
    @DisplayName("Should normalize blank and null input to empty key")
    void testNormalize_Empty() {
        assertEquals("", NameNormalizer.normalize("  "));
        assertEquals("", NameNormalizer.normalize("***"));
        assertEquals("", NameNormalizer.normalize(null));
    }
}
