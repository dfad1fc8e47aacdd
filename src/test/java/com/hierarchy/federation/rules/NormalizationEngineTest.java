package com.hierarchy.federation.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize(""));
        assertEquals("", engine.normalize("   "));
    }

    @ParameterizedTest
    @DisplayName("Should strip honorifics and suffixes")
    @CsvSource({
            "Dr. Sarah Johnson,sarah johnson",
            "Mrs Sarah Johnson,sarah johnson",
            "Robert Smith Jr.,robert smith",
            "'Robert Smith, PhD',robert smith",
            "'Robert Smith, Jr., MD',robert smith"
    })
    void testHonorificsAndSuffixes(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @ParameterizedTest
    @DisplayName("Should fold diacritics and punctuation")
    @CsvSource({
            "José Álvarez,jose alvarez",
            "Zoë O'Brien,zoe obrien",
            "'Smith,   John',smith john",
            "Mary-Kate Olsen,mary kate olsen"
    })
    void testDiacriticsAndPunctuation(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @Test
    @DisplayName("Should keep names that merely contain honorific letters")
    void testHonorificOnlyAtStart() {
        assertEquals("drew mrsic", engine.normalize("Drew Mrsic"));
    }

    @Test
    @DisplayName("Should apply rules in priority order")
    void testRulePriority() {
        NormalizationEngine custom = new NormalizationEngine(List.of(
                NormalizationRule.builder().name("second").pattern("b").replacement("c").priority(20).build(),
                NormalizationRule.builder().name("first").pattern("a").replacement("b").priority(10).build()));

        assertEquals("first", custom.getRules().get(0).getName());
        assertEquals("cc", custom.normalize("ab"));
    }

    @Test
    @DisplayName("Equivalent names fold to the same key")
    void testEquivalence() {
        assertTrue(engine.areEquivalent("Dr. SARAH  Johnson", "sarah johnson"));
        assertFalse(engine.areEquivalent("Sarah Johnson", "Sara Johnson"));
    }
}
