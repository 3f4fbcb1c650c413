package com.catalog.reconciliation.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class NameNormalizerTest {

    private NameNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = NameNormalizer.createDefault();
    }

    @Nested
    @DisplayName("Default rules")
    class DefaultRules {

        @ParameterizedTest
        @CsvSource({
                "'Massage   Therapy!', 'massage therapy'",
                "'massage therapy', 'massage therapy'",
                "'  Skin-Care  ', 'skincare'",
                "'Botox & Fillers', 'botox fillers'",
                "'Dr. O''Neil', 'dr oneil'",
                "'Facial (60 min)', 'facial 60 min'",
                "'Épilation Laser', 'épilation laser'"
        })
        @DisplayName("Should normalize display names")
        void normalizes(String input, String expected) {
            assertEquals(expected, normalizer.normalize(input));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t\n"})
        @DisplayName("Should yield the empty key for null or blank input")
        void emptyForBlank(String input) {
            assertEquals("", normalizer.normalize(input));
        }

        @Test
        @DisplayName("Should yield the empty key for punctuation only")
        void emptyForPunctuation() {
            assertEquals("", normalizer.normalize("!!! ---"));
        }

        @Test
        @DisplayName("Should drop underscores")
        void dropsUnderscore() {
            assertEquals("skincare", normalizer.normalize("skin_care"));
        }

        @Test
        @DisplayName("Should be idempotent")
        void idempotent() {
            String once = normalizer.normalize("  The   Spa -- Deluxe!  ");
            assertEquals(once, normalizer.normalize(once));
        }

        @Test
        @DisplayName("Should never leave a double space or surrounding whitespace")
        void collapsed() {
            String key = normalizer.normalize(" a ! b  ?  c ");
            assertEquals("a b c", key);
        }
    }

    @Test
    @DisplayName("Equivalence requires a shared non-empty key")
    void equivalence() {
        assertTrue(normalizer.areEquivalent("Massage Therapy", "massage   therapy"));
        assertFalse(normalizer.areEquivalent("Massage", "Facial"));
        assertFalse(normalizer.areEquivalent("", ""));
        assertFalse(normalizer.areEquivalent("!!", "??"));
    }

    @Test
    @DisplayName("Should apply custom rules in priority order")
    void customRules() {
        normalizer.addRule(NormalizationRule.builder()
                .name("expand-ampersand")
                .pattern("&")
                .replacement(" and ")
                .priority(10)
                .build());

        assertEquals("botox and fillers", normalizer.normalize("Botox & Fillers"));
        assertEquals("expand-ampersand", normalizer.getRules().get(0).getName());
    }

    @Test
    @DisplayName("Should remove rules by name")
    void removeRule() {
        assertTrue(normalizer.removeRule("strip-special-chars"));
        assertTrue(normalizer.getRules().isEmpty());
        assertEquals("skin-care", normalizer.normalize("Skin-Care"));
    }

    @Test
    @DisplayName("Rule builder should require name, pattern and replacement")
    void ruleBuilderValidation() {
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder()
                .pattern("x").replacement("").build());
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder()
                .name("x").replacement("").build());
    }
}
