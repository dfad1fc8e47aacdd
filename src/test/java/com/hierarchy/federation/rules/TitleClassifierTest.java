package com.hierarchy.federation.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Title rules Tests")
class TitleClassifierTest {

    private final TitleCanonicalizer canonicalizer =
            new TitleCanonicalizer(DefaultNormalizationRules.getTitleSynonyms());
    private final TitleClassifier classifier = new TitleClassifier(canonicalizer,
            DefaultNormalizationRules.getLeadershipKeywords(),
            DefaultNormalizationRules.getManagerKeywords());

    @Nested
    @DisplayName("Canonicalization")
    class CanonicalizerTests {

        @Test
        @DisplayName("Abbreviations expand token by token")
        void expandsTokens() {
            assertEquals("senior manager", canonicalizer.canonicalize("Sr. Mgr"));
            assertEquals("vice president sales", canonicalizer.canonicalize("VP, Sales"));
        }

        @Test
        @DisplayName("A whole-title synonym wins over token expansion")
        void wholeTitleSynonym() {
            TitleCanonicalizer custom = new TitleCanonicalizer(Map.of(
                    "Head Honcho", "Chief Executive Officer",
                    "head", "lead"));
            assertEquals(List.of("chief", "executive", "officer"), custom.canonicalTokens("head  honcho"));
            assertEquals(List.of("lead", "of", "sales"), custom.canonicalTokens("Head of Sales"));
        }

        @Test
        @DisplayName("Blank titles have no tokens")
        void blankTitle() {
            assertTrue(canonicalizer.canonicalTokens("  ").isEmpty());
            assertEquals("", canonicalizer.canonicalize(null));
        }
    }

    @Nested
    @DisplayName("Classification")
    class ClassificationTests {

        @ParameterizedTest
        @ValueSource(strings = {"Marketing Director", "VP Sales", "Vice President, Sales",
                "Chief Financial Officer", "CFO", "Master Agent", "Head of Operations"})
        @DisplayName("Leadership titles")
        void leadership(String title) {
            assertTrue(classifier.isLeadership(title), title);
        }

        @ParameterizedTest
        @ValueSource(strings = {"Engineering Manager", "Sr. Mgr", "Team Lead", "Shift Supervisor"})
        @DisplayName("Manager titles")
        void manager(String title) {
            assertTrue(classifier.isManager(title), title);
            assertFalse(classifier.isLeadership(title), title);
        }

        @ParameterizedTest
        @ValueSource(strings = {"Software Engineer", "Headquarters Clerk", "Team Leader", ""})
        @DisplayName("Keywords only match whole token runs")
        void contributors(String title) {
            assertTrue(classifier.classify(title).isEmpty(), title);
        }

        @Test
        @DisplayName("A title may carry both roles")
        void bothRoles() {
            assertEquals(EnumSet.allOf(Role.class), classifier.classify("Director and Project Lead"));
        }

        @Test
        @DisplayName("Keyword tables are configurable")
        void customKeywords() {
            TitleClassifier custom = new TitleClassifier(canonicalizer, Set.of("Partner"), Set.of("Coordinator"));

            assertTrue(custom.isLeadership("Senior Partner"));
            assertFalse(custom.isLeadership("Marketing Director"));
            assertTrue(custom.isManager("Event Coordinator"));
        }
    }
}
