package com.hierarchy.federation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrossReference Tests")
class CrossReferenceTest {

    private static final RecordKey LADDER = RecordKey.of("ladder", "L1");
    private static final RecordKey DEPT = RecordKey.of("department", "D9");
    private static final RecordKey ORG = RecordKey.of("orgchart", "E4");

    @Test
    @DisplayName("Needs at least two members")
    void requiresTwoMembers() {
        assertThrows(IllegalArgumentException.class,
                () -> new CrossReference(List.of(LADDER), 0.8, false, List.of()));
    }

    @Test
    @DisplayName("Confidence must be within [0, 1]")
    void confidenceRange() {
        assertThrows(IllegalArgumentException.class,
                () -> new CrossReference(List.of(LADDER, DEPT), 1.2, true, List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new CrossReference(List.of(LADDER, DEPT), -0.1, false, List.of()));
    }

    @Test
    @DisplayName("Signals are the union of contributing edge signals")
    void signalUnion() {
        MatchEvidence nameOnly = new MatchEvidence(LADDER, DEPT, 1.0, 0.0, 0.0, 0.6);
        MatchEvidence withStructure = new MatchEvidence(DEPT, ORG, 0.9, 0.0, 1.0, 0.69);
        CrossReference ref = new CrossReference(List.of(LADDER, DEPT, ORG), 0.6, false,
                List.of(nameOnly, withStructure));

        assertEquals(EnumSet.of(Signal.NAME, Signal.STRUCTURE), ref.signals());
        assertEquals(List.of("ladder", "department", "orgchart"), ref.sourceSystems());
        assertTrue(ref.contains(ORG));
        assertEquals(3, ref.size());
    }

    @Test
    @DisplayName("Evidence values outside [0, 1] are rejected")
    void evidenceRange() {
        assertThrows(IllegalArgumentException.class,
                () -> new MatchEvidence(LADDER, DEPT, 1.1, 0.0, 0.0, 0.5));
        assertTrue(new MatchEvidence(LADDER, DEPT, 1.0, 0.3, 0.5, 0.75).involves(DEPT));
    }
}
