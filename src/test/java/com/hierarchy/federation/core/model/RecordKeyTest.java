package com.hierarchy.federation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordKey Tests")
class RecordKeyTest {

    @Test
    @DisplayName("Keys with the same system and id are equal")
    void equality() {
        assertEquals(RecordKey.of("orgchart", "E1"), new RecordKey("orgchart", "E1"));
        assertNotEquals(RecordKey.of("orgchart", "E1"), RecordKey.of("ladder", "E1"));
    }

    @Test
    @DisplayName("Blank parts are rejected")
    void rejectsBlankParts() {
        assertThrows(IllegalArgumentException.class, () -> RecordKey.of(" ", "E1"));
        assertThrows(IllegalArgumentException.class, () -> RecordKey.of("orgchart", ""));
        assertThrows(NullPointerException.class, () -> RecordKey.of(null, "E1"));
    }

    @Test
    @DisplayName("Keys sort by system, then id")
    void ordering() {
        List<RecordKey> keys = new ArrayList<>(List.of(
                RecordKey.of("orgchart", "B"),
                RecordKey.of("ladder", "Z"),
                RecordKey.of("orgchart", "A")));
        Collections.sort(keys);

        assertEquals(List.of(RecordKey.of("ladder", "Z"), RecordKey.of("orgchart", "A"),
                RecordKey.of("orgchart", "B")), keys);
    }

    @Test
    @DisplayName("toString renders system:id")
    void rendering() {
        assertEquals("ladder:A001", RecordKey.of("ladder", "A001").toString());
    }
}
