package com.hierarchy.federation.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PersonRecord Tests")
class PersonRecordTest {

    private static PersonRecord.Builder minimal() {
        return PersonRecord.builder()
                .sourceSystem("orgchart")
                .sourceId("E1")
                .canonicalName("Jane Smith");
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Should require identity and name")
        void requiresIdentityAndName() {
            assertThrows(NullPointerException.class, () -> PersonRecord.builder()
                    .sourceId("E1").canonicalName("Jane").build());
            assertThrows(NullPointerException.class, () -> PersonRecord.builder()
                    .sourceSystem("orgchart").canonicalName("Jane").build());
            assertThrows(IllegalArgumentException.class, () -> minimal().canonicalName("  ").build());
        }

        @Test
        @DisplayName("Optional fields default to empty")
        void optionalDefaults() {
            PersonRecord record = minimal().build();

            assertEquals("", record.getTitle());
            assertEquals("", record.getNormalizedNameKey());
            assertTrue(record.getDepartment().isEmpty());
            assertTrue(record.getLevel().isEmpty());
            assertTrue(record.getReportsTo().isEmpty());
            assertTrue(record.getAliases().isEmpty());
            assertNull(record.getRawSource());
            assertFalse(record.hasNameKey());
        }

        @Test
        @DisplayName("Key combines source system and id")
        void keyFromParts() {
            PersonRecord record = minimal().build();
            assertEquals(RecordKey.of("orgchart", "E1"), record.getKey());
            assertEquals("orgchart", record.getSourceSystem());
            assertEquals("E1", record.getSourceId());
        }
    }

    @Nested
    @DisplayName("Immutability")
    class ImmutabilityTests {

        @Test
        @DisplayName("Alias list is copied on build")
        void aliasesCopied() {
            List<String> aliases = new ArrayList<>(List.of("Janie"));
            PersonRecord record = minimal().aliases(aliases).build();
            aliases.add("J. Smith");

            assertEquals(List.of("Janie"), record.getAliases());
            assertThrows(UnsupportedOperationException.class, () -> record.getAliases().add("x"));
        }

        @Test
        @DisplayName("Raw source cannot be modified through the record")
        void rawSourceCopied() {
            ObjectNode raw = JsonNodeFactory.instance.objectNode().put("id", "E1");
            PersonRecord record = minimal().rawSource(raw).build();

            raw.put("id", "changed");
            ((ObjectNode) record.getRawSource()).put("id", "changed again");

            assertEquals("E1", record.getRawSource().get("id").asText());
        }
    }

    @Nested
    @DisplayName("Roles")
    class RoleTests {

        @Test
        @DisplayName("Contributor is neither leadership nor manager")
        void contributor() {
            assertTrue(minimal().build().isContributor());
            assertFalse(minimal().leadership(true).build().isContributor());
            assertFalse(minimal().manager(true).build().isContributor());
        }

        @Test
        @DisplayName("Leadership and manager are not exclusive")
        void nonExclusive() {
            PersonRecord record = minimal().leadership(true).manager(true).build();
            assertTrue(record.isLeadership());
            assertTrue(record.isManager());
        }
    }
}
