package com.hierarchy.federation.ingest;

import com.hierarchy.federation.api.FederationOptions;
import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.core.model.RecordKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hierarchy.federation.TestRecords.json;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordNormalizer Tests")
class RecordNormalizerTest {

    private final RecordNormalizer normalizer = RecordNormalizer.from(FederationOptions.defaults());

    @Nested
    @DisplayName("Identity and names")
    class IdentityTests {

        @Test
        @DisplayName("Should keep the source id and fold the name key")
        void basicMapping() {
            PersonRecord record = normalizer.normalize(
                    json("{'employeeId':'E7','fullName':'  Dr.  José   Álvarez ','title':'Engineer'}"), "orgchart");

            assertEquals(RecordKey.of("orgchart", "E7"), record.getKey());
            assertEquals("Dr. José Álvarez", record.getCanonicalName());
            assertEquals("jose alvarez", record.getNormalizedNameKey());
            assertNotNull(record.getRawSource());
        }

        @Test
        @DisplayName("Numeric identifiers are read as text")
        void numericId() {
            PersonRecord record = normalizer.normalize(json("{'id':42,'name':'Ann Lee'}"), "orgchart");
            assertEquals("42", record.getSourceId());
        }

        @Test
        @DisplayName("Missing id or name is rejected with its position")
        void missingIdentity() {
            ValidationException noId = assertThrows(ValidationException.class,
                    () -> normalizer.normalize(json("{'name':'Ann Lee'}"), "orgchart", 3));
            assertEquals(3, noId.getPosition());
            assertEquals("orgchart", noId.getSourceSystem());

            assertThrows(ValidationException.class,
                    () -> normalizer.normalize(json("{'id':'E1','name':'   '}"), "orgchart"));
            assertThrows(ValidationException.class,
                    () -> normalizer.normalize(json("['not','an','object']"), "orgchart"));
        }

        @Test
        @DisplayName("A blank source tag is a caller error")
        void blankSourceSystem() {
            assertThrows(IllegalArgumentException.class,
                    () -> normalizer.normalize(json("{'id':'E1','name':'Ann'}"), " "));
        }

        @Test
        @DisplayName("Normalization is deterministic")
        void deterministic() {
            String raw = "{'id':'E1','name':'Ann Lee','title':'Team Lead','aliases':['Annie']}";
            assertEquals(normalizer.normalize(json(raw), "orgchart"), normalizer.normalize(json(raw), "orgchart"));
        }
    }

    @Nested
    @DisplayName("Ladder levels")
    class LadderTests {

        @Test
        @DisplayName("Level is derived from a native title")
        void levelFromTitle() {
            PersonRecord record = normalizer.normalize(
                    json("{'agentId':'A2','name':'Chris Brown','title':'Senior Sub-Agent'}"), "ladder");
            assertEquals(6, record.getLevel().orElseThrow());
        }

        @Test
        @DisplayName("Title is derived from the level")
        void titleFromLevel() {
            PersonRecord record = normalizer.normalize(
                    json("{'agentId':'A1','name':'Sarah Johnson','tier':'1'}"), "ladder");
            assertEquals(1, record.getLevel().orElseThrow());
            assertEquals("Master Agent", record.getTitle());
            assertTrue(record.isLeadership());
        }

        @Test
        @DisplayName("Whole-number decimal levels are accepted, fractional ones are not")
        void decimalLevels() {
            PersonRecord record = normalizer.normalize(
                    json("{'id':'A3','name':'Chris Brown','level':3.0}"), "ladder");
            assertEquals(3, record.getLevel().orElseThrow());

            assertThrows(ValidationException.class,
                    () -> normalizer.normalize(json("{'id':'A4','name':'X Y','level':3.5}"), "ladder"));
        }

        @Test
        @DisplayName("Out-of-range, malformed or missing levels are rejected")
        void invalidLevels() {
            assertThrows(ValidationException.class,
                    () -> normalizer.normalize(json("{'id':'A1','name':'X Y','level':9}"), "ladder"));
            assertThrows(ValidationException.class,
                    () -> normalizer.normalize(json("{'id':'A1','name':'X Y','level':'top'}"), "ladder"));
            assertThrows(ValidationException.class,
                    () -> normalizer.normalize(json("{'id':'A1','name':'X Y','title':'Regional Boss'}"), "ladder"));
        }

        @Test
        @DisplayName("Non-ladder sources ignore malformed levels")
        void nonLadderLevel() {
            PersonRecord record = normalizer.normalize(
                    json("{'id':'E1','name':'X Y','level':'senior'}"), "orgchart");
            assertTrue(record.getLevel().isEmpty());
        }
    }

    @Nested
    @DisplayName("Structure and roles")
    class StructureTests {

        @Test
        @DisplayName("reportsTo is scoped to the record's own source")
        void reportsToScoped() {
            PersonRecord record = normalizer.normalize(
                    json("{'id':'E2','name':'Bo Chen','managerId':'E1'}"), "orgchart");
            assertEquals(RecordKey.of("orgchart", "E1"), record.getReportsTo().orElseThrow());
        }

        @Test
        @DisplayName("Titles are classified into roles")
        void roles() {
            PersonRecord director = normalizer.normalize(
                    json("{'id':'D1','name':'Sarah Johnson','role':'Marketing Director','dept':'Marketing'}"),
                    "department");
            PersonRecord manager = normalizer.normalize(
                    json("{'id':'D2','name':'Michelle Rodriguez','role':'Marketing Manager'}"), "department");

            assertTrue(director.isLeadership());
            assertFalse(director.isManager());
            assertEquals("Marketing", director.getDepartment().orElseThrow());
            assertTrue(manager.isManager());
            assertTrue(manager.getDepartment().isEmpty());
        }

        @Test
        @DisplayName("Aliases are de-duplicated and folded")
        void aliases() {
            PersonRecord record = normalizer.normalize(
                    json("{'id':'E1','name':'Robert Smith','aliases':['Bob Smith','Bob  Smith','',null,'Dr. Bob Smith']}"),
                    "orgchart");

            assertEquals(List.of("Bob Smith", "Dr. Bob Smith"), record.getAliases());
            assertEquals(List.of("bob smith"), record.getNormalizedAliasKeys());
        }
    }

    @Test
    @DisplayName("Custom schemas replace field aliases per source")
    void customSchema() {
        FederationOptions options = FederationOptions.builder()
                .sourceSchema("hr", SourceSchema.builder()
                        .field(SourceSchema.Field.ID, "badge")
                        .field(SourceSchema.Field.NAME, "person")
                        .build())
                .build();
        RecordNormalizer custom = RecordNormalizer.from(options);

        PersonRecord record = custom.normalize(json("{'badge':'B1','person':'Ann Lee'}"), "hr");
        assertEquals("B1", record.getSourceId());
        assertThrows(ValidationException.class,
                () -> custom.normalize(json("{'id':'B1','name':'Ann Lee'}"), "hr"));
    }
}
