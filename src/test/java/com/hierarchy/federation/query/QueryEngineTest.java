package com.hierarchy.federation.query;

import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.index.Index;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hierarchy.federation.TestRecords.index;
import static com.hierarchy.federation.TestRecords.record;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryEngine Tests")
class QueryEngineTest {

    private final QueryEngine engine = new QueryEngine();

    private PersonRecord director;
    private PersonRecord manager;
    private PersonRecord analyst;
    private PersonRecord salesLead;
    private PersonRecord ladderTop;
    private Index index;

    @BeforeEach
    void setUp() {
        director = record("department",
                "{'id':'mar001','name':'Sarah Johnson','title':'Marketing Director','department':'Marketing'}");
        manager = record("department",
                "{'id':'mar002','name':'Michelle Rodriguez','title':'Marketing Manager','department':'marketing',"
                        + "'reportsTo':'mar001'}");
        analyst = record("department",
                "{'id':'mar003','name':'Kevin Park','title':'Analyst','department':'Marketing','reportsTo':'mar002'}");
        salesLead = record("orgchart",
                "{'id':'E10','name':'Sarah Miller','title':'Sales Lead','department':'Sales'}");
        ladderTop = record("ladder", "{'id':'A001','name':'Chris Brown','level':1}");
        index = index(director, manager, analyst, salesLead, ladderTop);
    }

    @Test
    @DisplayName("An unfiltered query returns every record in index order")
    void unfiltered() {
        assertTrue(PersonQuery.all().isUnfiltered());
        assertEquals(index.records(), engine.query(index, PersonQuery.all()));
    }

    @Nested
    @DisplayName("Single predicates")
    class SinglePredicates {

        @Test
        @DisplayName("Department matches case-insensitively")
        void department() {
            List<PersonRecord> result = engine.query(index, PersonQuery.builder().department("MARKETING").build());
            assertEquals(List.of(director, manager, analyst), result);
        }

        @Test
        @DisplayName("Leadership false selects non-leaders")
        void notLeadership() {
            List<PersonRecord> result = engine.query(index, PersonQuery.builder().leadership(false).build());
            assertEquals(List.of(manager, analyst, salesLead), result);
        }

        @Test
        @DisplayName("Name fragment is case-insensitive")
        void nameContains() {
            List<PersonRecord> result = engine.query(index, PersonQuery.builder().nameContains("SARAH").build());
            assertEquals(List.of(director, salesLead), result);
        }

        @Test
        @DisplayName("Direct reports are resolved within the source")
        void hasDirectReports() {
            List<PersonRecord> result = engine.query(index, PersonQuery.builder().hasDirectReports(true).build());
            assertEquals(List.of(director, manager), result);
        }

        @Test
        @DisplayName("Unknown values match nothing")
        void unknownValues() {
            assertTrue(engine.query(index, PersonQuery.builder().department("Legal").build()).isEmpty());
            assertTrue(engine.query(index, PersonQuery.builder().sourceSystem("payroll").build()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Conjunctions")
    class Conjunctions {

        @Test
        @DisplayName("All predicates must hold")
        void conjunction() {
            PersonQuery query = PersonQuery.builder()
                    .department("Marketing")
                    .manager(true)
                    .build();
            assertEquals(List.of(manager), engine.query(index, query));
        }

        @Test
        @DisplayName("Source system and leadership")
        void systemAndLeadership() {
            PersonQuery query = PersonQuery.builder()
                    .sourceSystem("ladder")
                    .leadership(true)
                    .build();
            assertEquals(List.of(ladderTop), engine.query(index, query));
        }

        @Test
        @DisplayName("Contradicting predicates return an empty result")
        void contradiction() {
            PersonQuery query = PersonQuery.builder()
                    .department("Sales")
                    .sourceSystem("department")
                    .build();
            assertTrue(engine.query(index, query).isEmpty());
        }
    }

    @Test
    @DisplayName("Results cannot be modified")
    void unmodifiable() {
        List<PersonRecord> result = engine.query(index, PersonQuery.all());
        assertThrows(UnsupportedOperationException.class, () -> result.add(director));
    }

    @Test
    @DisplayName("An empty name fragment is rejected")
    void emptyFragment() {
        assertThrows(IllegalArgumentException.class, () -> PersonQuery.builder().nameContains("").build());
    }

    @Test
    @DisplayName("toString lists only the set predicates")
    void rendering() {
        assertEquals("PersonQuery{department=Sales, manager=true}",
                PersonQuery.builder().department("Sales").manager(true).build().toString());
        assertEquals("PersonQuery{}", PersonQuery.all().toString());
    }
}
