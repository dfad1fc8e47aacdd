package com.hierarchy.federation.index;

import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.core.model.RecordKey;
import com.hierarchy.federation.similarity.DefaultBlockingKeyStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.hierarchy.federation.TestRecords.record;
import static org.junit.jupiter.api.Assertions.*;

class IndexBuilderTest {

    private static final Instant NOW = Instant.parse("2026-01-15T08:00:00Z");

    private final PersonRecord ceo = record("orgchart", "{'id':'E1','name':'Robert Smith','title':'CEO'}");
    private final PersonRecord manager = record("orgchart",
            "{'id':'E2','name':'Michelle Rodriguez','title':'Marketing Manager','department':'Marketing','managerId':'E1'}");
    private final PersonRecord rep = record("orgchart",
            "{'id':'E3','name':'Tom Baker','title':'Sales Rep','department':'SALES','managerId':'E1'}");
    private final PersonRecord agent = record("ladder", "{'id':'A1','name':'Sarah Johnson','level':1}");

    private IndexBuilder builder(long version) {
        return new IndexBuilder(version, new DefaultBlockingKeyStrategy(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Secondary indexes")
    class SecondaryIndexes {

        @Test
        @DisplayName("Records keep insertion order and positions")
        void insertionOrder() {
            Index index = builder(3L)
                    .addBatch("orgchart", List.of(ceo, manager, rep))
                    .addBatch("ladder", List.of(agent))
                    .build();

            assertEquals(3L, index.version());
            assertEquals(NOW, index.builtAt());
            assertEquals(List.of(ceo, manager, rep, agent), index.records());
            assertEquals(3, index.positionOf(agent.getKey()));
            assertSame(manager, index.get(RecordKey.of("orgchart", "E2")).orElseThrow());
            assertFalse(index.contains(RecordKey.of("orgchart", "E9")));
        }

        @Test
        @DisplayName("Departments are matched case-insensitively and keep their first label")
        void departments() {
            Index index = builder(1L).addBatch("orgchart", List.of(ceo, manager, rep)).build();

            assertEquals(List.of(rep), index.byDepartment("sales"));
            assertEquals(List.of(manager), index.byDepartment(" Marketing "));
            assertEquals("SALES", index.departments().get("sales"));
            assertTrue(index.byDepartment("Finance").isEmpty());
        }

        @Test
        @DisplayName("Leadership, managers and direct reports are indexed")
        void roles() {
            Index index = builder(1L).addBatch("orgchart", List.of(ceo, manager, rep)).build();

            assertEquals(List.of(ceo), index.leadership());
            assertEquals(List.of(manager), index.managers());
            assertEquals(List.of(manager.getKey(), rep.getKey()), index.directReportsOf(ceo.getKey()));
            assertFalse(index.hasDirectReports(rep.getKey()));
        }

        @Test
        @DisplayName("Source summaries count records per source")
        void summaries() {
            Index index = builder(1L)
                    .addBatch("orgchart", List.of(ceo, manager))
                    .addBatch("ladder", List.of(agent))
                    .build();

            assertEquals(List.of(new SourceSummary("orgchart", 2, NOW), new SourceSummary("ladder", 1, NOW)),
                    index.sources());
            assertEquals(List.of(agent), index.bySourceSystem("ladder"));
        }
    }

    @Nested
    @DisplayName("Duplicate identities")
    class Duplicates {

        @Test
        @DisplayName("A batch repeating an identity is rejected without staging anything")
        void duplicateBatch() {
            IndexBuilder builder = builder(1L);
            PersonRecord again = record("orgchart", "{'id':'E1','name':'Bob Smith'}");

            DuplicateIdentityException e = assertThrows(DuplicateIdentityException.class,
                    () -> builder.addBatch("orgchart", List.of(ceo, manager, again)));

            assertEquals("orgchart", e.getSourceSystem());
            assertEquals(List.of(ceo.getKey()), e.getDuplicates());
            assertEquals(0, builder.stagedCount());

            Index index = builder.addBatch("ladder", List.of(agent)).build();
            assertEquals(List.of(agent), index.records());
        }

        @Test
        @DisplayName("Interleaved records drop only the offending source")
        void interleaved() {
            IndexBuilder builder = builder(1L);
            PersonRecord again = record("orgchart", "{'id':'E2','name':'Michelle Rodriguez'}");

            List<DuplicateIdentityException> rejected = builder.addAll(List.of(ceo, agent, manager, again));

            assertEquals(1, rejected.size());
            assertEquals("orgchart", rejected.get(0).getSourceSystem());
            assertEquals(List.of(agent), builder.build().records());
        }

        @Test
        @DisplayName("A record from another source is refused")
        void wrongSource() {
            assertThrows(IllegalArgumentException.class,
                    () -> builder(1L).addBatch("ladder", List.of(ceo)));
        }
    }

    @Test
    @DisplayName("The builder is single-use")
    void singleUse() {
        IndexBuilder builder = builder(1L);
        builder.build();

        assertThrows(IllegalStateException.class, builder::build);
        assertThrows(IllegalStateException.class, () -> builder.addBatch("ladder", List.of(agent)));
    }

    @Test
    @DisplayName("The empty index has version 0")
    void emptyIndex() {
        assertEquals(0L, Index.empty().version());
        assertTrue(Index.empty().isEmpty());
    }
}
