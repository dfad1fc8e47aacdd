package com.hierarchy.federation.api;

import com.hierarchy.federation.ingest.SourceSchema;
import com.hierarchy.federation.similarity.SimilarityWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FederationOptionsTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void defaults() {
        FederationOptions options = FederationOptions.defaults();

        assertEquals(0.75, options.getPairThreshold());
        assertEquals(0.90, options.getLikelyThreshold());
        assertEquals(SimilarityWeights.defaultWeights(), options.getSimilarityWeights());
        assertEquals(Duration.ofMinutes(5), options.getCycleTimeout());
        assertTrue(options.getResolverParallelism() >= 1);
        assertTrue(options.getLeadershipKeywords().contains("Master Agent"));
        assertSame(SourceSchema.defaults(), options.schemaFor("ladder"));
    }

    @Test
    @DisplayName("Thresholds must lie in [0, 1] and be ordered")
    void thresholds() {
        assertThrows(IllegalArgumentException.class, () -> FederationOptions.builder().pairThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> FederationOptions.builder().likelyThreshold(-0.1));
        assertThrows(IllegalArgumentException.class,
                () -> FederationOptions.builder().pairThreshold(0.8).likelyThreshold(0.7).build());
        assertDoesNotThrow(() -> FederationOptions.builder().pairThreshold(0.8).likelyThreshold(0.8).build());
    }

    @Test
    @DisplayName("Cycle timeout and parallelism must be positive")
    void positiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> FederationOptions.builder().cycleTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> FederationOptions.builder().cycleTimeout(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> FederationOptions.builder().resolverParallelism(0));
    }

    @Test
    @DisplayName("Keyword sets are copied and read-only")
    void keywordsCopied() {
        FederationOptions options = FederationOptions.builder()
                .leadershipKeywords(Set.of("Partner"))
                .build();

        assertEquals(Set.of("Partner"), options.getLeadershipKeywords());
        assertThrows(UnsupportedOperationException.class, () -> options.getLeadershipKeywords().add("Chief"));
    }

    @Test
    @DisplayName("Schemas are registered per source")
    void schemas() {
        SourceSchema hr = SourceSchema.builder().field(SourceSchema.Field.ID, "badge").build();
        FederationOptions options = FederationOptions.builder().sourceSchema("hr", hr).build();

        assertSame(hr, options.schemaFor("hr"));
        assertSame(SourceSchema.defaults(), options.schemaFor("orgchart"));
    }
}
