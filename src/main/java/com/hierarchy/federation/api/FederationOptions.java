package com.hierarchy.federation.api;

import com.hierarchy.federation.ingest.SourceSchema;
import com.hierarchy.federation.rules.DefaultNormalizationRules;
import com.hierarchy.federation.similarity.SimilarityWeights;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration of a federation engine: matching thresholds, title
 * tables, per-source schemas and cycle limits.
 * Reloading configuration means building a new options object and a new engine.
 */
public class FederationOptions {

    private static final double DEFAULT_PAIR_THRESHOLD = 0.75;
    private static final double DEFAULT_LIKELY_THRESHOLD = 0.90;
    private static final Duration DEFAULT_CYCLE_TIMEOUT = Duration.ofMinutes(5);

    private final double pairThreshold;
    private final double likelyThreshold;
    private final SimilarityWeights similarityWeights;
    private final Map<String, String> titleSynonyms;
    private final Set<String> leadershipKeywords;
    private final Set<String> managerKeywords;
    private final Map<String, SourceSchema> sourceSchemas;
    private final int resolverParallelism;
    private final Duration cycleTimeout;

    private FederationOptions(Builder builder) {
        this.pairThreshold = builder.pairThreshold;
        this.likelyThreshold = builder.likelyThreshold;
        this.similarityWeights = builder.similarityWeights;
        this.titleSynonyms = Collections.unmodifiableMap(new LinkedHashMap<>(builder.titleSynonyms));
        this.leadershipKeywords = Collections.unmodifiableSet(new LinkedHashSet<>(builder.leadershipKeywords));
        this.managerKeywords = Collections.unmodifiableSet(new LinkedHashSet<>(builder.managerKeywords));
        this.sourceSchemas = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sourceSchemas));
        this.resolverParallelism = builder.resolverParallelism;
        this.cycleTimeout = builder.cycleTimeout;
    }

    public double getPairThreshold() {
        return pairThreshold;
    }

    public double getLikelyThreshold() {
        return likelyThreshold;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    public Map<String, String> getTitleSynonyms() {
        return titleSynonyms;
    }

    public Set<String> getLeadershipKeywords() {
        return leadershipKeywords;
    }

    public Set<String> getManagerKeywords() {
        return managerKeywords;
    }

    public Map<String, SourceSchema> getSourceSchemas() {
        return sourceSchemas;
    }

    /**
     * Schema registered for the given source, or the default schema.
     */
    public SourceSchema schemaFor(String sourceSystem) {
        return sourceSchemas.getOrDefault(sourceSystem, SourceSchema.defaults());
    }

    public int getResolverParallelism() {
        return resolverParallelism;
    }

    public Duration getCycleTimeout() {
        return cycleTimeout;
    }

    public static FederationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double pairThreshold = DEFAULT_PAIR_THRESHOLD;
        private double likelyThreshold = DEFAULT_LIKELY_THRESHOLD;
        private SimilarityWeights similarityWeights = SimilarityWeights.defaultWeights();
        private Map<String, String> titleSynonyms = DefaultNormalizationRules.getTitleSynonyms();
        private Set<String> leadershipKeywords = DefaultNormalizationRules.getLeadershipKeywords();
        private Set<String> managerKeywords = DefaultNormalizationRules.getManagerKeywords();
        private final Map<String, SourceSchema> sourceSchemas = new LinkedHashMap<>();
        private int resolverParallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
        private Duration cycleTimeout = DEFAULT_CYCLE_TIMEOUT;

        public Builder pairThreshold(double pairThreshold) {
            validateThreshold(pairThreshold, "pairThreshold");
            this.pairThreshold = pairThreshold;
            return this;
        }

        public Builder likelyThreshold(double likelyThreshold) {
            validateThreshold(likelyThreshold, "likelyThreshold");
            this.likelyThreshold = likelyThreshold;
            return this;
        }

        public Builder similarityWeights(SimilarityWeights similarityWeights) {
            this.similarityWeights = Objects.requireNonNull(similarityWeights, "similarityWeights");
            return this;
        }

        public Builder titleSynonyms(Map<String, String> titleSynonyms) {
            this.titleSynonyms = Objects.requireNonNull(titleSynonyms, "titleSynonyms");
            return this;
        }

        public Builder leadershipKeywords(Set<String> leadershipKeywords) {
            this.leadershipKeywords = Objects.requireNonNull(leadershipKeywords, "leadershipKeywords");
            return this;
        }

        public Builder managerKeywords(Set<String> managerKeywords) {
            this.managerKeywords = Objects.requireNonNull(managerKeywords, "managerKeywords");
            return this;
        }

        public Builder sourceSchema(String sourceSystem, SourceSchema schema) {
            Objects.requireNonNull(sourceSystem, "sourceSystem");
            this.sourceSchemas.put(sourceSystem, Objects.requireNonNull(schema, "schema"));
            return this;
        }

        public Builder resolverParallelism(int resolverParallelism) {
            if (resolverParallelism <= 0) {
                throw new IllegalArgumentException("resolverParallelism must be positive");
            }
            this.resolverParallelism = resolverParallelism;
            return this;
        }

        public Builder cycleTimeout(Duration cycleTimeout) {
            Objects.requireNonNull(cycleTimeout, "cycleTimeout");
            if (cycleTimeout.isNegative() || cycleTimeout.isZero()) {
                throw new IllegalArgumentException("cycleTimeout must be positive");
            }
            this.cycleTimeout = cycleTimeout;
            return this;
        }

        public FederationOptions build() {
            if (likelyThreshold < pairThreshold) {
                throw new IllegalArgumentException("likelyThreshold must be >= pairThreshold");
            }
            return new FederationOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "FederationOptions{" +
                "pairThreshold=" + pairThreshold +
                ", likelyThreshold=" + likelyThreshold +
                ", weights=" + similarityWeights +
                ", titleSynonyms=" + titleSynonyms.size() +
                ", leadershipKeywords=" + leadershipKeywords +
                ", managerKeywords=" + managerKeywords +
                ", sourceSchemas=" + sourceSchemas.keySet() +
                ", resolverParallelism=" + resolverParallelism +
                ", cycleTimeout=" + cycleTimeout +
                '}';
    }
}
