package com.hierarchy.federation.cdi;

import com.hierarchy.federation.api.FederationOptions;
import com.hierarchy.federation.api.HierarchyFederation;
import com.hierarchy.federation.cache.CacheConfig;
import com.hierarchy.federation.ingest.JsonSnapshotSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires a {@link HierarchyFederation} from MicroProfile Config properties.
 *
 * <p>File-fed sources are declared as {@code system=path} entries; each path
 * points at a JSON array or JSON Lines snapshot:</p>
 * <pre>
 * hierarchy-federation:
 *   sources: ladder=/data/ladder.json,orgchart=/data/orgchart.jsonl
 *   resolver:
 *     pair-threshold: 0.75
 *     likely-threshold: 0.9
 *   cycle:
 *     timeout-seconds: 300
 * </pre>
 */
@ApplicationScoped
public class HierarchyFederationProducer {

    private static final Logger log = LoggerFactory.getLogger(HierarchyFederationProducer.class);

    // ── Sources ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "hierarchy-federation.sources")
    Optional<List<String>> sourceFiles;

    // ── Resolver ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "hierarchy-federation.resolver.pair-threshold", defaultValue = "0.75")
    double pairThreshold;

    @Inject
    @ConfigProperty(name = "hierarchy-federation.resolver.likely-threshold", defaultValue = "0.90")
    double likelyThreshold;

    @Inject
    @ConfigProperty(name = "hierarchy-federation.resolver.parallelism", defaultValue = "0")
    int resolverParallelism;

    // ── Title classification ──────────────────────────────────

    @Inject
    @ConfigProperty(name = "hierarchy-federation.titles.leadership-keywords")
    Optional<List<String>> leadershipKeywords;

    @Inject
    @ConfigProperty(name = "hierarchy-federation.titles.manager-keywords")
    Optional<List<String>> managerKeywords;

    // ── Cycle ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "hierarchy-federation.cycle.timeout-seconds", defaultValue = "300")
    long cycleTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "hierarchy-federation.diagnostics.capacity", defaultValue = "100")
    int diagnosticsCapacity;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "hierarchy-federation.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "hierarchy-federation.cache.max-size", defaultValue = "256")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "hierarchy-federation.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public FederationOptions federationOptions() {
        FederationOptions.Builder builder = FederationOptions.builder()
                .pairThreshold(pairThreshold)
                .likelyThreshold(likelyThreshold)
                .cycleTimeout(Duration.ofSeconds(cycleTimeoutSeconds));
        if (resolverParallelism > 0) {
            builder.resolverParallelism(resolverParallelism);
        }
        leadershipKeywords.ifPresent(keywords -> builder.leadershipKeywords(new LinkedHashSet<>(keywords)));
        managerKeywords.ifPresent(keywords -> builder.managerKeywords(new LinkedHashSet<>(keywords)));
        return builder.build();
    }

    @Produces
    @ApplicationScoped
    public HierarchyFederation hierarchyFederation(FederationOptions options) {
        HierarchyFederation.Builder builder = HierarchyFederation.builder()
                .options(options)
                .diagnosticsCapacity(diagnosticsCapacity)
                .cacheConfig(cacheEnabled
                        ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                        : CacheConfig.disabled());

        for (String entry : sourceFiles.orElse(List.of())) {
            int separator = entry.indexOf('=');
            if (separator <= 0 || separator == entry.length() - 1) {
                throw new IllegalArgumentException("Source entry must be 'system=path': " + entry);
            }
            String system = entry.substring(0, separator).trim();
            Path path = Path.of(entry.substring(separator + 1).trim());
            builder.source(system, new JsonSnapshotSource(path));
            log.info("Registered file source: system={} path={}", system, path);
        }

        log.info("Producing HierarchyFederation: pairThreshold={} likelyThreshold={} cache={}",
                options.getPairThreshold(), options.getLikelyThreshold(), cacheEnabled);
        return builder.build();
    }

    public void closeFederation(@Disposes HierarchyFederation federation) {
        log.info("Closing HierarchyFederation");
        federation.close();
    }
}
