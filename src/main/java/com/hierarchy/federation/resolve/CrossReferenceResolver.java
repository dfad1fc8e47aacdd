package com.hierarchy.federation.resolve;

import com.hierarchy.federation.api.FederationOptions;
import com.hierarchy.federation.core.model.CrossReference;
import com.hierarchy.federation.core.model.MatchEvidence;
import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.core.model.RecordKey;
import com.hierarchy.federation.cycle.CycleAbortedException;
import com.hierarchy.federation.cycle.CycleToken;
import com.hierarchy.federation.index.Index;
import com.hierarchy.federation.rules.TitleCanonicalizer;
import com.hierarchy.federation.similarity.BlockingKey;
import com.hierarchy.federation.similarity.PairScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Infers which records from different source systems describe the same person.
 *
 * <ol>
 *   <li>Records are compared only inside their block (see {@link BlockingKey});
 *       a block without department is also compared with every block sharing
 *       its prefix. Each pair is generated once and same-system pairs are skipped.</li>
 *   <li>Blocks are scored independently, in parallel when a worker pool is given.</li>
 *   <li>Pairs at or above the pair threshold become edges. Edges are sorted by
 *       index position and merged single-threaded with union-find, so the
 *       clusters do not depend on worker scheduling.</li>
 *   <li>A cluster's confidence is its weakest edge.</li>
 * </ol>
 */
public class CrossReferenceResolver {
    private static final Logger log = LoggerFactory.getLogger(CrossReferenceResolver.class);
    private static final int CHECKPOINT_INTERVAL = 1_024;

    private static final Comparator<Edge> EDGE_ORDER = Comparator
            .comparingInt(Edge::leftPosition)
            .thenComparingInt(Edge::rightPosition);

    private final PairScorer scorer;
    private final double pairThreshold;
    private final double likelyThreshold;
    private final ExecutorService workers;

    /**
     * @param workers pool for block scoring, or null to score on the calling thread
     */
    public CrossReferenceResolver(PairScorer scorer, double pairThreshold, double likelyThreshold,
                                  ExecutorService workers) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.pairThreshold = pairThreshold;
        this.likelyThreshold = likelyThreshold;
        this.workers = workers;
    }

    public static CrossReferenceResolver from(FederationOptions options, ExecutorService workers) {
        PairScorer scorer = new PairScorer(new TitleCanonicalizer(options.getTitleSynonyms()),
                options.getSimilarityWeights());
        return new CrossReferenceResolver(scorer, options.getPairThreshold(), options.getLikelyThreshold(), workers);
    }

    public ResolutionResult resolve(Index index) {
        return resolve(index, CycleToken.detached());
    }

    /**
     * Resolves cross references for the given index.
     *
     * @throws CycleAbortedException when the token is cancelled or expires mid-run
     */
    public ResolutionResult resolve(Index index, CycleToken token) {
        long start = System.nanoTime();
        List<BlockTask> tasks = plan(index);

        List<BlockOutcome> outcomes = score(tasks, index, token);
        token.checkpoint();

        List<Edge> edges = new ArrayList<>();
        long compared = 0;
        for (BlockOutcome outcome : outcomes) {
            edges.addAll(outcome.edges());
            compared += outcome.comparedPairs();
        }
        edges.sort(EDGE_ORDER);

        List<CrossReference> clusters = merge(edges, index);

        List<RecordKey> unblockable = index.unblockable().stream().map(PersonRecord::getKey).toList();
        ResolverDiagnostics diagnostics = new ResolverDiagnostics(index.size(), index.blocks().size(),
                compared, edges.size(), clusters.size(), unblockable);

        if (!unblockable.isEmpty()) {
            log.warn("resolver.unblockable count={} keys={}", unblockable.size(), unblockable);
        }
        log.info("resolver.completed version={} blocks={} compared={} edges={} clusters={} durationMs={}",
                index.version(), diagnostics.blockCount(), compared, edges.size(), clusters.size(),
                (System.nanoTime() - start) / 1_000_000);
        return new ResolutionResult(index.version(), clusters, diagnostics);
    }

    public double getPairThreshold() {
        return pairThreshold;
    }

    public double getLikelyThreshold() {
        return likelyThreshold;
    }

    /**
     * One task per block; a wildcard block also carries the same-prefix blocks it must be compared against.
     */
    List<BlockTask> plan(Index index) {
        Map<String, List<BlockingKey>> byPrefix = new LinkedHashMap<>();
        for (BlockingKey key : index.blocks().keySet()) {
            byPrefix.computeIfAbsent(key.prefix(), k -> new ArrayList<>()).add(key);
        }

        List<BlockTask> tasks = new ArrayList<>();
        for (Map.Entry<BlockingKey, List<PersonRecord>> entry : index.blocks().entrySet()) {
            BlockingKey key = entry.getKey();
            List<List<PersonRecord>> partners = new ArrayList<>();
            if (key.isWildcard()) {
                for (BlockingKey other : byPrefix.get(key.prefix())) {
                    if (!other.equals(key)) {
                        partners.add(index.blocks().get(other));
                    }
                }
            }
            tasks.add(new BlockTask(key, entry.getValue(), partners));
        }
        return tasks;
    }

    private List<BlockOutcome> score(List<BlockTask> tasks, Index index, CycleToken token) {
        if (workers == null || tasks.size() <= 1) {
            List<BlockOutcome> outcomes = new ArrayList<>(tasks.size());
            for (BlockTask task : tasks) {
                outcomes.add(scoreBlock(task, index, token));
            }
            return outcomes;
        }

        List<CompletableFuture<BlockOutcome>> futures = tasks.stream()
                .map(task -> CompletableFuture.supplyAsync(() -> scoreBlock(task, index, token), workers))
                .toList();
        try {
            return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .thenApply(v -> futures.stream().map(CompletableFuture::join).toList())
                    .join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof CycleAbortedException aborted) {
                throw aborted;
            }
            throw e;
        }
    }

    private BlockOutcome scoreBlock(BlockTask task, Index index, CycleToken token) {
        token.checkpoint();
        List<Edge> edges = new ArrayList<>();
        long compared = 0;

        List<PersonRecord> members = task.members();
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                if (compare(members.get(i), members.get(j), index, edges)) {
                    if (++compared % CHECKPOINT_INTERVAL == 0) {
                        token.checkpoint();
                    }
                }
            }
        }
        for (List<PersonRecord> partner : task.partners()) {
            for (PersonRecord left : members) {
                for (PersonRecord right : partner) {
                    if (compare(left, right, index, edges)) {
                        if (++compared % CHECKPOINT_INTERVAL == 0) {
                            token.checkpoint();
                        }
                    }
                }
            }
        }
        log.debug("resolver.block key={} members={} partners={} compared={} edges={}",
                task.key(), members.size(), task.partners().size(), compared, edges.size());
        return new BlockOutcome(edges, compared);
    }

    /**
     * Scores the pair when it crosses systems. Returns whether it was scored.
     */
    private boolean compare(PersonRecord a, PersonRecord b, Index index, List<Edge> edges) {
        if (a.getSourceSystem().equals(b.getSourceSystem())) {
            return false;
        }
        int posA = index.positionOf(a.getKey());
        int posB = index.positionOf(b.getKey());
        PersonRecord first = posA <= posB ? a : b;
        PersonRecord second = first == a ? b : a;

        MatchEvidence evidence = scorer.score(first, second);
        if (evidence.score() >= pairThreshold) {
            edges.add(new Edge(Math.min(posA, posB), Math.max(posA, posB), evidence));
        }
        return true;
    }

    private List<CrossReference> merge(List<Edge> edges, Index index) {
        UnionFind unionFind = new UnionFind(index.size());
        for (Edge edge : edges) {
            unionFind.union(edge.leftPosition(), edge.rightPosition());
        }

        // Keyed by the cluster's root; TreeMap over first member keeps output in index order
        Map<Integer, TreeSet<Integer>> membersByRoot = new LinkedHashMap<>();
        Map<Integer, List<MatchEvidence>> evidenceByRoot = new LinkedHashMap<>();
        for (Edge edge : edges) {
            int root = unionFind.find(edge.leftPosition());
            TreeSet<Integer> members = membersByRoot.computeIfAbsent(root, k -> new TreeSet<>());
            members.add(edge.leftPosition());
            members.add(edge.rightPosition());
            evidenceByRoot.computeIfAbsent(root, k -> new ArrayList<>()).add(edge.evidence());
        }

        TreeMap<Integer, CrossReference> ordered = new TreeMap<>();
        membersByRoot.forEach((root, positions) -> {
            List<MatchEvidence> evidence = evidenceByRoot.get(root);
            double confidence = evidence.stream().mapToDouble(MatchEvidence::score).min().orElse(0.0);
            List<RecordKey> members = positions.stream()
                    .map(position -> index.records().get(position).getKey())
                    .toList();
            ordered.put(positions.first(),
                    new CrossReference(members, confidence, confidence >= likelyThreshold, evidence));
        });
        return List.copyOf(ordered.values());
    }

    record BlockTask(BlockingKey key, List<PersonRecord> members, List<List<PersonRecord>> partners) {
    }

    private record BlockOutcome(List<Edge> edges, long comparedPairs) {
    }

    private record Edge(int leftPosition, int rightPosition, MatchEvidence evidence) {
    }
}
