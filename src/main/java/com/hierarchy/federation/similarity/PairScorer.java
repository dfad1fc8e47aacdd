package com.hierarchy.federation.similarity;

import com.hierarchy.federation.core.model.MatchEvidence;
import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.rules.TitleCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores a candidate pair of records.
 * Formula: score = wName*name + wTitle*title + wStructure*structure.
 *
 * <p>Each signal and the final score are rounded to four decimal places, so
 * a pair sitting exactly on a threshold compares the same way on every run
 * and platform.</p>
 */
public class PairScorer {
    private static final Logger log = LoggerFactory.getLogger(PairScorer.class);
    private static final double SCALE = 10_000.0;

    private final SimilarityAlgorithm nameSimilarity;
    private final TitleSimilarity titleSimilarity;
    private final SimilarityWeights weights;

    public PairScorer(TitleCanonicalizer canonicalizer, SimilarityWeights weights) {
        this(new TokenSetSimilarity(), new TitleSimilarity(canonicalizer), weights);
    }

    public PairScorer(SimilarityAlgorithm nameSimilarity, TitleSimilarity titleSimilarity,
                      SimilarityWeights weights) {
        this.nameSimilarity = nameSimilarity;
        this.titleSimilarity = titleSimilarity;
        this.weights = weights;
    }

    /**
     * Scores the pair. The evidence lists {@code a} on the left.
     */
    public MatchEvidence score(PersonRecord a, PersonRecord b) {
        double name = round(nameScore(a, b));
        double title = round(titleSimilarity.compute(a, b));
        double structure = StructuralCompatibility.compute(a, b);
        double score = round(weights.nameWeight() * name
                + weights.titleWeight() * title
                + weights.structureWeight() * structure);

        if (log.isTraceEnabled()) {
            log.trace("pair.scored left={} right={} name={} title={} structure={} score={}",
                    a.getKey(), b.getKey(), name, title, structure, score);
        }
        return new MatchEvidence(a.getKey(), b.getKey(), name, title, structure, Math.min(1.0, score));
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    /**
     * Best similarity over the canonical names and aliases of both records.
     */
    double nameScore(PersonRecord a, PersonRecord b) {
        double best = 0.0;
        for (String left : nameKeys(a)) {
            for (String right : nameKeys(b)) {
                best = Math.max(best, nameSimilarity.compute(left, right));
                if (best >= 1.0) {
                    return 1.0;
                }
            }
        }
        return best;
    }

    private static List<String> nameKeys(PersonRecord record) {
        List<String> keys = new ArrayList<>(1 + record.getNormalizedAliasKeys().size());
        if (record.hasNameKey()) {
            keys.add(record.getNormalizedNameKey());
        }
        keys.addAll(record.getNormalizedAliasKeys());
        return keys;
    }

    static double round(double value) {
        return Math.round(value * SCALE) / SCALE;
    }
}
