package com.hierarchy.federation.core.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Explains one scored pair: the individual signal values and the weighted score.
 */
public record MatchEvidence(
        RecordKey left,
        RecordKey right,
        double nameSimilarity,
        double titleSimilarity,
        double structuralCompatibility,
        double score
) {
    public MatchEvidence {
        Objects.requireNonNull(left, "left is required");
        Objects.requireNonNull(right, "right is required");
        checkUnit(nameSimilarity, "nameSimilarity");
        checkUnit(titleSimilarity, "titleSimilarity");
        checkUnit(structuralCompatibility, "structuralCompatibility");
        checkUnit(score, "score");
    }

    /**
     * Signals that contributed a non-zero value to the score.
     */
    public Set<Signal> contributingSignals() {
        Set<Signal> signals = EnumSet.noneOf(Signal.class);
        if (nameSimilarity > 0.0) {
            signals.add(Signal.NAME);
        }
        if (titleSimilarity > 0.0) {
            signals.add(Signal.TITLE);
        }
        if (structuralCompatibility > 0.0) {
            signals.add(Signal.STRUCTURE);
        }
        return signals;
    }

    public boolean involves(RecordKey key) {
        return left.equals(key) || right.equals(key);
    }

    private static void checkUnit(double value, String name) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }

    @Override
    public String toString() {
        return String.format("MatchEvidence{%s ~ %s, name=%.4f, title=%.4f, structure=%.2f, score=%.4f}",
                left, right, nameSimilarity, titleSimilarity, structuralCompatibility, score);
    }
}
