package com.hierarchy.federation.similarity;

/**
 * Weights of the three pair signals in the combined match score.
 */
public record SimilarityWeights(
        double nameWeight,
        double titleWeight,
        double structureWeight
) {
    public SimilarityWeights {
        if (nameWeight < 0 || titleWeight < 0 || structureWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = nameWeight + titleWeight + structureWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * 0.6 name, 0.25 title, 0.15 structure.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.6, 0.25, 0.15);
    }

    /**
     * Weights for sources whose titles are unreliable.
     */
    public static SimilarityWeights nameFocused() {
        return new SimilarityWeights(0.8, 0.1, 0.1);
    }
}
