package com.hierarchy.federation.similarity;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Set overlap: |intersection| / |union|.
 * Two empty sets carry no evidence and score 0.0.
 */
public final class JaccardSimilarity {

    private JaccardSimilarity() {
        // Utility class
    }

    public static <T> double compute(Collection<T> first, Collection<T> second) {
        if (first == null || second == null || first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        Set<T> left = new HashSet<>(first);
        Set<T> right = new HashSet<>(second);

        int intersectionSize = 0;
        for (T element : left) {
            if (right.contains(element)) {
                intersectionSize++;
            }
        }
        int unionSize = left.size() + right.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }
}
