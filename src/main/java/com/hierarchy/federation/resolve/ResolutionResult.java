package com.hierarchy.federation.resolve;

import com.hierarchy.federation.core.model.CrossReference;
import com.hierarchy.federation.core.model.RecordKey;

import java.util.List;
import java.util.Optional;

/**
 * Cross references computed from one index version, with their diagnostics.
 */
public record ResolutionResult(
        long indexVersion,
        List<CrossReference> crossReferences,
        ResolverDiagnostics diagnostics
) {
    public ResolutionResult {
        crossReferences = crossReferences != null ? List.copyOf(crossReferences) : List.of();
        diagnostics = diagnostics != null ? diagnostics : ResolverDiagnostics.empty();
    }

    public static ResolutionResult empty(long indexVersion) {
        return new ResolutionResult(indexVersion, List.of(), ResolverDiagnostics.empty());
    }

    /**
     * Cross references whose confidence is at least {@code minConfidence}, in resolver order.
     */
    public List<CrossReference> withMinConfidence(double minConfidence) {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be between 0.0 and 1.0");
        }
        return crossReferences.stream()
                .filter(ref -> ref.confidence() >= minConfidence)
                .toList();
    }

    public Optional<CrossReference> findFor(RecordKey key) {
        return crossReferences.stream()
                .filter(ref -> ref.contains(key))
                .findFirst();
    }

    public long likelyCount() {
        return crossReferences.stream().filter(CrossReference::likelySamePerson).count();
    }
}
