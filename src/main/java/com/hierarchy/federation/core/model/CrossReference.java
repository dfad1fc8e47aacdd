package com.hierarchy.federation.core.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A cluster of records from different systems believed to denote the same person.
 *
 * <p>{@code confidence} is the minimum edge score inside the cluster, so it
 * never exceeds any of the pairwise scores listed in {@code evidence}.</p>
 */
public record CrossReference(
        List<RecordKey> members,
        double confidence,
        boolean likelySamePerson,
        List<MatchEvidence> evidence
) {
    public CrossReference {
        members = members != null ? List.copyOf(members) : List.of();
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        if (members.size() < 2) {
            throw new IllegalArgumentException("A cross reference needs at least two members");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
    }

    public boolean contains(RecordKey key) {
        return members.contains(key);
    }

    public int size() {
        return members.size();
    }

    /**
     * Union of the signals that contributed to any edge of this cluster.
     */
    public Set<Signal> signals() {
        Set<Signal> signals = EnumSet.noneOf(Signal.class);
        for (MatchEvidence edge : evidence) {
            signals.addAll(edge.contributingSignals());
        }
        return signals;
    }

    /**
     * Source systems represented in this cluster, in member order.
     */
    public List<String> sourceSystems() {
        return members.stream()
                .map(RecordKey::sourceSystem)
                .distinct()
                .toList();
    }
}
