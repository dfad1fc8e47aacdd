package com.hierarchy.federation.cycle;

import java.util.List;
import java.util.Objects;

/**
 * What happened to one source during a cycle.
 *
 * @param sourceSystem the source tag
 * @param status       whether the source made it into the index
 * @param pulled       raw records returned by the adapter
 * @param accepted     records normalized and indexed
 * @param rejected     records skipped by validation
 * @param errors       validation messages, truncated to {@link #MAX_ERRORS}
 * @param failure      why the whole source was left out, or null
 */
public record SourceReport(
        String sourceSystem,
        Status status,
        int pulled,
        int accepted,
        int rejected,
        List<String> errors,
        String failure
) {
    public static final int MAX_ERRORS = 50;

    public enum Status {
        /** Every record was indexed. */
        ACCEPTED,
        /** Indexed, but some records were skipped by validation. */
        PARTIAL,
        /** Left out entirely: adapter failure or duplicated identity. */
        REJECTED
    }

    public SourceReport {
        Objects.requireNonNull(sourceSystem, "sourceSystem");
        Objects.requireNonNull(status, "status");
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    static SourceReport rejected(String sourceSystem, int pulled, int invalid, List<String> errors, String failure) {
        return new SourceReport(sourceSystem, Status.REJECTED, pulled, 0, invalid, errors, failure);
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }
}
