package com.hierarchy.federation.view;

import com.hierarchy.federation.core.model.RecordKey;

import java.util.Objects;

/**
 * A structural problem found while materializing a view. Reported, never thrown.
 *
 * @param type    kind of problem
 * @param subject record whose {@code reportsTo} is affected
 * @param target  the referenced key
 * @param message human-readable description
 */
public record ViewDiagnostic(Type type, RecordKey subject, RecordKey target, String message) {

    public enum Type {
        /** {@code reportsTo} names a record that is not in the index. */
        DANGLING_REPORTS_TO,
        /** Following {@code reportsTo} leads back to the subject. */
        CYCLE
    }

    public ViewDiagnostic {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(target, "target");
    }

    static ViewDiagnostic dangling(RecordKey subject, RecordKey target) {
        return new ViewDiagnostic(Type.DANGLING_REPORTS_TO, subject, target,
                subject + " reports to " + target + " which is not indexed");
    }

    static ViewDiagnostic cycle(RecordKey subject, RecordKey target) {
        return new ViewDiagnostic(Type.CYCLE, subject, target,
                subject + " reports to " + target + " which closes a reporting cycle");
    }
}
