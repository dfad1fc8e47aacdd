package com.hierarchy.federation.cycle;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on a started cycle.
 *
 * <p>The report future always completes normally: an aborted or failed cycle
 * yields a report with the matching {@link CycleOutcome}.</p>
 */
public final class CycleHandle {

    private final CycleToken token;
    private final CompletableFuture<CycleReport> report;
    private final Runnable onCancel;

    public CycleHandle(CycleToken token, CompletableFuture<CycleReport> report, Runnable onCancel) {
        this.token = Objects.requireNonNull(token, "token");
        this.report = Objects.requireNonNull(report, "report");
        this.onCancel = Objects.requireNonNull(onCancel, "onCancel");
    }

    public String cycleId() {
        return token.cycleId();
    }

    /**
     * Cancels the cycle unless it is already publishing or finished.
     *
     * @return true when this call cancelled it
     */
    public boolean cancel() {
        if (token.cancel()) {
            onCancel.run();
            return true;
        }
        return false;
    }

    public boolean isDone() {
        return report.isDone();
    }

    public CompletableFuture<CycleReport> report() {
        return report;
    }

    /**
     * Blocks until the outcome is known.
     */
    public CycleReport await() {
        return report.join();
    }

    @Override
    public String toString() {
        return "CycleHandle{" + token + ", done=" + report.isDone() + '}';
    }
}
