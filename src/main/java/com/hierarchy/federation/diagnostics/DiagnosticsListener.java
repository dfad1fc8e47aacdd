package com.hierarchy.federation.diagnostics;

import com.hierarchy.federation.cycle.CycleReport;

/**
 * Receives the report of every finished cycle, published or not.
 * Called from cycle threads; implementations must be thread-safe and must not block.
 */
@FunctionalInterface
public interface DiagnosticsListener {

    void onCycleCompleted(CycleReport report);
}
