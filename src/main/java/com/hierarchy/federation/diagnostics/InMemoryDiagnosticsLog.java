package com.hierarchy.federation.diagnostics;

import com.hierarchy.federation.cycle.CycleOutcome;
import com.hierarchy.federation.cycle.CycleReport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the most recent cycle reports in memory, oldest first.
 * Thread-safe; once full, the oldest report is dropped for each new one.
 */
public class InMemoryDiagnosticsLog implements DiagnosticsListener {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<CycleReport> reports = new ArrayDeque<>();

    public InMemoryDiagnosticsLog() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryDiagnosticsLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void onCycleCompleted(CycleReport report) {
        if (reports.size() == capacity) {
            reports.removeFirst();
        }
        reports.addLast(report);
    }

    public synchronized List<CycleReport> findAll() {
        return List.copyOf(reports);
    }

    /**
     * Up to {@code limit} most recent reports, oldest first.
     */
    public synchronized List<CycleReport> findRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<CycleReport> all = new ArrayList<>(reports);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized Optional<CycleReport> latest() {
        return Optional.ofNullable(reports.peekLast());
    }

    /**
     * Most recent report that was not a cancellation.
     */
    public synchronized Optional<CycleReport> latestConclusive() {
        Iterator<CycleReport> it = reports.descendingIterator();
        while (it.hasNext()) {
            CycleReport report = it.next();
            if (report.outcome() != CycleOutcome.CANCELLED) {
                return Optional.of(report);
            }
        }
        return Optional.empty();
    }

    public synchronized int count() {
        return reports.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        reports.clear();
    }
}
