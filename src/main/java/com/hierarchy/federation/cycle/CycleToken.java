package com.hierarchy.federation.cycle;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation state of one running cycle.
 *
 * <p>Work calls {@link #checkpoint()} between units; it throws once the cycle
 * was cancelled or timed out. Publishing requires winning
 * {@link #beginCommit()}, and cancelling or expiring requires the cycle to
 * still be running, so a cycle is either published or aborted, never both.</p>
 */
public final class CycleToken {

    public enum State {
        RUNNING,
        COMMITTING,
        CANCELLED,
        TIMED_OUT
    }

    private final String cycleId;
    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);

    public CycleToken(String cycleId) {
        this.cycleId = Objects.requireNonNull(cycleId, "cycleId");
    }

    /**
     * Token for work that runs outside a managed cycle and is never cancelled.
     */
    public static CycleToken detached() {
        return new CycleToken("detached");
    }

    public String cycleId() {
        return cycleId;
    }

    public State state() {
        return state.get();
    }

    /**
     * Requests cancellation. Returns false when the cycle already committed or stopped.
     */
    public boolean cancel() {
        return state.compareAndSet(State.RUNNING, State.CANCELLED);
    }

    /**
     * Marks the cycle as out of time. Returns false when it already committed or stopped.
     */
    public boolean expire() {
        return state.compareAndSet(State.RUNNING, State.TIMED_OUT);
    }

    /**
     * Claims the right to publish. Returns false when the cycle was aborted first.
     */
    public boolean beginCommit() {
        return state.compareAndSet(State.RUNNING, State.COMMITTING);
    }

    public boolean isAborted() {
        State current = state.get();
        return current == State.CANCELLED || current == State.TIMED_OUT;
    }

    /**
     * Throws when the cycle must stop.
     *
     * @throws CycleCancelledException when cancelled
     * @throws CycleTimeoutException   when out of time
     */
    public void checkpoint() {
        switch (state.get()) {
            case CANCELLED:
                throw new CycleCancelledException(cycleId);
            case TIMED_OUT:
                throw new CycleTimeoutException(cycleId);
            default:
                break;
        }
    }

    /**
     * Exception describing why this cycle stopped, or null while it may still publish.
     */
    public CycleAbortedException abortCause() {
        switch (state.get()) {
            case CANCELLED:
                return new CycleCancelledException(cycleId);
            case TIMED_OUT:
                return new CycleTimeoutException(cycleId);
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return "CycleToken{" + cycleId + ", " + state.get() + '}';
    }
}
