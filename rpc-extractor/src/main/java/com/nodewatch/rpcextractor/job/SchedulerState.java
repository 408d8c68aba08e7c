package com.nodewatch.rpcextractor.job;

/**
 * Lifecycle of the {@link ExtractionScheduler}.
 */
public enum SchedulerState {
    /** Waiting for the next base tick; nothing in flight. */
    IDLE,
    /** At least one fetch in flight. */
    DISPATCHING,
    /** Shutdown observed, waiting for in-flight fetches to resolve. */
    DRAINING,
    /** Terminal. */
    STOPPED
}
