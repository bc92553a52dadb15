package com.codemeter.core.backend;

/**
 * Lifecycle of the {@link WorkerPoolBackend}.
 *
 * <pre>
 * NEW --initialize--&gt; RUNNING --drainAndShutdown--&gt; DRAINING --queue empty, workers idle--&gt; STOPPED
 * </pre>
 */
public enum PoolState {
    /** Created, no workers started. */
    NEW,
    /** Accepting submissions. */
    RUNNING,
    /** Rejecting submissions, finishing queued work. */
    DRAINING,
    /** Queue empty, workers gone. */
    STOPPED
}
