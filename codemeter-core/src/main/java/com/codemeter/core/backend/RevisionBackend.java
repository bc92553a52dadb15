package com.codemeter.core.backend;

import com.codemeter.core.model.RevisionStatus;
import com.codemeter.core.walk.WalkEntry;

import java.nio.file.Path;

/**
 * Executes per-file revisions on behalf of the directory walk.
 *
 * <p>Lifecycle: {@link #initialize()} once, any number of {@link #submit} calls from a single
 * producer thread, then {@link #drainAndShutdown()} once. After {@code drainAndShutdown} returns
 * every accepted submission has been revised.
 *
 * @see SynchronousBackend
 * @see WorkerPoolBackend
 */
public interface RevisionBackend {

    /**
     * Returns a short identifier for logs and reports (e.g. {@code "sync"}, {@code "pool"}).
     *
     * @return backend name
     */
    String name();

    /**
     * Prepares the backend.
     *
     * @return {@link RevisionStatus#SUCCESS}, or {@link RevisionStatus#BACKEND_INIT_FAILED}
     */
    RevisionStatus initialize();

    /**
     * Hands a file to the backend.
     *
     * @param path file to revise
     * @param entry entry metadata from the walk
     * @return submission status; for the synchronous backend this is the revision status itself
     */
    RevisionStatus submit(Path path, WalkEntry entry);

    /**
     * Stops accepting work, waits for all accepted work to finish and releases resources.
     * An interrupt does not cut the wait short; it is reported once the wait is over and the
     * thread's interrupt flag is set again.
     *
     * @return {@link RevisionStatus#SUCCESS}, {@link RevisionStatus#INTERRUPTED} or the shutdown
     *     failure
     */
    RevisionStatus drainAndShutdown();
}
