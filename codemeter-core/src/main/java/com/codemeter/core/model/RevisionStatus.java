package com.codemeter.core.model;

/**
 * Outcome of a revision run or of one of its steps.
 *
 * <p>Statuses are returned instead of thrown. "No language mapping" is not a status: an unmapped
 * file is simply not revised.
 */
public enum RevisionStatus {
    /** Completed without error. */
    SUCCESS,
    /** Missing or unusable root path. */
    INVALID_PARAMETER,
    /** Configuration values out of range. */
    INVALID_CONFIGURATION,
    /** A file or directory could not be opened, sized or read. */
    IO_ERROR,
    /** Memory or another resource could not be obtained. */
    RESOURCE_ERROR,
    /** The backend could not start. */
    BACKEND_INIT_FAILED,
    /** The backend refused work because it is shutting down. */
    BACKEND_REJECTED,
    /** The backend failed while draining or stopping. */
    BACKEND_SHUTDOWN_FAILED,
    /** The calling thread was interrupted while waiting. */
    INTERRUPTED;

    /**
     * Returns true for {@link #SUCCESS}.
     *
     * @return true if this status is a success
     */
    public boolean isSuccess() {
        return this == SUCCESS;
    }

    /**
     * Returns the earlier of two outcomes: {@code first} unless it succeeded.
     *
     * @param first status of the earlier operation
     * @param second status of the later operation
     * @return the first failure, or {@link #SUCCESS} if both succeeded
     */
    public static RevisionStatus firstFailure(RevisionStatus first, RevisionStatus second) {
        return first.isSuccess() ? second : first;
    }
}
