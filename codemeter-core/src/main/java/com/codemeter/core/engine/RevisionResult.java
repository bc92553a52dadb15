package com.codemeter.core.engine;

import com.codemeter.core.model.RevisionSnapshot;
import com.codemeter.core.model.RevisionStatus;

import java.util.Objects;

/**
 * Outcome of {@link RevisionEngine#run}.
 *
 * <p>The snapshot is always present. For a run that failed before the walk started it is empty;
 * for a run that failed during the walk or drain it holds whatever was counted.
 *
 * @param status overall status, the earliest failure if any
 * @param snapshot finalized counts
 */
public record RevisionResult(
    RevisionStatus status,
    RevisionSnapshot snapshot
) {
    public RevisionResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }
}
