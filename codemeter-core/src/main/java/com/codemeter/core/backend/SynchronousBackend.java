package com.codemeter.core.backend;

import com.codemeter.core.model.RevisionStatus;
import com.codemeter.core.walk.WalkEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Backend that revises each file inline on the submitting thread.
 *
 * <p>An unexpected exception from the reviser is logged and reported as
 * {@link RevisionStatus#IO_ERROR}, a per-file failure that does not stop the walk.
 */
public class SynchronousBackend implements RevisionBackend {

    private static final Logger log = LoggerFactory.getLogger(SynchronousBackend.class);

    private final FileReviser reviser;

    public SynchronousBackend(FileReviser reviser) {
        this.reviser = Objects.requireNonNull(reviser, "reviser must not be null");
    }

    @Override
    public String name() {
        return "sync";
    }

    @Override
    public RevisionStatus initialize() {
        return RevisionStatus.SUCCESS;
    }

    @Override
    public RevisionStatus submit(Path path, WalkEntry entry) {
        try {
            return reviser.revise(path);
        } catch (RuntimeException e) {
            // Same outcome as on a pool worker: the file is lost, the walk goes on.
            log.error("Unexpected failure revising {}", path, e);
            return RevisionStatus.IO_ERROR;
        }
    }

    @Override
    public RevisionStatus drainAndShutdown() {
        return RevisionStatus.SUCCESS;
    }
}
