package com.codemeter.core.backend;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One queued file job of the {@link WorkerPoolBackend}.
 *
 * @param path file to revise
 */
public record WorkItem(Path path) {

    public WorkItem {
        Objects.requireNonNull(path, "path must not be null");
    }
}
