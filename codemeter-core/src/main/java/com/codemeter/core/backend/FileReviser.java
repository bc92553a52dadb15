package com.codemeter.core.backend;

import com.codemeter.core.model.RevisionStatus;

import java.nio.file.Path;

/**
 * The per-file "revise" operation: load, classify and aggregate one file.
 *
 * <p>Implementations must be safe to call from several threads at once.
 */
@FunctionalInterface
public interface FileReviser {

    /**
     * Revises one file.
     *
     * @param path file to revise
     * @return {@link RevisionStatus#SUCCESS} or the reason the file could not be revised
     */
    RevisionStatus revise(Path path);
}
