package com.codemeter.core.walk;

import java.util.Objects;

/**
 * Basic metadata of a directory entry handed to an {@link EntryVisitor}.
 *
 * @param name entry name without directories
 * @param directory true for directories
 * @param size size in bytes as reported by the file system (0 for directories)
 */
public record WalkEntry(
    String name,
    boolean directory,
    long size
) {
    /**
     * Compact constructor with validation.
     */
    public WalkEntry {
        Objects.requireNonNull(name, "name must not be null");
    }
}
