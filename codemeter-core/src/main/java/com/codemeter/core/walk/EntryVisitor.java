package com.codemeter.core.walk;

import com.codemeter.core.model.RevisionStatus;

import java.nio.file.Path;

/**
 * Callback invoked by {@link DirectoryWalker} for every entry it does not skip.
 */
@FunctionalInterface
public interface EntryVisitor {

    /**
     * Visits one entry.
     *
     * @param path full path of the entry
     * @param entry entry metadata
     * @return {@link RevisionStatus#SUCCESS} to continue; any other status aborts the walk and is
     *         returned by {@link DirectoryWalker#walk}
     */
    RevisionStatus visit(Path path, WalkEntry entry);
}
