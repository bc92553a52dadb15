package com.codemeter.core.walk;

/**
 * Options for {@link DirectoryWalker#walk}.
 *
 * @param recurse descend into subdirectories; if false only the root's immediate children are visited
 */
public record WalkOptions(boolean recurse) {

    /**
     * Recursive walk.
     *
     * @return default options
     */
    public static WalkOptions defaults() {
        return new WalkOptions(true);
    }
}
