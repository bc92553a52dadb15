package com.codemeter.core.walk;

import com.codemeter.core.model.RevisionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

/**
 * Depth-first, visitor-driven traversal of a directory tree.
 *
 * <p>Rules:
 * <ul>
 *   <li>If the root is a regular file the visitor is called once for it and nothing is enumerated.</li>
 *   <li>Entries named {@code .} and {@code ..} are skipped.</li>
 *   <li>Symbolic links and other special entries are skipped with a warning, so link cycles
 *       cannot trap the walk.</li>
 *   <li>A directory is visited before its children.</li>
 *   <li>A visitor status other than {@link RevisionStatus#SUCCESS} stops the walk and is returned.</li>
 *   <li>An unreadable root is fatal ({@link RevisionStatus#IO_ERROR}); an unreadable subdirectory
 *       is logged and skipped.</li>
 * </ul>
 */
public class DirectoryWalker {

    private static final Logger log = LoggerFactory.getLogger(DirectoryWalker.class);

    /**
     * Walks the tree under {@code root}.
     *
     * @param root root directory or single file
     * @param visitor entry callback
     * @param options walk options
     * @return {@link RevisionStatus#SUCCESS}, the visitor's failure status, or the root's I/O failure
     */
    public RevisionStatus walk(Path root, EntryVisitor visitor, WalkOptions options) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(visitor, "visitor must not be null");
        Objects.requireNonNull(options, "options must not be null");

        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(root, BasicFileAttributes.class);
        } catch (IOException e) {
            log.error("Cannot read root {}: {}", root, e.getMessage());
            return RevisionStatus.IO_ERROR;
        }

        if (!attributes.isDirectory()) {
            Path fileName = root.getFileName();
            String name = fileName != null ? fileName.toString() : root.toString();
            return visitor.visit(root, new WalkEntry(name, false, attributes.size()));
        }

        try {
            return walkDirectory(root, visitor, options.recurse());
        } catch (IOException e) {
            log.error("Cannot list root directory {}: {}", root, e.getMessage());
            return RevisionStatus.IO_ERROR;
        }
    }

    private RevisionStatus walkDirectory(Path directory, EntryVisitor visitor, boolean recurse) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path path : entries) {
                Path fileName = path.getFileName();
                if (fileName == null) {
                    continue;
                }
                String name = fileName.toString();
                if (name.equals(".") || name.equals("..")) {
                    continue;
                }

                BasicFileAttributes attributes;
                try {
                    attributes = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                } catch (IOException e) {
                    log.warn("Skipping {}: cannot read attributes ({})", path, e.getMessage());
                    continue;
                }

                if (attributes.isSymbolicLink() || attributes.isOther()) {
                    log.warn("Skipping link or special file: {}", path);
                    continue;
                }

                boolean isDirectory = attributes.isDirectory();
                RevisionStatus status = visitor.visit(path,
                    new WalkEntry(name, isDirectory, isDirectory ? 0 : attributes.size()));
                if (!status.isSuccess()) {
                    return status;
                }

                if (isDirectory && recurse) {
                    RevisionStatus nested;
                    try {
                        nested = walkDirectory(path, visitor, true);
                    } catch (IOException e) {
                        log.warn("Skipping unreadable directory {}: {}", path, e.getMessage());
                        continue;
                    }
                    if (!nested.isSuccess()) {
                        return nested;
                    }
                }
            }
        } catch (DirectoryIteratorException e) {
            throw e.getCause();
        }
        return RevisionStatus.SUCCESS;
    }
}
