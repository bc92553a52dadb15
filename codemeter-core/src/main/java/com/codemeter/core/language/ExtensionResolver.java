package com.codemeter.core.language;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a bare file name to an {@link ExtensionMapping}.
 *
 * <p><b>Resolution order:</b>
 * <ol>
 *   <li>The whole file name prefixed with a dot, so table entries such as
 *       {@code ".Dockerfile"} or {@code ".CMakeLists.txt"} match files without an extension.</li>
 *   <li>Every suffix that starts at a dot, beginning with the leftmost dot. Longer suffixes are
 *       tried first, so {@code "view.blade.php"} resolves to {@code ".blade.php"} before
 *       {@code ".php"}.</li>
 * </ol>
 *
 * <p>Keys are compared case-insensitively (ASCII folding only). When two table keys fold to the
 * same value the entry that appears first in the table wins.
 *
 * <p>Instances are immutable and safe for concurrent use.
 */
public final class ExtensionResolver {

    private final ExtensionTable table;
    private final Map<String, ExtensionMapping> index;

    /**
     * Creates a resolver over the given table.
     *
     * @param table extension table
     */
    public ExtensionResolver(ExtensionTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.index = new HashMap<>(table.size() * 2);
        for (ExtensionMapping mapping : table.mappings()) {
            index.putIfAbsent(foldAscii(mapping.extension()), mapping);
        }
    }

    /**
     * Returns the table this resolver was built from.
     *
     * @return extension table
     */
    public ExtensionTable table() {
        return table;
    }

    /**
     * Resolves a file name.
     *
     * @param fileName bare file name without directories
     * @return the matching mapping, or empty if the name matches no entry
     */
    public Optional<ExtensionMapping> resolve(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return Optional.empty();
        }

        ExtensionMapping wholeName = index.get(foldAscii("." + fileName));
        if (wholeName != null) {
            return Optional.of(wholeName);
        }

        int dot = fileName.indexOf('.');
        while (dot >= 0) {
            ExtensionMapping mapping = index.get(foldAscii(fileName.substring(dot)));
            if (mapping != null) {
                return Optional.of(mapping);
            }
            dot = fileName.indexOf('.', dot + 1);
        }
        return Optional.empty();
    }

    /**
     * Returns true if the file name resolves to a known language.
     *
     * @param fileName bare file name
     * @return true if the file should be revised
     */
    public boolean shouldRevise(String fileName) {
        return resolve(fileName).isPresent();
    }

    /**
     * Lower-cases ASCII letters only; other characters are kept as they are.
     */
    static String foldAscii(String value) {
        char[] chars = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                if (chars == null) {
                    chars = value.toCharArray();
                }
                chars[i] = (char) (c + ('a' - 'A'));
            }
        }
        return chars == null ? value : new String(chars);
    }
}
