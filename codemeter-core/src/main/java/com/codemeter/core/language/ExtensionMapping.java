package com.codemeter.core.language;

import java.util.Objects;

/**
 * One entry of the extension table: an extension key (or a whole file name prefixed with a dot)
 * mapped to a language name.
 *
 * <p>The {@code index} is the entry's position in its {@link ExtensionTable}. Per-run state such
 * as the bound revision record is keyed by this index, so the table itself stays immutable and can
 * be shared by concurrent runs.
 *
 * @param index position of this entry in the table
 * @param extension extension key including the leading dot, e.g. {@code ".java"} or {@code ".CMakeLists.txt"}
 * @param language language or file type name, e.g. {@code "Java"}
 */
public record ExtensionMapping(
    int index,
    String extension,
    String language
) {
    /**
     * Compact constructor with validation.
     */
    public ExtensionMapping {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        Objects.requireNonNull(extension, "extension must not be null");
        Objects.requireNonNull(language, "language must not be null");
        if (extension.isEmpty() || extension.charAt(0) != '.') {
            throw new IllegalArgumentException("extension must start with a dot: " + extension);
        }
        if (language.isBlank()) {
            throw new IllegalArgumentException("language must not be blank");
        }
    }

    /**
     * Returns true if the key contains more than one dot (e.g. {@code ".blade.php"}).
     *
     * @return true for multi-dot keys
     */
    public boolean isMultiDot() {
        return extension.indexOf('.', 1) > 0;
    }
}
