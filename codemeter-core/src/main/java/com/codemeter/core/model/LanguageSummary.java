package com.codemeter.core.model;

import java.util.Objects;

/**
 * Immutable per-language row of a finished revision.
 *
 * @param language language name
 * @param files number of files counted for the language
 * @param blank blank lines
 * @param comment comment lines
 * @param code code lines, {@code total - blank - comment}
 * @param total physical lines
 */
public record LanguageSummary(
    String language,
    long files,
    long blank,
    long comment,
    long code,
    long total
) {
    public LanguageSummary {
        Objects.requireNonNull(language, "language must not be null");
        if (files < 0 || blank < 0 || comment < 0 || code < 0 || total < 0) {
            throw new IllegalArgumentException("counts must not be negative for " + language);
        }
        if (blank + comment + code != total) {
            throw new IllegalArgumentException(
                "blank + comment + code must equal total for " + language);
        }
    }

    /**
     * Creates a summary, deriving the code count.
     */
    public static LanguageSummary of(String language, long files, long total, long blank, long comment) {
        return new LanguageSummary(language, files, blank, comment, total - blank - comment, total);
    }
}
