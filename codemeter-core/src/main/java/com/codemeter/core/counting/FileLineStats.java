package com.codemeter.core.counting;

/**
 * Line tally of a single file.
 *
 * @param total number of logical lines
 * @param blank lines with no non-whitespace character outside an open block comment
 * @param comment lines carrying only comment text
 */
public record FileLineStats(
    long total,
    long blank,
    long comment
) {
    /**
     * Tally of an empty file.
     */
    public static final FileLineStats EMPTY = new FileLineStats(0, 0, 0);

    /**
     * Compact constructor with validation.
     */
    public FileLineStats {
        if (total < 0 || blank < 0 || comment < 0) {
            throw new IllegalArgumentException("line counts must not be negative");
        }
        if (blank + comment > total) {
            throw new IllegalArgumentException(
                "blank (" + blank + ") + comment (" + comment + ") exceeds total (" + total + ")");
        }
    }

    /**
     * Returns the number of code lines.
     *
     * @return {@code total - blank - comment}
     */
    public long code() {
        return total - blank - comment;
    }
}
