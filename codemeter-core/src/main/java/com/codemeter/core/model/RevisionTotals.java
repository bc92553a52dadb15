package com.codemeter.core.model;

/**
 * Global line and file totals of a revision.
 *
 * @param files files counted
 * @param blank blank lines
 * @param comment comment lines
 * @param code code lines
 * @param total physical lines
 */
public record RevisionTotals(
    long files,
    long blank,
    long comment,
    long code,
    long total
) {
    /**
     * Totals of a revision that counted nothing.
     */
    public static final RevisionTotals EMPTY = new RevisionTotals(0, 0, 0, 0, 0);

    public static RevisionTotals of(long files, long total, long blank, long comment) {
        return new RevisionTotals(files, blank, comment, total - blank - comment, total);
    }
}
