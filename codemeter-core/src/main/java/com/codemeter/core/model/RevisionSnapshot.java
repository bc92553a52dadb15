package com.codemeter.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Finalized result of a revision, built once the backend has drained.
 *
 * <p>Languages are listed in first-seen order; renderers sort as they see fit.
 *
 * @param root scanned root path
 * @param backend name of the backend that ran the revision
 * @param languages per-language rows
 * @param totals global totals
 * @param ignoredFiles files without a language mapping
 * @param skippedFiles mapped files that were not text (binary, bad UTF-16, too large)
 * @param failedFiles mapped files that could not be read
 * @param elapsed wall-clock duration of the run
 */
public record RevisionSnapshot(
    Path root,
    String backend,
    List<LanguageSummary> languages,
    RevisionTotals totals,
    long ignoredFiles,
    long skippedFiles,
    long failedFiles,
    Duration elapsed
) {
    public RevisionSnapshot {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(backend, "backend must not be null");
        Objects.requireNonNull(totals, "totals must not be null");
        languages = languages != null ? List.copyOf(languages) : List.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    /**
     * Creates a snapshot for a run that never reached the walk.
     *
     * @param root scanned root path
     * @return an empty snapshot
     */
    public static RevisionSnapshot empty(Path root) {
        return new RevisionSnapshot(root, "none", List.of(), RevisionTotals.EMPTY, 0, 0, 0, Duration.ZERO);
    }

    /**
     * Returns languages ordered by code lines descending, then by name.
     *
     * @return sorted copy of {@link #languages()}
     */
    public List<LanguageSummary> languagesByCode() {
        return languages.stream()
            .sorted(Comparator.comparingLong(LanguageSummary::code).reversed()
                .thenComparing(LanguageSummary::language))
            .toList();
    }

    /**
     * Finds the row for a language.
     *
     * @param language language name
     * @return the row, or {@code null} if the language was not seen
     */
    public LanguageSummary language(String language) {
        return languages.stream()
            .filter(summary -> summary.language().equals(language))
            .findFirst()
            .orElse(null);
    }
}
