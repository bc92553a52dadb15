package com.codemeter.core.aggregate;

import com.codemeter.core.counting.FileLineStats;
import com.codemeter.core.language.CommentFamily;
import com.codemeter.core.model.LanguageSummary;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running statistics for one language during one revision.
 *
 * <p>Created once per language by {@link Aggregator} and never removed. Counters only grow and
 * are updated without locking, so a read while workers are running may lag but is never
 * negative.
 */
public final class RevisionRecord {

    private final String language;
    private final CommentFamily family;

    private final AtomicLong files = new AtomicLong();
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong blank = new AtomicLong();
    private final AtomicLong comment = new AtomicLong();

    RevisionRecord(String language, CommentFamily family) {
        this.language = Objects.requireNonNull(language, "language must not be null");
        this.family = Objects.requireNonNull(family, "family must not be null");
    }

    /**
     * Adds one file's counts.
     *
     * @param stats counts of the file
     */
    void accumulate(FileLineStats stats) {
        files.incrementAndGet();
        total.addAndGet(stats.total());
        blank.addAndGet(stats.blank());
        comment.addAndGet(stats.comment());
    }

    public String language() {
        return language;
    }

    /**
     * Returns the comment family resolved when the record was created.
     *
     * @return comment family of {@link #language()}
     */
    public CommentFamily family() {
        return family;
    }

    public long files() {
        return files.get();
    }

    public long total() {
        return total.get();
    }

    public long blank() {
        return blank.get();
    }

    public long comment() {
        return comment.get();
    }

    /**
     * Returns an immutable copy of the counters. Call after the backend has drained.
     *
     * @return summary row
     */
    public LanguageSummary toSummary() {
        return LanguageSummary.of(language, files.get(), total.get(), blank.get(), comment.get());
    }

    @Override
    public String toString() {
        return "RevisionRecord[" + language + ", files=" + files.get() + ", total=" + total.get() + "]";
    }
}
