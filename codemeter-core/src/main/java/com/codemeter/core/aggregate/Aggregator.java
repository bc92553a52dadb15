package com.codemeter.core.aggregate;

import com.codemeter.core.counting.FileLineStats;
import com.codemeter.core.language.CommentFamily;
import com.codemeter.core.language.ExtensionMapping;
import com.codemeter.core.language.ExtensionTable;
import com.codemeter.core.language.LanguageFamilyClassifier;
import com.codemeter.core.model.LanguageSummary;
import com.codemeter.core.model.RevisionTotals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Thread-safe collector of per-language {@link RevisionRecord}s and global counters for one
 * revision.
 *
 * <p>Each extension mapping is bound to its record the first time a file with that extension is
 * revised. The binding lives in a slot indexed by {@link ExtensionMapping#index()}, so lookups
 * after the first one are a single volatile read. The first lookup takes the aggregator lock,
 * re-checks the slot and merges by language name: {@code .h} and {@code .hpp} share one record if
 * they map to the same language.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Aggregator aggregator = new Aggregator(table, new LanguageFamilyClassifier());
 * RevisionRecord record = aggregator.getOrCreateRecord(mapping);
 * aggregator.accumulate(record, stats);
 * aggregator.accumulateGlobal(stats);
 * }</pre>
 */
public final class Aggregator {

    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    private final ExtensionTable table;
    private final LanguageFamilyClassifier familyClassifier;
    private final AtomicReferenceArray<RevisionRecord> bound;

    private final Object lock = new Object();
    private final Map<String, RevisionRecord> recordsByLanguage = new LinkedHashMap<>();

    private final AtomicLong files = new AtomicLong();
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong blank = new AtomicLong();
    private final AtomicLong comment = new AtomicLong();

    public Aggregator(ExtensionTable table, LanguageFamilyClassifier familyClassifier) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.familyClassifier = Objects.requireNonNull(familyClassifier, "familyClassifier must not be null");
        this.bound = new AtomicReferenceArray<>(table.size());
    }

    /**
     * Returns the record bound to a mapping, creating and binding it on first use.
     *
     * @param mapping a mapping of this aggregator's table
     * @return the record of the mapping's language
     * @throws IllegalArgumentException if the mapping does not belong to the table
     */
    public RevisionRecord getOrCreateRecord(ExtensionMapping mapping) {
        int index = mapping.index();
        if (index >= bound.length() || !table.get(index).equals(mapping)) {
            throw new IllegalArgumentException("Mapping is not part of this table: " + mapping);
        }

        RevisionRecord record = bound.get(index);
        if (record != null) {
            return record;
        }

        synchronized (lock) {
            record = bound.get(index);
            if (record != null) {
                return record;
            }
            record = recordsByLanguage.get(mapping.language());
            if (record == null) {
                CommentFamily family = familyClassifier.classify(mapping.language());
                record = new RevisionRecord(mapping.language(), family);
                recordsByLanguage.put(mapping.language(), record);
                log.debug("New language record: {} ({})", mapping.language(), family);
            }
            bound.set(index, record);
            return record;
        }
    }

    /**
     * Adds one file's counts to its language record.
     */
    public void accumulate(RevisionRecord record, FileLineStats stats) {
        record.accumulate(stats);
    }

    /**
     * Adds one file's counts to the global totals.
     */
    public void accumulateGlobal(FileLineStats stats) {
        files.incrementAndGet();
        total.addAndGet(stats.total());
        blank.addAndGet(stats.blank());
        comment.addAndGet(stats.comment());
    }

    /**
     * Returns the records created so far, in first-seen order.
     *
     * @return copy of the record list
     */
    public List<RevisionRecord> records() {
        synchronized (lock) {
            return new ArrayList<>(recordsByLanguage.values());
        }
    }

    /**
     * Returns one summary row per record, in first-seen order.
     *
     * @return summary rows
     */
    public List<LanguageSummary> summaries() {
        return records().stream()
            .map(RevisionRecord::toSummary)
            .toList();
    }

    /**
     * Returns the global counters.
     *
     * @return global totals
     */
    public RevisionTotals totals() {
        return RevisionTotals.of(files.get(), total.get(), blank.get(), comment.get());
    }
}
