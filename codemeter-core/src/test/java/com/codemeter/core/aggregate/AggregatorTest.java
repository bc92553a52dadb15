package com.codemeter.core.aggregate;

import com.codemeter.core.counting.FileLineStats;
import com.codemeter.core.language.CommentFamily;
import com.codemeter.core.language.ExtensionMapping;
import com.codemeter.core.language.ExtensionTable;
import com.codemeter.core.language.LanguageFamilyClassifier;
import com.codemeter.core.model.LanguageSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Aggregator}.
 */
class AggregatorTest {

    private ExtensionTable table;
    private Aggregator aggregator;

    @BeforeEach
    void setUp() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(".h", "C/C++ Header");
        entries.put(".java", "Java");
        entries.put(".hpp", "C/C++ Header");
        entries.put(".py", "Python");
        table = ExtensionTable.of(entries);
        aggregator = new Aggregator(table, new LanguageFamilyClassifier());
    }

    @Test
    void getOrCreateRecord_sameLanguageDifferentExtensions_shareOneRecord() {
        RevisionRecord fromH = aggregator.getOrCreateRecord(table.get(0));
        RevisionRecord fromHpp = aggregator.getOrCreateRecord(table.get(2));

        assertThat(fromHpp).isSameAs(fromH);
        assertThat(aggregator.records()).hasSize(1);

        aggregator.accumulate(fromH, new FileLineStats(10, 2, 3));
        aggregator.accumulate(fromHpp, new FileLineStats(5, 1, 1));

        LanguageSummary summary = fromH.toSummary();
        assertThat(summary.files()).isEqualTo(2);
        assertThat(summary.total()).isEqualTo(15);
        assertThat(summary.code()).isEqualTo(8);
    }

    @Test
    void getOrCreateRecord_repeatedLookup_returnsBoundRecord() {
        RevisionRecord first = aggregator.getOrCreateRecord(table.get(1));

        assertThat(aggregator.getOrCreateRecord(table.get(1))).isSameAs(first);
        assertThat(first.family()).isEqualTo(CommentFamily.C_STYLE);
    }

    @Test
    void records_areInFirstSeenOrder() {
        aggregator.getOrCreateRecord(table.get(3));
        aggregator.getOrCreateRecord(table.get(1));
        aggregator.getOrCreateRecord(table.get(0));

        assertThat(aggregator.records())
            .extracting(RevisionRecord::language)
            .containsExactly("Python", "Java", "C/C++ Header");
    }

    @Test
    void getOrCreateRecord_foreignMapping_throws() {
        ExtensionMapping foreign = new ExtensionMapping(1, ".kt", "Kotlin");

        assertThatThrownBy(() -> aggregator.getOrCreateRecord(foreign))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void separateAggregators_doNotShareBindings() {
        Aggregator other = new Aggregator(table, new LanguageFamilyClassifier());

        RevisionRecord mine = aggregator.getOrCreateRecord(table.get(1));
        RevisionRecord theirs = other.getOrCreateRecord(table.get(1));

        assertThat(theirs).isNotSameAs(mine);
    }

    @Test
    void accumulateGlobal_sumsEveryFile() {
        aggregator.accumulateGlobal(new FileLineStats(4, 1, 1));
        aggregator.accumulateGlobal(new FileLineStats(6, 0, 2));

        assertThat(aggregator.totals().files()).isEqualTo(2);
        assertThat(aggregator.totals().total()).isEqualTo(10);
        assertThat(aggregator.totals().blank()).isEqualTo(1);
        assertThat(aggregator.totals().comment()).isEqualTo(3);
        assertThat(aggregator.totals().code()).isEqualTo(6);
    }

    @Test
    void concurrentAccumulation_losesNoUpdates() throws Exception {
        int threads = 8;
        int filesPerThread = 1_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int offset = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < filesPerThread; i++) {
                        ExtensionMapping mapping = table.get((i + offset) % table.size());
                        RevisionRecord record = aggregator.getOrCreateRecord(mapping);
                        FileLineStats stats = new FileLineStats(3, 1, 1);
                        aggregator.accumulate(record, stats);
                        aggregator.accumulateGlobal(stats);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        long files = (long) threads * filesPerThread;
        assertThat(aggregator.records()).hasSize(3);
        assertThat(aggregator.totals().files()).isEqualTo(files);
        assertThat(aggregator.totals().total()).isEqualTo(3 * files);
        assertThat(aggregator.summaries().stream().mapToLong(LanguageSummary::files).sum()).isEqualTo(files);
        assertThat(aggregator.summaries().stream().mapToLong(LanguageSummary::code).sum()).isEqualTo(files);
    }
}
