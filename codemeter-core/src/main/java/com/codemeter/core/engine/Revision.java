package com.codemeter.core.engine;

import com.codemeter.core.aggregate.Aggregator;
import com.codemeter.core.config.RevisionConfig;
import com.codemeter.core.model.RevisionSnapshot;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State of one revision run, passed explicitly to everything that takes part in it.
 *
 * <p>Each call to {@link RevisionEngine#run} creates its own instance, so runs never share
 * counters or language records.
 */
public final class Revision {

    private final Path root;
    private final RevisionConfig config;
    private final Aggregator aggregator;
    private final long startNanos = System.nanoTime();

    private final AtomicLong ignoredFiles = new AtomicLong();
    private final AtomicLong skippedFiles = new AtomicLong();
    private final AtomicLong failedFiles = new AtomicLong();

    private volatile String backendName = "none";

    public Revision(Path root, RevisionConfig config, Aggregator aggregator) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
    }

    public Path root() {
        return root;
    }

    public RevisionConfig config() {
        return config;
    }

    public Aggregator aggregator() {
        return aggregator;
    }

    public String backendName() {
        return backendName;
    }

    void backendName(String backendName) {
        this.backendName = backendName;
    }

    /** A file without a language mapping. */
    void fileIgnored() {
        ignoredFiles.incrementAndGet();
    }

    /** A mapped file that is not text. */
    void fileSkipped() {
        skippedFiles.incrementAndGet();
    }

    /** A mapped file that could not be read. */
    void fileFailed() {
        failedFiles.incrementAndGet();
    }

    public long ignoredFiles() {
        return ignoredFiles.get();
    }

    public long skippedFiles() {
        return skippedFiles.get();
    }

    public long failedFiles() {
        return failedFiles.get();
    }

    /**
     * Builds the finalized snapshot. Only meaningful after the backend has drained.
     *
     * @return snapshot of the current counters
     */
    public RevisionSnapshot snapshot() {
        return new RevisionSnapshot(
            root,
            backendName,
            aggregator.summaries(),
            aggregator.totals(),
            ignoredFiles.get(),
            skippedFiles.get(),
            failedFiles.get(),
            Duration.ofNanos(System.nanoTime() - startNanos)
        );
    }
}
