package com.codemeter.core.engine;

import com.codemeter.core.aggregate.Aggregator;
import com.codemeter.core.aggregate.RevisionRecord;
import com.codemeter.core.backend.FileReviser;
import com.codemeter.core.counting.FileLineStats;
import com.codemeter.core.counting.LineClassifier;
import com.codemeter.core.io.FileBufferView;
import com.codemeter.core.io.FileLoader;
import com.codemeter.core.language.ExtensionMapping;
import com.codemeter.core.language.ExtensionResolver;
import com.codemeter.core.model.RevisionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Revises one file: resolve its language, load it, count its lines and add the counts to the
 * revision.
 *
 * <p>Safe to call from several worker threads at once. Per-file failures are logged, counted on
 * the {@link Revision} and reported as a status; they never throw.
 */
public class DefaultFileReviser implements FileReviser {

    private static final Logger log = LoggerFactory.getLogger(DefaultFileReviser.class);

    private final Revision revision;
    private final ExtensionResolver resolver;
    private final FileLoader loader;
    private final LineClassifier classifier;

    public DefaultFileReviser(Revision revision, ExtensionResolver resolver, FileLoader loader,
                              LineClassifier classifier) {
        this.revision = Objects.requireNonNull(revision, "revision must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public RevisionStatus revise(Path path) {
        Path fileName = path.getFileName();
        Optional<ExtensionMapping> mapping = resolver.resolve(fileName != null ? fileName.toString() : "");
        if (mapping.isEmpty()) {
            revision.fileIgnored();
            return RevisionStatus.SUCCESS;
        }

        FileBufferView view;
        try {
            view = loader.load(path);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", path, e.getMessage());
            revision.fileFailed();
            return RevisionStatus.IO_ERROR;
        } catch (OutOfMemoryError e) {
            log.error("Not enough memory to load {}", path);
            revision.fileFailed();
            return RevisionStatus.RESOURCE_ERROR;
        }

        if (!view.text()) {
            revision.fileSkipped();
            return RevisionStatus.SUCCESS;
        }

        // A language gets its record only once one of its files has been read as text.
        Aggregator aggregator = revision.aggregator();
        RevisionRecord record = aggregator.getOrCreateRecord(mapping.get());
        FileLineStats stats = classifier.classify(record.family(), view);
        aggregator.accumulate(record, stats);
        aggregator.accumulateGlobal(stats);
        log.debug("{}: {} ({} lines, {} blank, {} comment)",
            path, record.language(), stats.total(), stats.blank(), stats.comment());
        return RevisionStatus.SUCCESS;
    }
}
