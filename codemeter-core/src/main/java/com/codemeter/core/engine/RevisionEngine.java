package com.codemeter.core.engine;

import com.codemeter.core.aggregate.Aggregator;
import com.codemeter.core.backend.FileReviser;
import com.codemeter.core.backend.RevisionBackend;
import com.codemeter.core.backend.SynchronousBackend;
import com.codemeter.core.backend.WorkerPoolBackend;
import com.codemeter.core.config.BackendKind;
import com.codemeter.core.config.RevisionConfig;
import com.codemeter.core.counting.LineClassifier;
import com.codemeter.core.io.FileLoader;
import com.codemeter.core.language.ExtensionResolver;
import com.codemeter.core.language.ExtensionTable;
import com.codemeter.core.language.LanguageFamilyClassifier;
import com.codemeter.core.model.RevisionSnapshot;
import com.codemeter.core.model.RevisionStatus;
import com.codemeter.core.walk.DirectoryWalker;
import com.codemeter.core.walk.EntryVisitor;
import com.codemeter.core.walk.WalkOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Runs a revision: walks a tree, counts every file with a known language and returns the totals.
 *
 * <p>Flow:
 * <ol>
 *   <li>Validate the root path and the configuration.</li>
 *   <li>Select a backend. A worker pool that fails to start is replaced by the synchronous
 *       backend.</li>
 *   <li>Walk the tree. Unmapped files are counted as ignored; mapped files are submitted.</li>
 *   <li>Drain the backend, then build the snapshot.</li>
 * </ol>
 *
 * <p>The engine holds only immutable collaborators; all run state lives in a {@link Revision}
 * created per call, so one engine can serve concurrent runs.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RevisionEngine engine = new RevisionEngine();
 * RevisionResult result = engine.run(Path.of("src"), RevisionConfig.defaults());
 * if (result.isSuccess()) {
 *     result.snapshot().languages().forEach(System.out::println);
 * }
 * }</pre>
 */
public class RevisionEngine {

    private static final Logger log = LoggerFactory.getLogger(RevisionEngine.class);

    private final ExtensionTable table;
    private final ExtensionResolver resolver;
    private final LanguageFamilyClassifier familyClassifier;
    private final LineClassifier lineClassifier;
    private final FileLoader loader;
    private final DirectoryWalker walker;
    private final ThreadFactory workerThreadFactory;

    /**
     * Creates an engine over the built-in extension table.
     */
    public RevisionEngine() {
        this(ExtensionTable.loadDefault(), new LanguageFamilyClassifier());
    }

    public RevisionEngine(ExtensionTable table, LanguageFamilyClassifier familyClassifier) {
        this(table, familyClassifier, null);
    }

    /**
     * Creates an engine.
     *
     * @param table extension table
     * @param familyClassifier language to comment family mapping
     * @param workerThreadFactory factory for pool workers, or {@code null} for the pool's default
     */
    public RevisionEngine(ExtensionTable table, LanguageFamilyClassifier familyClassifier,
                          ThreadFactory workerThreadFactory) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.familyClassifier = Objects.requireNonNull(familyClassifier, "familyClassifier must not be null");
        this.resolver = new ExtensionResolver(table);
        this.lineClassifier = new LineClassifier();
        this.loader = new FileLoader();
        this.walker = new DirectoryWalker();
        this.workerThreadFactory = workerThreadFactory;
    }

    /**
     * Runs a revision.
     *
     * @param root directory to walk, or a single file
     * @param config run settings, {@code null} for defaults
     * @return the run status and the finalized snapshot; never throws for I/O or configuration problems
     */
    public RevisionResult run(Path root, RevisionConfig config) {
        if (root == null) {
            log.error("No root path given");
            return new RevisionResult(RevisionStatus.INVALID_PARAMETER, RevisionSnapshot.empty(Path.of("")));
        }
        if (!Files.exists(root)) {
            log.error("Root path does not exist: {}", root);
            return new RevisionResult(RevisionStatus.INVALID_PARAMETER, RevisionSnapshot.empty(root));
        }

        RevisionConfig effectiveConfig = config != null ? config : RevisionConfig.defaults();
        List<String> problems = effectiveConfig.validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            return new RevisionResult(RevisionStatus.INVALID_CONFIGURATION, RevisionSnapshot.empty(root));
        }

        Revision revision = new Revision(root, effectiveConfig, new Aggregator(table, familyClassifier));
        FileReviser reviser = new DefaultFileReviser(revision, resolver, loader, lineClassifier);
        RevisionBackend backend = startBackend(effectiveConfig, reviser);
        revision.backendName(backend.name());

        log.info("Revising {} with the {} backend", root, backend.name());

        RevisionStatus walkStatus = walker.walk(root, visitor(revision, backend),
            new WalkOptions(effectiveConfig.effectiveRecurse()));

        // Accepted work must finish before the totals are read, even after an interrupt.
        boolean interrupted = Thread.interrupted();
        RevisionStatus drainStatus = backend.drainAndShutdown();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        RevisionStatus status = RevisionStatus.firstFailure(walkStatus, drainStatus);
        RevisionSnapshot snapshot = revision.snapshot();
        if (status.isSuccess()) {
            log.info("Revised {} files in {} ms ({} ignored, {} skipped, {} failed)",
                snapshot.totals().files(), snapshot.elapsed().toMillis(),
                snapshot.ignoredFiles(), snapshot.skippedFiles(), snapshot.failedFiles());
        } else {
            log.error("Revision of {} failed: {}", root, status);
        }
        return new RevisionResult(status, snapshot);
    }

    private EntryVisitor visitor(Revision revision, RevisionBackend backend) {
        return (path, entry) -> {
            if (entry.directory()) {
                return RevisionStatus.SUCCESS;
            }
            if (!resolver.shouldRevise(entry.name())) {
                revision.fileIgnored();
                return RevisionStatus.SUCCESS;
            }
            RevisionStatus status = backend.submit(path, entry);
            // Per-file failures are already counted; only backend failures stop the walk.
            if (status == RevisionStatus.IO_ERROR || status == RevisionStatus.RESOURCE_ERROR) {
                return RevisionStatus.SUCCESS;
            }
            return status;
        };
    }

    /**
     * Creates and initializes the configured backend, falling back to the synchronous backend
     * when a worker pool cannot start.
     */
    RevisionBackend startBackend(RevisionConfig config, FileReviser reviser) {
        int workers = config.effectiveWorkerThreadCount(WorkerPoolBackend.defaultWorkerCount());
        BackendKind kind = config.effectiveBackend();
        boolean usePool = kind == BackendKind.POOL || (kind == BackendKind.AUTO && workers > 1);

        if (usePool) {
            int capacity = config.effectiveMaxQueueLength(WorkerPoolBackend.defaultQueueCapacity(workers));
            WorkerPoolBackend pool = workerThreadFactory != null
                ? new WorkerPoolBackend(reviser, workers, capacity, workerThreadFactory)
                : new WorkerPoolBackend(reviser, workers, capacity);
            RevisionStatus status = pool.initialize();
            if (status.isSuccess()) {
                log.debug("Worker pool: {} workers, queue capacity {}", workers, capacity);
                return pool;
            }
            log.warn("Worker pool failed to start ({}), falling back to synchronous revision", status);
        }

        SynchronousBackend sync = new SynchronousBackend(reviser);
        sync.initialize();
        return sync;
    }

    public ExtensionTable table() {
        return table;
    }

    public ExtensionResolver resolver() {
        return resolver;
    }

    public LanguageFamilyClassifier familyClassifier() {
        return familyClassifier;
    }
}
