package com.codemeter.core.backend;

import com.codemeter.core.model.RevisionStatus;
import com.codemeter.core.walk.WalkEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Backend that revises files on a fixed set of worker threads fed by a {@link BoundedWorkQueue}.
 *
 * <p>{@link #submit} enqueues a {@link WorkItem} and blocks while the queue is full
 * (backpressure on the walk). {@link #drainAndShutdown()} rejects further submissions, lets the
 * workers finish everything already queued and joins them.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * WorkerPoolBackend pool = new WorkerPoolBackend(reviser, 4, 64);
 * if (pool.initialize().isSuccess()) {
 *     pool.submit(path, entry);
 *     pool.drainAndShutdown();
 * }
 * }</pre>
 */
public class WorkerPoolBackend implements RevisionBackend {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolBackend.class);

    /**
     * Smallest default queue capacity.
     */
    public static final int MIN_DEFAULT_QUEUE_CAPACITY = 64;

    /**
     * Default queue slots per worker.
     */
    public static final int QUEUE_SLOTS_PER_WORKER = 8;

    private final FileReviser reviser;
    private final int workerCount;
    private final ThreadFactory threadFactory;
    private final BoundedWorkQueue<WorkItem> queue;
    private final List<Thread> workers = new ArrayList<>();
    private final AtomicLong revisedCount = new AtomicLong();

    private volatile boolean initialized;

    /**
     * Creates a pool with the default worker thread factory.
     *
     * @param reviser per-file operation
     * @param workerCount number of workers, at least 1
     * @param queueCapacity maximum queued items, at least 1
     */
    public WorkerPoolBackend(FileReviser reviser, int workerCount, int queueCapacity) {
        this(reviser, workerCount, queueCapacity, defaultThreadFactory());
    }

    /**
     * Creates a pool.
     *
     * @param reviser per-file operation
     * @param workerCount number of workers, at least 1
     * @param queueCapacity maximum queued items, at least 1
     * @param threadFactory factory for worker threads
     */
    public WorkerPoolBackend(FileReviser reviser, int workerCount, int queueCapacity, ThreadFactory threadFactory) {
        this.reviser = Objects.requireNonNull(reviser, "reviser must not be null");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory must not be null");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1: " + workerCount);
        }
        this.workerCount = workerCount;
        this.queue = new BoundedWorkQueue<>(queueCapacity);
    }

    /**
     * Returns the default worker count: the number of available processors, at least 1.
     *
     * @return default worker count
     */
    public static int defaultWorkerCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Returns the default queue capacity for a worker count.
     *
     * @param workerCount number of workers
     * @return {@code max(64, 8 * workerCount)}
     */
    public static int defaultQueueCapacity(int workerCount) {
        return Math.max(MIN_DEFAULT_QUEUE_CAPACITY, QUEUE_SLOTS_PER_WORKER * workerCount);
    }

    @Override
    public String name() {
        return "pool";
    }

    @Override
    public synchronized RevisionStatus initialize() {
        if (initialized) {
            log.error("Worker pool already initialized");
            return RevisionStatus.BACKEND_INIT_FAILED;
        }

        for (int i = 0; i < workerCount; i++) {
            Thread worker;
            try {
                worker = threadFactory.newThread(this::runWorker);
            } catch (RuntimeException e) {
                log.warn("Failed to create worker thread {}: {}", i, e.getMessage());
                worker = null;
            }
            if (worker == null) {
                abortInitialization();
                return RevisionStatus.BACKEND_INIT_FAILED;
            }

            queue.consumerStarted();
            try {
                worker.start();
            } catch (OutOfMemoryError | RuntimeException e) {
                // OutOfMemoryError here means "unable to create native thread", not heap exhaustion.
                queue.consumerExited();
                log.warn("Failed to start worker thread {}: {}", i, e.getMessage());
                abortInitialization();
                return RevisionStatus.BACKEND_INIT_FAILED;
            }
            workers.add(worker);
        }

        initialized = true;
        log.debug("Worker pool started: {} workers, queue capacity {}", workerCount, queue.capacity());
        return RevisionStatus.SUCCESS;
    }

    @Override
    public RevisionStatus submit(Path path, WalkEntry entry) {
        if (!initialized) {
            return RevisionStatus.BACKEND_REJECTED;
        }
        try {
            return queue.put(new WorkItem(path))
                ? RevisionStatus.SUCCESS
                : RevisionStatus.BACKEND_REJECTED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for queue space for {}", path);
            return RevisionStatus.INTERRUPTED;
        }
    }

    @Override
    public synchronized RevisionStatus drainAndShutdown() {
        if (!initialized) {
            return RevisionStatus.SUCCESS;
        }

        queue.beginDrain();
        boolean interrupted = false;
        boolean complete;
        // Accepted work always finishes and every worker is joined before this returns.
        while (true) {
            try {
                complete = queue.awaitDrained();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        interrupted |= joinWorkers();
        workers.clear();

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (!complete) {
            log.error("Worker pool stopped with unfinished work: all workers exited");
            return RevisionStatus.BACKEND_SHUTDOWN_FAILED;
        }
        if (interrupted) {
            log.warn("Interrupted while draining the worker pool; {} files revised", revisedCount.get());
            return RevisionStatus.INTERRUPTED;
        }
        log.debug("Worker pool drained: {} files revised", revisedCount.get());
        return RevisionStatus.SUCCESS;
    }

    private void abortInitialization() {
        queue.beginDrain();
        boolean interrupted = false;
        while (true) {
            try {
                queue.awaitDrained();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        interrupted |= joinWorkers();
        workers.clear();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Joins every started worker, waiting through interrupts.
     *
     * @return true if the calling thread was interrupted while waiting
     */
    private boolean joinWorkers() {
        boolean interrupted = false;
        for (Thread worker : workers) {
            while (true) {
                try {
                    worker.join();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        return interrupted;
    }

    private void runWorker() {
        try {
            while (true) {
                WorkItem item;
                try {
                    item = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Worker {} interrupted, exiting", Thread.currentThread().getName());
                    return;
                }
                if (item == null) {
                    return;
                }
                try {
                    RevisionStatus status = reviser.revise(item.path());
                    if (!status.isSuccess()) {
                        log.debug("Revision of {} finished with {}", item.path(), status);
                    }
                } catch (RuntimeException e) {
                    log.error("Unexpected failure revising {}", item.path(), e);
                } finally {
                    revisedCount.incrementAndGet();
                    queue.complete();
                }
            }
        } finally {
            queue.consumerExited();
        }
    }

    private static ThreadFactory defaultThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "codemeter-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ==================== Introspection ====================

    /**
     * Returns the lifecycle state.
     *
     * @return current state
     */
    public PoolState state() {
        return initialized ? queue.state() : PoolState.NEW;
    }

    public int workerCount() {
        return workerCount;
    }

    public int queueCapacity() {
        return queue.capacity();
    }

    /**
     * Returns the number of items waiting in the queue.
     *
     * @return queued item count
     */
    public int queuedCount() {
        return queue.size();
    }

    /**
     * Returns the number of workers currently revising a file.
     *
     * @return busy worker count
     */
    public int activeWorkerCount() {
        return queue.activeConsumers();
    }

    /**
     * Returns the number of items the workers have finished, successfully or not.
     *
     * @return finished item count
     */
    public long revisedCount() {
        return revisedCount.get();
    }
}
