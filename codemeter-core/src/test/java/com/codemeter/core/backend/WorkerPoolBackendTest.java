package com.codemeter.core.backend;

import com.codemeter.core.model.RevisionStatus;
import com.codemeter.core.walk.WalkEntry;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link WorkerPoolBackend}.
 */
class WorkerPoolBackendTest {

    private static final long TIMEOUT_SECONDS = 10;

    private static WalkEntry entry(String name) {
        return new WalkEntry(name, false, 1);
    }

    /**
     * Waits until {@code thread} parks, i.e. is blocked on a lock or condition.
     */
    private static void awaitBlocked(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (thread.getState() != Thread.State.WAITING && thread.getState() != Thread.State.TIMED_WAITING) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Thread did not block: " + thread.getName() + " " + thread.getState());
            }
            Thread.sleep(5);
        }
    }

    /**
     * Reviser whose first call blocks until {@link #release} is counted down.
     */
    private static final class GatedReviser implements FileReviser {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final List<Path> revised = new CopyOnWriteArrayList<>();

        @Override
        public RevisionStatus revise(Path path) {
            started.countDown();
            try {
                if (!release.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("gate never opened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RevisionStatus.INTERRUPTED;
            }
            revised.add(path);
            return RevisionStatus.SUCCESS;
        }
    }

    @Test
    void submit_queueFull_blocksUntilSlotIsConsumed() throws Exception {
        GatedReviser reviser = new GatedReviser();
        WorkerPoolBackend pool = new WorkerPoolBackend(reviser, 1, 2);
        assertThat(pool.initialize()).isEqualTo(RevisionStatus.SUCCESS);

        // Given: the only worker is busy and the queue holds two items
        assertThat(pool.submit(Path.of("1"), entry("1"))).isEqualTo(RevisionStatus.SUCCESS);
        assertThat(reviser.started.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(pool.submit(Path.of("2"), entry("2"))).isEqualTo(RevisionStatus.SUCCESS);
        assertThat(pool.submit(Path.of("3"), entry("3"))).isEqualTo(RevisionStatus.SUCCESS);
        assertThat(pool.queuedCount()).isEqualTo(2);

        // When: a fourth item is submitted
        AtomicReference<RevisionStatus> fourth = new AtomicReference<>();
        Thread submitter = new Thread(() -> fourth.set(pool.submit(Path.of("4"), entry("4"))), "submitter");
        submitter.start();
        awaitBlocked(submitter);

        // Then: it waits for space
        assertThat(fourth.get()).isNull();
        assertThat(pool.queuedCount()).isEqualTo(2);
        assertThat(pool.activeWorkerCount()).isEqualTo(1);

        reviser.release.countDown();
        submitter.join(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));
        assertThat(fourth.get()).isEqualTo(RevisionStatus.SUCCESS);

        assertThat(pool.drainAndShutdown()).isEqualTo(RevisionStatus.SUCCESS);
        assertThat(reviser.revised).containsExactly(Path.of("1"), Path.of("2"), Path.of("3"), Path.of("4"));
        assertThat(pool.queueCapacity()).isEqualTo(2);
    }

    @Test
    void drainAndShutdown_waitsForQueuedAndInFlightWork() throws Exception {
        GatedReviser reviser = new GatedReviser();
        WorkerPoolBackend pool = new WorkerPoolBackend(reviser, 1, 4);
        pool.initialize();
        pool.submit(Path.of("a"), entry("a"));
        pool.submit(Path.of("b"), entry("b"));
        assertThat(reviser.started.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<RevisionStatus> drain = new CompletableFuture<>();
        Thread drainer = new Thread(() -> drain.complete(pool.drainAndShutdown()), "drainer");
        drainer.start();
        awaitBlocked(drainer);

        assertThat(drain).isNotDone();
        assertThat(pool.state()).isEqualTo(PoolState.DRAINING);

        reviser.release.countDown();

        assertThat(drain.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo(RevisionStatus.SUCCESS);
        assertThat(reviser.revised).containsExactly(Path.of("a"), Path.of("b"));
        assertThat(pool.state()).isEqualTo(PoolState.STOPPED);
        assertThat(pool.queuedCount()).isZero();
        assertThat(pool.activeWorkerCount()).isZero();
    }

    @Test
    void drainAndShutdown_interrupted_stillWaitsForWorkers() throws Exception {
        GatedReviser reviser = new GatedReviser();
        WorkerPoolBackend pool = new WorkerPoolBackend(reviser, 1, 4);
        pool.initialize();
        pool.submit(Path.of("a"), entry("a"));
        pool.submit(Path.of("b"), entry("b"));
        assertThat(reviser.started.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();

        // Pool state is read on the draining thread the moment drainAndShutdown returns
        CompletableFuture<RevisionStatus> drain = new CompletableFuture<>();
        AtomicReference<PoolState> stateOnReturn = new AtomicReference<>();
        AtomicInteger queuedOnReturn = new AtomicInteger(-1);
        AtomicInteger activeOnReturn = new AtomicInteger(-1);
        AtomicReference<Boolean> flag = new AtomicReference<>();
        Thread drainer = new Thread(() -> {
            RevisionStatus status = pool.drainAndShutdown();
            stateOnReturn.set(pool.state());
            queuedOnReturn.set(pool.queuedCount());
            activeOnReturn.set(pool.activeWorkerCount());
            flag.set(Thread.currentThread().isInterrupted());
            drain.complete(status);
        }, "drainer");
        drainer.start();
        awaitBlocked(drainer);

        drainer.interrupt();
        awaitBlocked(drainer);
        assertThat(drain).isNotDone();

        reviser.release.countDown();

        assertThat(drain.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo(RevisionStatus.INTERRUPTED);
        assertThat(flag.get()).isTrue();
        assertThat(stateOnReturn.get()).isEqualTo(PoolState.STOPPED);
        assertThat(queuedOnReturn.get()).isZero();
        assertThat(activeOnReturn.get()).isZero();
        assertThat(reviser.revised).containsExactly(Path.of("a"), Path.of("b"));
    }

    @Test
    void submit_afterDrain_isRejected() {
        WorkerPoolBackend pool = new WorkerPoolBackend(path -> RevisionStatus.SUCCESS, 2, 8);
        pool.initialize();

        assertThat(pool.drainAndShutdown()).isEqualTo(RevisionStatus.SUCCESS);
        assertThat(pool.submit(Path.of("late"), entry("late"))).isEqualTo(RevisionStatus.BACKEND_REJECTED);
    }

    @Test
    void submit_beforeInitialize_isRejected() {
        WorkerPoolBackend pool = new WorkerPoolBackend(path -> RevisionStatus.SUCCESS, 1, 1);

        assertThat(pool.state()).isEqualTo(PoolState.NEW);
        assertThat(pool.submit(Path.of("early"), entry("early"))).isEqualTo(RevisionStatus.BACKEND_REJECTED);
    }

    @Test
    void submit_interruptedWhileBlocked_returnsInterruptedAndKeepsFlag() throws Exception {
        GatedReviser reviser = new GatedReviser();
        WorkerPoolBackend pool = new WorkerPoolBackend(reviser, 1, 1);
        pool.initialize();
        pool.submit(Path.of("1"), entry("1"));
        assertThat(reviser.started.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        pool.submit(Path.of("2"), entry("2"));

        AtomicReference<RevisionStatus> status = new AtomicReference<>();
        AtomicReference<Boolean> flag = new AtomicReference<>();
        Thread submitter = new Thread(() -> {
            status.set(pool.submit(Path.of("3"), entry("3")));
            flag.set(Thread.currentThread().isInterrupted());
        }, "submitter");
        submitter.start();
        awaitBlocked(submitter);

        submitter.interrupt();
        submitter.join(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));

        assertThat(status.get()).isEqualTo(RevisionStatus.INTERRUPTED);
        assertThat(flag.get()).isTrue();

        reviser.release.countDown();
        assertThat(pool.drainAndShutdown()).isEqualTo(RevisionStatus.SUCCESS);
        assertThat(reviser.revised).containsExactly(Path.of("1"), Path.of("2"));
    }

    @Test
    void worker_survivesReviserException() {
        List<Path> revised = new CopyOnWriteArrayList<>();
        WorkerPoolBackend pool = new WorkerPoolBackend(path -> {
            if (path.toString().equals("boom")) {
                throw new IllegalStateException("boom");
            }
            revised.add(path);
            return RevisionStatus.SUCCESS;
        }, 1, 8);
        pool.initialize();

        pool.submit(Path.of("boom"), entry("boom"));
        pool.submit(Path.of("ok"), entry("ok"));

        assertThat(pool.drainAndShutdown()).isEqualTo(RevisionStatus.SUCCESS);
        assertThat(revised).containsExactly(Path.of("ok"));
        assertThat(pool.revisedCount()).isEqualTo(2);
    }

    @Test
    void manyWorkers_reviseEverySubmission() {
        ConcurrentHashMap<Path, Integer> seen = new ConcurrentHashMap<>();
        WorkerPoolBackend pool = new WorkerPoolBackend(path -> {
            seen.merge(path, 1, Integer::sum);
            return RevisionStatus.SUCCESS;
        }, 4, 3);
        pool.initialize();

        for (int i = 0; i < 500; i++) {
            assertThat(pool.submit(Path.of("f" + i), entry("f" + i))).isEqualTo(RevisionStatus.SUCCESS);
        }

        assertThat(pool.drainAndShutdown()).isEqualTo(RevisionStatus.SUCCESS);
        assertThat(seen).hasSize(500);
        assertThat(seen.values()).allMatch(count -> count == 1);
    }

    @Test
    void initialize_threadCreationFails_returnsInitFailed() {
        AtomicInteger created = new AtomicInteger();
        List<Thread> threads = new CopyOnWriteArrayList<>();
        ThreadFactory failingSecond = runnable -> {
            if (created.incrementAndGet() > 1) {
                return null;
            }
            Thread thread = new Thread(runnable, "first-worker");
            threads.add(thread);
            return thread;
        };
        WorkerPoolBackend pool = new WorkerPoolBackend(path -> RevisionStatus.SUCCESS, 3, 8, failingSecond);

        assertThat(pool.initialize()).isEqualTo(RevisionStatus.BACKEND_INIT_FAILED);
        assertThat(pool.state()).isEqualTo(PoolState.NEW);
        assertThat(threads).hasSize(1);
        assertThat(threads.get(0).isAlive()).isFalse();
        assertThat(pool.submit(Path.of("x"), entry("x"))).isEqualTo(RevisionStatus.BACKEND_REJECTED);
    }

    @Test
    void initialize_threadFactoryThrows_returnsInitFailed() {
        WorkerPoolBackend pool = new WorkerPoolBackend(path -> RevisionStatus.SUCCESS, 2, 8, runnable -> {
            throw new IllegalStateException("no threads for you");
        });

        assertThat(pool.initialize()).isEqualTo(RevisionStatus.BACKEND_INIT_FAILED);
    }

    @Test
    void defaults_followProcessorCount() {
        assertThat(WorkerPoolBackend.defaultWorkerCount()).isGreaterThanOrEqualTo(1);
        assertThat(WorkerPoolBackend.defaultQueueCapacity(1)).isEqualTo(64);
        assertThat(WorkerPoolBackend.defaultQueueCapacity(16)).isEqualTo(128);
    }
}
