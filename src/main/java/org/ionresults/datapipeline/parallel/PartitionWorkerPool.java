package org.ionresults.datapipeline.parallel;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A small thread pool that runs independent partitions behind a barrier.
 * <p>
 * Keeps {@code P-1} daemon threads parked between dispatches; the calling thread
 * participates as worker 0, so the total parallelism is P. A dispatch splits the partition
 * range {@code [0, partitionCount)} into P contiguous chunks, runs them concurrently and
 * returns only after every thread finished its chunk. That return is the gather point
 * of the materialization stage.
 * <p>
 * <b>Synchronization protocol:</b>
 * <ol>
 *   <li>Caller publishes the task and increments the volatile {@code phase} counter</li>
 *   <li>Caller unparks all workers and processes chunk 0 itself</li>
 *   <li>Workers wake, see the new phase, process their chunk and increment {@code workersCompleted}</li>
 *   <li>Caller spins briefly, then parks until the last worker to finish unparks it</li>
 * </ol>
 * <p>
 * A failing partition is retried up to {@code maxAttempts} times in total, but only for failures
 * the dispatch's retry predicate accepts. Retries rerun the whole partition, so side effects
 * inside it happen at least once. After the last attempt (or a failure not worth retrying) the
 * failure is recorded; the first failure is rethrown from {@link #dispatch(int, PartitionTask)}
 * as {@link PartitionFailedException}, later ones are attached as suppressed exceptions.
 * <p>
 * <b>Thread safety:</b> {@link #dispatch(int, PartitionTask)} must only be called by one thread
 * at a time. {@link #shutdown()} is idempotent and safe to call from any thread.
 */
public class PartitionWorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PartitionWorkerPool.class);

    /**
     * Work performed for a single partition.
     */
    @FunctionalInterface
    public interface PartitionTask {
        /**
         * Processes one partition.
         *
         * @param partition partition index in {@code [0, partitionCount)}
         * @throws Exception any failure; the partition is retried or the dispatch fails
         */
        void run(int partition) throws Exception;
    }

    private static final int SPIN_LIMIT = 1_000;
    private static final long PARK_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final Thread[] workers;
    private final int totalThreads;
    private final int maxAttempts;

    private volatile int phase;
    private volatile int workSize;
    private volatile PartitionTask task;
    private volatile Predicate<Throwable> retryable;
    private volatile Thread dispatcher;
    private volatile boolean stopped;
    private final AtomicInteger workersCompleted = new AtomicInteger();
    private final AtomicReference<PartitionFailedException> failure = new AtomicReference<>();
    private final AtomicInteger readyWorkers = new AtomicInteger();

    /**
     * Creates a pool with the given parallelism and a single attempt per partition.
     *
     * @param parallelism total number of threads including the caller, must be &gt;= 1
     */
    public PartitionWorkerPool(int parallelism) {
        this(parallelism, 1);
    }

    /**
     * Creates a pool.
     * <p>
     * Spawns {@code parallelism - 1} daemon threads and waits until every one of them has read
     * its initial phase snapshot, so that the first dispatch cannot be mistaken for a spurious wakeup.
     *
     * @param parallelism total number of threads including the caller, must be &gt;= 1
     * @param maxAttempts attempts per partition, must be &gt;= 1
     * @throws IllegalArgumentException on invalid arguments
     */
    public PartitionWorkerPool(int parallelism, int maxAttempts) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be >= 1, got " + parallelism);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.totalThreads = parallelism;
        this.maxAttempts = maxAttempts;
        this.workers = new Thread[parallelism - 1];

        for (int i = 0; i < workers.length; i++) {
            int workerIndex = i + 1;
            workers[i] = new Thread(() -> workerLoop(workerIndex), "partition-worker-" + workerIndex);
            workers[i].setDaemon(true);
            workers[i].start();
        }

        while (readyWorkers.get() < workers.length) {
            Thread.onSpinWait();
        }
    }

    public int getParallelism() {
        return totalThreads;
    }

    /**
     * Runs {@code task} for every partition and blocks until all partitions finished.
     * Every failure is retried up to the pool's attempt limit.
     *
     * @param partitionCount number of partitions, nothing happens if &lt;= 0
     * @param task           work per partition
     * @throws PartitionFailedException if any partition failed after all attempts
     * @throws IllegalStateException    if the pool was shut down
     */
    public void dispatch(int partitionCount, PartitionTask task) {
        dispatch(partitionCount, task, failure -> true);
    }

    /**
     * Runs {@code task} for every partition and blocks until all partitions finished.
     *
     * @param partitionCount number of partitions, nothing happens if &lt;= 0
     * @param task           work per partition
     * @param retryable      failures that may succeed on another attempt; others fail the partition at once
     * @throws PartitionFailedException if any partition failed
     * @throws IllegalStateException    if the pool was shut down
     */
    public void dispatch(int partitionCount, PartitionTask task, Predicate<Throwable> retryable) {
        if (stopped) {
            throw new IllegalStateException("Pool has been shut down");
        }
        if (partitionCount <= 0) return;

        this.workSize = partitionCount;
        this.task = task;
        this.retryable = retryable;
        this.dispatcher = Thread.currentThread();
        failure.set(null);
        workersCompleted.set(0);

        // Volatile write, happens-before for all workers reading phase
        phase++;

        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }

        runChunk(0);

        awaitWorkers();

        PartitionFailedException failed = failure.get();
        if (failed != null) {
            throw failed;
        }
    }

    /**
     * Stops and joins all worker threads. Idempotent.
     */
    public void shutdown() {
        stopped = true;
        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }
        for (Thread worker : workers) {
            try {
                worker.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Spins for short chunks, parks for long ones. The timed park also covers an unpark that
     * arrived before the caller started parking.
     */
    private void awaitWorkers() {
        for (int spins = 0; workersCompleted.get() < workers.length; spins++) {
            if (spins < SPIN_LIMIT) {
                Thread.onSpinWait();
            } else {
                LockSupport.parkNanos(this, PARK_NANOS);
            }
        }
    }

    private void workerLoop(int workerIndex) {
        int lastPhase = phase;
        readyWorkers.incrementAndGet();

        while (!stopped) {
            LockSupport.park();

            if (stopped) break;

            int currentPhase = phase;
            if (currentPhase == lastPhase) {
                // Spurious wakeup
                continue;
            }
            lastPhase = currentPhase;

            runChunk(workerIndex);
            if (workersCompleted.incrementAndGet() == workers.length) {
                LockSupport.unpark(dispatcher);
            }
        }
    }

    private void runChunk(int threadIndex) {
        int size = workSize;
        int chunkSize = (size + totalThreads - 1) / totalThreads;
        int from = threadIndex * chunkSize;
        int to = Math.min(from + chunkSize, size);
        for (int partition = from; partition < to; partition++) {
            runPartition(partition);
        }
    }

    private void runPartition(int partition) {
        for (int attempt = 1; ; attempt++) {
            try {
                task.run(partition);
                return;
            } catch (Throwable t) {
                if (attempt < maxAttempts && retryable.test(t)) {
                    log.warn("Partition {} failed on attempt {}/{}, retrying: {}",
                        partition, attempt, maxAttempts, t.getMessage());
                    continue;
                }
                PartitionFailedException failed = new PartitionFailedException(partition, attempt, t);
                if (!failure.compareAndSet(null, failed)) {
                    failure.get().addSuppressed(failed);
                }
                return;
            }
        }
    }
}
