package dev.providers.engine;

import dev.providers.error.QueueClearedException;
import dev.providers.error.QueueTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs provider calls with bounded concurrency. Pending tasks start in priority
 * order, first-in first-out within a priority. A task that outlives the timeout
 * fails with {@link QueueTimeoutException} and its worker thread is interrupted,
 * which aborts any retry sleep, poll sleep, HTTP exchange or process wait in progress.
 */
public final class ProviderQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderQueue.class);

    public static final int DEFAULT_MAX_CONCURRENT = 3;
    public static final long DEFAULT_TIMEOUT_MS = 120_000;

    public enum Priority {
        LOW(1),
        NORMAL(2),
        URGENT(3);

        private final int weight;

        Priority(int weight) {
            this.weight = weight;
        }

        public int weight() {
            return weight;
        }
    }

    /** Counters for {@link #status()}. */
    public record QueueStatus(int pending, int running, int completed, int failed) {}

    private record Entry<T>(String id, Priority priority, long sequence, Callable<T> task,
                            CompletableFuture<T> result) {}

    private static final Comparator<Entry<?>> ORDER = Comparator
        .comparingInt((Entry<?> e) -> e.priority().weight()).reversed()
        .thenComparingLong(e -> e.sequence());

    private final int maxConcurrent;
    private final long timeoutMs;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final PriorityQueue<Entry<?>> pending = new PriorityQueue<>(ORDER);
    private long sequence;
    private int running;
    private int completed;
    private int failed;

    public ProviderQueue() {
        this(DEFAULT_MAX_CONCURRENT, DEFAULT_TIMEOUT_MS);
    }

    public ProviderQueue(int maxConcurrent, long timeoutMs) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got " + timeoutMs);
        }
        this.maxConcurrent = maxConcurrent;
        this.timeoutMs = timeoutMs;
        this.workers = Executors.newCachedThreadPool(daemonThreads("provider-queue-"));
        this.timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("provider-queue-timer-"));
    }

    public int maxConcurrent() { return maxConcurrent; }
    public long timeoutMs() { return timeoutMs; }

    public <T> CompletableFuture<T> enqueue(String id, Callable<T> task) {
        return enqueue(id, Priority.NORMAL, task);
    }

    /**
     * Queue a task; it starts as soon as a slot is free and no higher-priority
     * or earlier task is waiting.
     */
    public synchronized <T> CompletableFuture<T> enqueue(String id, Priority priority, Callable<T> task) {
        var result = new CompletableFuture<T>();
        pending.add(new Entry<>(id, priority == null ? Priority.NORMAL : priority, sequence++, task, result));
        dispatch();
        return result;
    }

    public synchronized QueueStatus status() {
        return new QueueStatus(pending.size(), running, completed, failed);
    }

    /**
     * Drop every task that has not started yet; their futures fail with
     * {@link QueueClearedException}. Running tasks are left alone.
     */
    public synchronized void clear() {
        Entry<?> entry;
        while ((entry = pending.poll()) != null) {
            entry.result().completeExceptionally(new QueueClearedException(entry.id()));
        }
        notifyAll();
    }

    /** Block until nothing is pending or running. */
    public synchronized void drain() throws InterruptedException {
        while (running > 0 || !pending.isEmpty()) {
            wait();
        }
    }

    @Override
    public void close() {
        clear();
        workers.shutdownNow();
        timer.shutdownNow();
    }

    private void dispatch() {
        while (running < maxConcurrent && !pending.isEmpty()) {
            Entry<?> next = pending.poll();
            running++;
            log.debug("Starting task {} ({} priority), {} running", next.id(), next.priority(), running);
            workers.execute(() -> execute(next));
        }
    }

    private <T> void execute(Entry<T> entry) {
        Thread worker = Thread.currentThread();
        ScheduledFuture<?> timeout = timer.schedule(() -> {
            if (entry.result().completeExceptionally(new QueueTimeoutException(entry.id(), timeoutMs))) {
                log.warn("Task {} exceeded {} ms; interrupting", entry.id(), timeoutMs);
                worker.interrupt();
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);

        try {
            entry.result().complete(entry.task().call());
        } catch (Exception e) {
            entry.result().completeExceptionally(e);
        } finally {
            timeout.cancel(false);
            finished(entry);
        }
    }

    private synchronized void finished(Entry<?> entry) {
        running--;
        if (entry.result().isCompletedExceptionally()) {
            failed++;
        } else {
            completed++;
        }
        dispatch();
        notifyAll();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
