package com.questrail.datagram.internal.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * BoundedWorkerPool
 * =============================================================================
 * A fixed set of worker threads consuming a bounded FIFO queue.
 *
 * <h2>Backpressure</h2>
 * {@link #submit} blocks while the queue is full. There is no unbounded
 * buffering anywhere in the pool.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   start()              → launches the workers
 *   submit(...)          → enqueues work, blocking while full
 *   awaitDrained(...)    → stops accepting work, waits for the queue to empty
 *                          and the workers to exit, up to a deadline
 *   abandon(...)         → interrupts whatever is still running and joins it
 *   drainQueue()         → removes work that never ran
 * </pre>
 *
 * <h2>Threading Model</h2>
 * Workers poll with a short timeout so that they observe {@link #awaitDrained}
 * and {@link #abandon} without being interrupted. Interruption is used only by
 * {@link #abandon}, to unblock work that outlived the grace period.
 *
 * <p>The item handler is expected to report its own failures. Anything that
 * still escapes it, {@link Error}s included, goes to the failure callback (or
 * the log) and the worker moves on to the next item.</p>
 */
public final class BoundedWorkerPool<T> {

    private static final Logger log = LoggerFactory.getLogger(BoundedWorkerPool.class);

    static final long POLL_INTERVAL_MILLIS = 50;

    private final String name;
    private final int workerCount;
    private final BlockingQueue<T> queue;
    private final Consumer<T> handler;
    private final ThreadFactory threadFactory;
    private final BiConsumer<T, Throwable> onFailure;

    private final CancellationSignal abandoned = new CancellationSignal();
    private final List<Thread> workers = new ArrayList<>();

    private volatile boolean closed;
    private volatile boolean started;

    /**
     * @param name          diagnostic name
     * @param workerCount   number of worker threads
     * @param queueCapacity queue bound
     * @param handler       per-item work; runs on worker threads concurrently
     * @param threadFactory creates the worker threads
     */
    public BoundedWorkerPool(String name,
                             int workerCount,
                             int queueCapacity,
                             Consumer<T> handler,
                             ThreadFactory threadFactory) {
        this(name, workerCount, queueCapacity, handler, threadFactory, null);
    }

    /**
     * @param onFailure receives the item and whatever escaped {@code handler}
     *                  for it, including {@link Error}s; {@code null} means log only
     */
    public BoundedWorkerPool(String name,
                             int workerCount,
                             int queueCapacity,
                             Consumer<T> handler,
                             ThreadFactory threadFactory,
                             BiConsumer<T, Throwable> onFailure) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.workerCount = workerCount;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.handler = Objects.requireNonNull(handler, "handler");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.onFailure = onFailure;
    }

    /**
     * Launch the workers. Can only be called once.
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("pool " + name + " already started");
        }
        started = true;
        for (int i = 0; i < workerCount; i++) {
            Thread worker = threadFactory.newThread(this::runWorker);
            workers.add(worker);
            worker.start();
        }
    }

    /**
     * Enqueue {@code item}, blocking while the queue is full.
     *
     * <p>Gives up when the pool stops accepting work, when the pool is abandoned,
     * or when {@code giveUp} (if non-null) fires.</p>
     *
     * @return {@code true} if the item was queued
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean submit(T item, CancellationSignal giveUp) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        while (true) {
            if (closed || abandoned.isCancelled() || (giveUp != null && giveUp.isCancelled())) {
                return false;
            }
            if (queue.offer(item, POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
    }

    /**
     * Stop accepting work and wait until every queued item has been handled and
     * every worker has exited, or until {@code deadlineNanos} (a
     * {@link System#nanoTime()} value) passes.
     *
     * @return {@code true} if all workers exited before the deadline
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean awaitDrained(long deadlineNanos) throws InterruptedException {
        closed = true;
        for (Thread worker : snapshotWorkers()) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                return allTerminated();
            }
            TimeUnit.NANOSECONDS.timedJoin(worker, remaining);
        }
        return allTerminated();
    }

    /**
     * Stop all work now: workers finish at most their current item, which is
     * interrupted. Waits up to {@code joinTimeoutNanos} per worker.
     *
     * @return names of workers that were still alive afterwards
     */
    public List<String> abandon(long joinTimeoutNanos) {
        closed = true;
        abandoned.cancel();

        List<Thread> snapshot = snapshotWorkers();
        for (Thread worker : snapshot) {
            worker.interrupt();
        }

        List<String> survivors = new ArrayList<>();
        for (Thread worker : snapshot) {
            if (!Threads.joinUninterruptibly(worker, joinTimeoutNanos)) {
                survivors.add(worker.getName());
            }
        }
        return survivors;
    }

    /**
     * Remove and return every item still queued.
     */
    public List<T> drainQueue() {
        List<T> leftovers = new ArrayList<>();
        queue.drainTo(leftovers);
        return leftovers;
    }

    public boolean allTerminated() {
        for (Thread worker : snapshotWorkers()) {
            if (worker.isAlive()) {
                return false;
            }
        }
        return true;
    }

    public int queued() {
        return queue.size();
    }

    List<Thread> workers() {
        return Collections.unmodifiableList(snapshotWorkers());
    }

    private synchronized List<Thread> snapshotWorkers() {
        return new ArrayList<>(workers);
    }

    private void runWorker() {
        while (!abandoned.isCancelled()) {
            final T item;
            try {
                item = queue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                if (abandoned.isCancelled()) {
                    return;
                }
                continue;
            }

            if (item == null) {
                if (closed) {
                    return;
                }
                continue;
            }

            try {
                handler.accept(item);
            } catch (Throwable t) {
                handleFailure(item, t);
            }
        }
    }

    // A worker only ever exits through awaitDrained() or abandon().
    private void handleFailure(T item, Throwable failure) {
        if (onFailure == null) {
            log.error("Worker in pool {} failed on {}", name, item, failure);
            return;
        }
        try {
            onFailure.accept(item, failure);
        } catch (Throwable t) {
            log.error("Worker in pool {} failed on {}; failure callback threw", name, item, t);
        }
    }
}
