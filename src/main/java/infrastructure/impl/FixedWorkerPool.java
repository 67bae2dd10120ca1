package infrastructure.impl;

import infrastructure.interfaces.IConnectionProcessor;
import infrastructure.interfaces.IWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * FixedWorkerPool bounds concurrent processing to a fixed number of threads.
 * <p>
 * Work waits in an unbounded {@link LinkedBlockingQueue}; each worker takes one item,
 * runs it to completion and only then takes the next. Workers share nothing but the queue.
 * </p>
 * <p>
 * Shutdown enqueues one end-of-work marker per worker behind whatever is already
 * queued, so every accepted item is processed before the workers exit.
 * </p>
 *
 * @param <T> closeable unit of work (an accepted socket in production)
 */
public final class FixedWorkerPool<T extends Closeable> implements IWorkerPool<T> {

    private static final Logger log = LoggerFactory.getLogger(FixedWorkerPool.class);

    /** Queue slot; a null item marks end of work for one worker. */
    private record Slot<T>(T item) {}

    private final BlockingQueue<Slot<T>> queue = new LinkedBlockingQueue<>();
    private final List<Thread> workers;
    private final IConnectionProcessor<T> processor;

    private final Object submitLock = new Object();
    private boolean closed; // guarded by submitLock

    /**
     * Starts {@code size} workers immediately.
     *
     * @param size      number of workers (minimum 1)
     * @param name      thread name prefix, e.g. "worker"
     * @param processor invoked on a worker thread for every submitted item
     */
    public FixedWorkerPool(int size, String name, IConnectionProcessor<T> processor) {
        if (size < 1) throw new IllegalArgumentException("pool size must be >= 1: " + size);
        this.processor = processor;

        List<Thread> threads = new ArrayList<>(size);
        for (int i = 1; i <= size; i++) {
            Thread t = new Thread(this::runWorker, name + "-" + i);
            threads.add(t);
            t.start();
        }
        this.workers = Collections.unmodifiableList(threads);
    }

    @Override
    public boolean submit(T item) {
        Objects.requireNonNull(item, "item");
        synchronized (submitLock) {
            if (!closed) {
                queue.add(new Slot<>(item));
                return true;
            }
        }
        log.warn("worker pool is shut down, dropping {}", item);
        closeQuietly(item);
        return false;
    }

    @Override
    public void shutdown() throws InterruptedException {
        synchronized (submitLock) {
            if (!closed) {
                closed = true;
                for (int i = 0; i < workers.size(); i++) {
                    queue.add(new Slot<>(null));
                }
            }
        }
        for (Thread t : workers) {
            if (t != Thread.currentThread()) t.join();
        }
    }

    @Override
    public int size() {
        return workers.size();
    }

    private void runWorker() {
        while (true) {
            Slot<T> slot;
            try {
                slot = queue.take(); // the only wait point of a worker
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted, exiting", Thread.currentThread().getName());
                return;
            }
            if (slot.item() == null) {
                return;
            }
            try {
                processor.process(slot.item());
            } catch (Throwable t) {
                // the worker keeps serving whatever the item threw
                log.error("unhandled failure while processing {}", slot.item(), t);
                closeQuietly(slot.item());
            }
        }
    }

    private static void closeQuietly(Closeable c) {
        try {
            c.close();
        } catch (IOException e) {
            log.debug("close failed: {}", e.getMessage());
        }
    }
}
