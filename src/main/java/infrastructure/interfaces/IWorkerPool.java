package infrastructure.interfaces;

/**
 * Fixed set of long-lived workers fed from one shared queue.
 *
 * @param <T> unit of work, processed by exactly one worker
 */
public interface IWorkerPool<T> {

    /**
     * Enqueues without blocking.
     *
     * @return false when the pool has been shut down; the item is then dropped
     */
    boolean submit(T item);

    /** Stops accepting work, lets workers drain the queue and joins them. */
    void shutdown() throws InterruptedException;

    int size();
}
