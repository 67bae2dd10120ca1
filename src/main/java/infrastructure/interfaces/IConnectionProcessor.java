package infrastructure.interfaces;

/** Processes one unit of work to completion on the calling worker thread. */
@FunctionalInterface
public interface IConnectionProcessor<T> {
    void process(T item);
}
