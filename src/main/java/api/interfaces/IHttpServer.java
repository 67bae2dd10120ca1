package api.interfaces;

import java.io.IOException;

/*
AutoCloseable so the listener and its workers are torn down together
 */
public interface IHttpServer extends AutoCloseable {

    /** Binds on all interfaces and starts accepting. A bind failure is fatal. */
    void start(int port) throws IOException;

    /** Port actually bound, useful when started on port 0. */
    int port();

    /** Blocks until the accept loop has exited. */
    void awaitTermination() throws InterruptedException;

    @Override void close();
}
