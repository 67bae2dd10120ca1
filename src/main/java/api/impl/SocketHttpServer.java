package api.impl;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpServer;
import infrastructure.impl.FixedWorkerPool;
import infrastructure.interfaces.IWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Listener loop in front of a {@link FixedWorkerPool}.
 * <p>
 * The acceptor thread only accepts and hands sockets to the pool; it never reads from them.
 * A failed accept is logged and the loop goes on. Closing the listener ends the loop.
 * </p>
 */
public class SocketHttpServer implements IHttpServer {

    private static final Logger log = LoggerFactory.getLogger(SocketHttpServer.class);

    private final int backlog;
    private final IWorkerPool<Socket> pool;

    private volatile ServerSocket server;
    private Thread acceptor;

    public SocketHttpServer(IHandlerFactory factory, int workers, int backlog) {
        this.pool = new FixedWorkerPool<>(workers, "worker", new ConnectionHandler(factory));
        this.backlog = backlog;
    }

    @Override
    public synchronized void start(int port) throws IOException {
        if (server != null) throw new IllegalStateException("already started");

        ServerSocket ss = new ServerSocket();
        try {
            ss.setReuseAddress(true);
            ss.bind(new InetSocketAddress(port), backlog); // all interfaces
        } catch (IOException e) {
            ss.close();
            stopWorkers();
            throw e;
        }
        server = ss;

        acceptor = new Thread(() -> acceptLoop(ss), "acceptor");
        acceptor.start();
        log.info("listening on port {} with {} workers", ss.getLocalPort(), pool.size());
    }

    private void acceptLoop(ServerSocket ss) {
        while (!ss.isClosed()) {
            Socket client;
            try {
                client = ss.accept();
            } catch (IOException e) {
                if (ss.isClosed()) break;
                log.warn("accept failed: {}", e.getMessage());
                continue;
            }
            pool.submit(client);
        }
        log.info("acceptor stopped");
    }

    @Override
    public int port() {
        ServerSocket ss = server;
        if (ss == null) throw new IllegalStateException("not started");
        return ss.getLocalPort();
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        Thread t;
        synchronized (this) {
            t = acceptor;
        }
        if (t != null) t.join();
    }

    /** Stops accepting, then drains and joins the workers. */
    @Override
    public void close() {
        ServerSocket ss = server;
        if (ss != null) {
            try {
                ss.close();
            } catch (IOException e) {
                log.warn("closing listener failed: {}", e.getMessage());
            }
        }
        try {
            awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while waiting for the acceptor");
        }
        stopWorkers();
    }

    private void stopWorkers() {
        try {
            pool.shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while shutting down workers");
        }
    }
}
