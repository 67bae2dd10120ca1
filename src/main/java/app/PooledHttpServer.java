package app;

import api.impl.SocketHttpServer;
import api.impl.handlers.HandlerFactory;
import api.interfaces.IHttpServer;
import infrastructure.config.ServerConfig;

public class PooledHttpServer {

    public static void main(String[] args) throws Exception {
        ServerConfig config = ServerConfig.resolve(args);

        IHttpServer server = new SocketHttpServer(new HandlerFactory(), config.workers(), config.backlog());
        server.start(config.port()); // bind failure is fatal

        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "shutdown"));
        server.awaitTermination();
    }
}
