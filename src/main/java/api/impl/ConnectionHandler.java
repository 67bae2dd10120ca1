package api.impl;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import infrastructure.interfaces.IConnectionProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.util.Locale;
import java.util.Optional;

/**
 * One request/response exchange per connection: parse, route, write, close.
 * <p>
 * Every failure stays inside {@link #process(Socket)}; the socket is closed on all paths.
 * </p>
 */
public class ConnectionHandler implements IConnectionProcessor<Socket> {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);

    private final IHandlerFactory factory;

    public ConnectionHandler(IHandlerFactory factory) {
        this.factory = factory;
    }

    @Override
    public void process(Socket client) {
        try (Socket s = client;
             InputStream in = new BufferedInputStream(s.getInputStream());
             OutputStream out = s.getOutputStream()) {

            s.setTcpNoDelay(true);

            Optional<MinimalHttpRequest> parsed = RequestParser.parse(in);
            if (parsed.isEmpty()) {
                log.debug("dropping {}: malformed or empty request line", s.getRemoteSocketAddress());
                return;
            }

            HttpResponseImpl res = respond(parsed.get());
            HttpResponseWriter.write(out, res);

        } catch (SocketException se) {
            if (isPeerGone(se)) {
                log.debug("peer went away: {}", se.getMessage());
            } else {
                log.warn("socket error: {}", se.getMessage());
            }
        } catch (IOException e) {
            log.warn("connection error: {}", e.getMessage());
        }
    }

    /** Routes the request; a failing handler yields a 500. */
    HttpResponseImpl respond(MinimalHttpRequest req) {
        HttpResponseImpl res = new HttpResponseImpl();
        IHttpHandler handler = factory.create(req);
        try {
            handler.handle(req, res);
        } catch (Exception | StackOverflowError e) {
            log.error("handler failed for {} {}", req.method(), req.path(), e);
            res = new HttpResponseImpl();
            res.status(500);
            res.contentType(HttpResponseImpl.TEXT_PLAIN);
            res.body("Internal Server Error");
        }
        return res;
    }

    private static boolean isPeerGone(SocketException se) {
        String msg = String.valueOf(se.getMessage()).toLowerCase(Locale.ROOT);
        return msg.contains("connection reset") || msg.contains("broken pipe")
                || msg.contains("socket write error") || msg.contains("software caused connection abort");
    }
}
