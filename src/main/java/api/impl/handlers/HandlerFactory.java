package api.impl.handlers;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;

/** Fixed route table; method and path must match exactly. */
public class HandlerFactory implements IHandlerFactory {

    private final IHttpHandler greeting = new GreetingHandler();
    private final IHttpHandler queryEcho = new QueryEchoHandler();
    private final IHttpHandler bodyEcho = new BodyEchoHandler();
    private final IHttpHandler notFound = new NotFoundHandler();

    @Override
    public IHttpHandler create(HttpRequest req) {
        String m = req.method();
        String p = req.path();

        if ("/".equals(p) && "GET".equals(m)) return greeting;
        if ("/something".equals(p)) {
            if ("GET".equals(m)) return queryEcho;
            if ("POST".equals(m)) return bodyEcho;
        }
        return notFound;
    }
}
