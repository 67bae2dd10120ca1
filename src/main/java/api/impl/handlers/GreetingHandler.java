package api.impl.handlers;

import api.impl.HttpResponseImpl;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

public class GreetingHandler implements IHttpHandler {
    public static final String GREETING = "Hello from Java!";

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        res.status(200);
        res.contentType(HttpResponseImpl.TEXT_PLAIN);
        res.body(GREETING);
    }
}
