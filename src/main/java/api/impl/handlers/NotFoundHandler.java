package api.impl.handlers;

import api.impl.HttpResponseImpl;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

public class NotFoundHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        res.status(404);
        res.contentType(HttpResponseImpl.TEXT_PLAIN);
        res.body("Not Found");
    }
}
