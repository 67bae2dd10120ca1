package api.impl.handlers;

import api.impl.HttpResponseImpl;
import api.impl.QueryString;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import java.util.Map;

/** Echoes the route and its query parameters, as JSON when {@code json=true}. */
public class QueryEchoHandler implements IHttpHandler {
    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        Map<String, String> query = QueryString.parse(req.query());
        res.status(200);

        if ("true".equals(query.get("json"))) {
            JsonObject root = new JsonObject();
            root.addProperty("route", req.path());
            root.add("query", gson.toJsonTree(query));
            res.contentType(HttpResponseImpl.APPLICATION_JSON);
            res.body(gson.toJson(root));
        } else {
            res.contentType(HttpResponseImpl.TEXT_PLAIN);
            res.body("Route: " + req.path() + ", Query: " + query);
        }
    }
}
