package api.impl;

import api.interfaces.http.HttpRequest;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String query;
    private final String version;
    private final Map<String,String> headers;
    private final byte[] body;

    public MinimalHttpRequest(String method, String path, String query, String version,
                              Map<String,String> headers, byte[] body){
        this.method = method;
        this.path = path;
        this.query = query == null ? "" : query;
        this.version = version;
        this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(headers);
        this.body = body == null ? new byte[0] : body;
    }

    @Override public String method(){ return method; }
    @Override public String path(){ return path; }
    @Override public String query(){ return query; }
    @Override public String version(){ return version; }
    @Override public Map<String, String> headers(){ return headers; }

    @Override
    public String header(String name){
        if (name == null) return null;
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Override public byte[] body() { return body; }
}
