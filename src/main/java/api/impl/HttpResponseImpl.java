package api.impl;

import api.interfaces.http.HttpResponse;

import java.nio.charset.StandardCharsets;

public class HttpResponseImpl implements HttpResponse {
    public static final String TEXT_PLAIN = "text/plain";
    public static final String APPLICATION_JSON = "application/json";

    private int status = 200;
    private String contentType = TEXT_PLAIN;
    private byte[] body = new byte[0];

    @Override
    public void status(int code) {
        this.status = code;
    }

    @Override
    public void contentType(String type) {
        this.contentType = type;
    }

    @Override
    public void body(String text) {
        this.body = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void body(byte[] bytes) {
        this.body = bytes == null ? new byte[0] : bytes;
    }

    // getters used by writer
    public int status() { return status; }
    public String reason() { return reason(status); }
    public String contentType() { return contentType; }
    public byte[] body() { return body; }

    /** Fixed code to phrase table; anything not listed is "Error". */
    public static String reason(int code) {
        return switch (code) {
            case 200 -> "OK";
            case 404 -> "Not Found";
            default -> "Error";
        };
    }
}
