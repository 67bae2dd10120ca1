package api.impl;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

public final class HttpResponseWriter {

    public static final String VERSION = "HTTP/1.1";

    private HttpResponseWriter() {}

    /**
     * Serializes the status line, Content-Type, Content-Length, Connection: close
     * and the body, in that order. Content-Length is always the body's byte length.
     */
    public static byte[] format(HttpResponseImpl res) {
        byte[] body = res.body();
        String head = VERSION + " " + res.status() + " " + res.reason() + "\r\n"
                + "Content-Type: " + res.contentType() + "\r\n"
                + "Content-Length: " + body.length + "\r\n"
                + "Connection: close\r\n"
                + "\r\n";
        byte[] headBytes = head.getBytes(StandardCharsets.US_ASCII);

        byte[] wire = new byte[headBytes.length + body.length];
        System.arraycopy(headBytes, 0, wire, 0, headBytes.length);
        System.arraycopy(body, 0, wire, headBytes.length, body.length);
        return wire;
    }

    public static void write(OutputStream out, HttpResponseImpl res) throws IOException {
        out.write(format(res));
        out.flush();
    }
}
