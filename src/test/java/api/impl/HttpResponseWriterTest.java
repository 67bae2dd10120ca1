package api.impl;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpResponseWriterTest {

    @Test
    void writesHeadersInFixedOrder() throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(200);
        res.contentType("text/plain");
        res.body("hello");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.write(out, res);

        assertEquals("HTTP/1.1 200 OK\r\n"
                + "Content-Type: text/plain\r\n"
                + "Content-Length: 5\r\n"
                + "Connection: close\r\n"
                + "\r\n"
                + "hello", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void contentLengthCountsBytesNotChars() {
        HttpResponseImpl res = new HttpResponseImpl();
        res.body("héllo ☃");
        String wire = new String(HttpResponseWriter.format(res), StandardCharsets.UTF_8);
        assertTrue(wire.contains("Content-Length: 10\r\n"), wire);
        assertTrue(wire.endsWith("\r\n\r\nhéllo ☃"));
    }

    @Test
    void emptyBodyHasZeroLength() {
        HttpResponseImpl res = new HttpResponseImpl();
        String wire = new String(HttpResponseWriter.format(res), StandardCharsets.US_ASCII);
        assertTrue(wire.endsWith("Content-Length: 0\r\nConnection: close\r\n\r\n"));
    }

    @Test
    void reasonComesFromFixedTable() {
        assertEquals("OK", HttpResponseImpl.reason(200));
        assertEquals("Not Found", HttpResponseImpl.reason(404));
        assertEquals("Error", HttpResponseImpl.reason(500));
        assertEquals("Error", HttpResponseImpl.reason(418));

        HttpResponseImpl res = new HttpResponseImpl();
        res.status(404);
        String wire = new String(HttpResponseWriter.format(res), StandardCharsets.US_ASCII);
        assertTrue(wire.startsWith("HTTP/1.1 404 Not Found\r\n"));
    }
}
