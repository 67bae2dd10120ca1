package api.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads one request (request line, headers, optional body) off a raw stream.
 * <p>
 * Only a missing or malformed request line makes the request unusable; every
 * later step falls back to a default instead of failing.
 * </p>
 */
public final class RequestParser {

    private static final Logger log = LoggerFactory.getLogger(RequestParser.class);

    static final String DEFAULT_VERSION = "HTTP/1.1";
    static final String CONTENT_LENGTH = "content-length";

    private RequestParser() {}

    /**
     * @param in stream positioned at the start of a request; callers should buffer it
     * @return the request, or empty when the peer closed immediately or the request line
     *         has fewer than two tokens
     */
    public static Optional<MinimalHttpRequest> parse(InputStream in) {
        String start;
        try {
            start = readLine(in); // e.g., "GET /something?json=true HTTP/1.1"
        } catch (IOException e) {
            log.debug("request line unreadable: {}", e.getMessage());
            return Optional.empty();
        }
        if (start == null || start.isEmpty()) {
            return Optional.empty();
        }

        String[] parts = start.trim().split("\\s+");
        if (parts.length < 2) {
            return Optional.empty();
        }
        String method = parts[0];
        String fullPath = parts[1];
        String version = parts.length > 2 ? parts[2] : DEFAULT_VERSION;

        int q = fullPath.indexOf('?');
        String path = q < 0 ? fullPath : fullPath.substring(0, q);
        String query = q < 0 ? "" : fullPath.substring(q + 1);

        Map<String, String> headers = readHeaders(in);
        int len = contentLength(headers.get(CONTENT_LENGTH));
        byte[] body = readBody(in, len);

        return Optional.of(new MinimalHttpRequest(method, path, query, version, headers, body));
    }

    /** Reads header lines until a blank line, end of stream or a read failure. */
    static Map<String, String> readHeaders(InputStream in) {
        Map<String, String> headers = new LinkedHashMap<>();
        try {
            String line;
            while ((line = readLine(in)) != null && !line.trim().isEmpty()) {
                String trimmed = line.trim();
                int idx = trimmed.indexOf(": ");
                if (idx < 0) continue; // no separator, skip
                headers.put(trimmed.substring(0, idx).toLowerCase(Locale.ROOT), trimmed.substring(idx + 2));
            }
        } catch (IOException e) {
            log.debug("header section cut short: {}", e.getMessage());
        }
        return headers;
    }

    /** Decimal digits only and within int range; anything else counts as 0. */
    static int contentLength(String value) {
        if (value == null || value.isEmpty()) return 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /** Exactly {@code len} bytes, or an empty body on a short read or I/O failure. */
    static byte[] readBody(InputStream in, int len) {
        if (len <= 0) return new byte[0];
        try {
            byte[] body = in.readNBytes(len);
            if (body.length < len) {
                log.debug("short body: expected {} bytes, got {}", len, body.length);
                return new byte[0];
            }
            return body;
        } catch (IOException e) {
            log.debug("body unreadable: {}", e.getMessage());
            return new byte[0];
        }
    }

    /**
     * Reads up to LF and strips a trailing CR.
     *
     * @return the line, or null at end of stream with nothing read
     */
    static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                return decode(buf.toByteArray());
            }
            buf.write(b);
        }
        return (buf.size() == 0) ? null : decode(buf.toByteArray());
    }

    private static String decode(byte[] bytes) {
        int len = bytes.length;
        if (len > 0 && bytes[len - 1] == '\r') len--;
        return new String(bytes, 0, len, StandardCharsets.UTF_8);
    }
}
