package api.interfaces.http;

import java.util.Map;

/** Minimal request contract */
public interface HttpRequest {
    String method();
    String path();

    /** Raw query string (text after the first '?'), never null. */
    String query();

    String version();

    /** Case-insensitive lookup; null when absent. */
    String header(String name);

    /** Headers keyed by lower-cased name. */
    Map<String, String> headers();

    /** Request body, empty when no usable Content-Length was sent. */
    byte[] body();
}
