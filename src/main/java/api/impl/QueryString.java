package api.impl;

import java.util.LinkedHashMap;
import java.util.Map;

/** Splits a raw query string into parameters. Values are not percent-decoded. */
public final class QueryString {

    private QueryString() {}

    /**
     * Segments are separated by '&amp;' and split on the first '='. Empty segments and
     * segments without '=' are dropped; a repeated key keeps its last value.
     */
    public static Map<String, String> parse(String raw) {
        Map<String, String> params = new LinkedHashMap<>();
        if (raw == null || raw.isEmpty()) return params;

        for (String segment : raw.split("&")) {
            if (segment.isEmpty()) continue;
            int eq = segment.indexOf('=');
            if (eq < 0) continue;
            params.put(segment.substring(0, eq), segment.substring(eq + 1));
        }
        return params;
    }
}
