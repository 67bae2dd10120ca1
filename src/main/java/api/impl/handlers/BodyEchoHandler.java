package api.impl.handlers;

import api.impl.HttpResponseImpl;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

/**
 * Wraps the request body as {@code {"route":...,"body":...}}.
 * <p>
 * A body that is a strict JSON document nested at most {@link #MAX_DEPTH} levels is
 * embedded as that value; any other text is embedded as a JSON string, so the response
 * is always valid JSON. No body gives {@code {}}.
 * </p>
 */
public class BodyEchoHandler implements IHttpHandler {
    /** Deeper documents are echoed as text; serializing them recurses per level. */
    static final int MAX_DEPTH = 128;

    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();
    private static final TypeAdapter<JsonElement> elements = gson.getAdapter(JsonElement.class);

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonObject root = new JsonObject();
        root.addProperty("route", req.path());
        root.add("body", embed(req.body()));

        res.status(200);
        res.contentType(HttpResponseImpl.APPLICATION_JSON);
        res.body(gson.toJson(root));
    }

    static JsonElement embed(byte[] bytes) {
        if (bytes == null || bytes.length == 0) return new JsonObject();

        String payload = new String(bytes, StandardCharsets.UTF_8);
        if (payload.isBlank() || depth(payload) > MAX_DEPTH) return new JsonPrimitive(payload);
        try {
            JsonReader reader = new JsonReader(new StringReader(payload));
            reader.setLenient(false);
            JsonElement value = elements.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) return new JsonPrimitive(payload);
            return value;
        } catch (IOException | RuntimeException e) {
            return new JsonPrimitive(payload);
        }
    }

    /** Deepest array/object nesting, ignoring brackets inside string literals. */
    static int depth(String text) {
        int depth = 0;
        int max = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"') inString = false;
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '[', '{' -> max = Math.max(max, ++depth);
                case ']', '}' -> depth--;
                default -> { }
            }
        }
        return max;
    }
}
