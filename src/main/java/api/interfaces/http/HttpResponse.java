package api.interfaces.http;

/** Minimal response contract */
public interface HttpResponse {
    /** Sets the status; the reason phrase is derived from the code. */
    void status(int code);
    void contentType(String type);
    void body(String text);
    void body(byte[] bytes);
}
