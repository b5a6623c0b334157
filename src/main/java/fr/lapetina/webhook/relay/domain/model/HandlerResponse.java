package fr.lapetina.webhook.relay.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP status, content type and short body produced for one webhook call.
 * The body is copied on the way in and out, and compared by content.
 */
public record HandlerResponse(
        int statusCode,
        String contentType,
        byte[] body,
        Map<String, String> headers
) {
    public static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    public static final String APPLICATION_JSON = "application/json";

    public HandlerResponse {
        Objects.requireNonNull(contentType, "Content type is required");
        body = body != null ? body.clone() : new byte[0];
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public static HandlerResponse text(int statusCode, String message) {
        return new HandlerResponse(statusCode, TEXT_PLAIN, message.getBytes(StandardCharsets.UTF_8), null);
    }

    public static HandlerResponse json(int statusCode, byte[] json) {
        return new HandlerResponse(statusCode, APPLICATION_JSON, json, null);
    }

    public HandlerResponse withHeader(String name, String value) {
        Map<String, String> merged = new HashMap<>(headers);
        merged.put(name, value);
        return new HandlerResponse(statusCode, contentType, body, merged);
    }

    /**
     * Returns the body. The returned array is a copy.
     */
    @Override
    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HandlerResponse that = (HandlerResponse) o;
        return statusCode == that.statusCode
                && contentType.equals(that.contentType)
                && Arrays.equals(body, that.body)
                && headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(statusCode, contentType, headers) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "HandlerResponse{statusCode=" + statusCode + ", contentType=" + contentType
                + ", bodyBytes=" + body.length + ", headers=" + headers + "}";
    }
}
