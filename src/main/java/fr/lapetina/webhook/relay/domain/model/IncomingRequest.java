package fr.lapetina.webhook.relay.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Represents an inbound webhook call, detached from the HTTP runtime that received it.
 * Immutable and thread-safe.
 *
 * <p>Header names are case-insensitive and every header may carry several values,
 * in the order they were received.
 */
public final class IncomingRequest {

    private final String method;
    private final String path;
    private final Map<String, List<String>> headers;
    private final Map<String, List<String>> queryParameters;
    private final byte[] body;
    private final String peerAddress;

    private IncomingRequest(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "Method is required");
        this.path = builder.path != null ? builder.path : "/";
        this.headers = freeze(builder.headers, true);
        this.queryParameters = freeze(builder.queryParameters, false);
        this.body = builder.body != null ? builder.body.clone() : new byte[0];
        this.peerAddress = builder.peerAddress;
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    /**
     * Returns the raw body. The returned array is a copy.
     */
    public byte[] body() {
        return body.clone();
    }

    public int bodySize() {
        return body.length;
    }

    /**
     * Returns the socket peer address, or null if the runtime could not determine it.
     */
    public String peerAddress() {
        return peerAddress;
    }

    public String contentType() {
        return header("Content-Type");
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    /**
     * Returns the first value of the named header, or null if absent.
     */
    public String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Returns every value of the named header in arrival order.
     */
    public List<String> headerValues(String name) {
        return headers.getOrDefault(name, List.of());
    }

    /**
     * Returns the first value of the named query parameter, or null if absent.
     */
    public String queryParameter(String name) {
        List<String> values = queryParameters.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public boolean isPost() {
        return "POST".equalsIgnoreCase(method);
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> source, boolean caseInsensitive) {
        Map<String, List<String>> copy = caseInsensitive
                ? new TreeMap<>(String.CASE_INSENSITIVE_ORDER)
                : new LinkedHashMap<>();
        source.forEach((name, values) -> copy.merge(name, List.copyOf(values), (a, b) -> {
            List<String> merged = new ArrayList<>(a);
            merged.addAll(b);
            return List.copyOf(merged);
        }));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "IncomingRequest{method=" + method + ", path=" + path + ", bodySize=" + body.length + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String method;
        private String path;
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private final Map<String, List<String>> queryParameters = new LinkedHashMap<>();
        private byte[] body;
        private String peerAddress;

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder header(String name, String value) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder headers(Map<String, List<String>> headers) {
            headers.forEach((name, values) -> values.forEach(value -> header(name, value)));
            return this;
        }

        public Builder queryParameter(String name, String value) {
            queryParameters.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder peerAddress(String peerAddress) {
            this.peerAddress = peerAddress;
            return this;
        }

        public IncomingRequest build() {
            return new IncomingRequest(this);
        }
    }
}
