package de.entwicklertraining.taskstream;

import de.entwicklertraining.taskstream.cancellation.CancellationToken;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything needed to send one logical request: verb, path, body, headers and the
 * cancellation token shared by all of its attempts.
 *
 * <p>A descriptor is immutable. Retries, auth replays and stream reconnects all send the
 * same descriptor again; only the {@code Authorization} header is recomputed per attempt.
 */
public final class RequestDescriptor {
    private final HttpMethod method;
    private final String path;
    private final String body;
    private final Map<String, String> headers;
    private final CancellationToken cancellationToken;
    private final Integer maxAttempts;

    private RequestDescriptor(Builder builder) {
        this.method = builder.method;
        this.path = builder.path;
        this.body = builder.body;
        this.headers = Map.copyOf(builder.headers);
        this.cancellationToken = builder.cancellationToken != null
                ? builder.cancellationToken
                : CancellationToken.none();
        this.maxAttempts = builder.maxAttempts;
    }

    public static Builder builder(HttpMethod method, String path) {
        return new Builder(method, path);
    }

    public static RequestDescriptor get(String path) {
        return builder(HttpMethod.GET, path).build();
    }

    public static RequestDescriptor delete(String path) {
        return builder(HttpMethod.DELETE, path).build();
    }

    public static RequestDescriptor post(String path, JSONObject body) {
        return builder(HttpMethod.POST, path).body(body).build();
    }

    public static RequestDescriptor put(String path, JSONObject body) {
        return builder(HttpMethod.PUT, path).body(body).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(method, path);
        builder.body = body;
        builder.headers.putAll(headers);
        builder.cancellationToken = cancellationToken;
        builder.maxAttempts = maxAttempts;
        return builder;
    }

    /**
     * Returns a copy of this descriptor bound to another cancellation token.
     *
     * @param token the token
     * @return the copy
     */
    public RequestDescriptor withCancellationToken(CancellationToken token) {
        return toBuilder().cancellationToken(token).build();
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    /**
     * The serialized request body.
     *
     * @return the body, or null when the request has none
     */
    public String getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    /**
     * Attempt budget set on this request, overriding the client's per-verb budget.
     *
     * @return the override, if any
     */
    public Optional<Integer> getMaxAttempts() {
        return Optional.ofNullable(maxAttempts);
    }

    @Override
    public String toString() {
        return method + " " + path;
    }

    public static final class Builder {
        private final HttpMethod method;
        private final String path;
        private String body;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private CancellationToken cancellationToken;
        private Integer maxAttempts;

        private Builder(HttpMethod method, String path) {
            this.method = Objects.requireNonNull(method, "method");
            this.path = Objects.requireNonNull(path, "path");
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder body(JSONObject body) {
            this.body = body == null ? null : body.toString();
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        /**
         * Sets the total number of attempts for this request. For POST and PUT this is
         * the explicit opt-in to repeating a non-idempotent call.
         *
         * @param maxAttempts total attempts including the first one (must be >= 1)
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RequestDescriptor build() {
            if (path.isBlank()) {
                throw new IllegalArgumentException("path must not be blank");
            }
            if (maxAttempts != null && maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
            }
            headers.forEach((name, value) -> {
                if (name == null || value == null) {
                    throw new IllegalArgumentException("Header names and values must not be null");
                }
                if (name.equalsIgnoreCase("Authorization")) {
                    throw new IllegalArgumentException("Authorization is managed by the credential store");
                }
            });
            return new RequestDescriptor(this);
        }
    }
}
