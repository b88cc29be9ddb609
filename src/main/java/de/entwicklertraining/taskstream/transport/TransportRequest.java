package de.entwicklertraining.taskstream.transport;

import de.entwicklertraining.taskstream.HttpMethod;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * A fully resolved outgoing HTTP request: absolute URI, final headers (including
 * {@code Authorization}) and the per-attempt timeout.
 *
 * @param method the HTTP verb
 * @param uri the absolute target URI
 * @param headers request headers, never null
 * @param body the request body, or null for none
 * @param timeout per-attempt timeout, or null for the transport default
 */
public record TransportRequest(HttpMethod method,
                               URI uri,
                               Map<String, String> headers,
                               String body,
                               Duration timeout) {
    private static final String BEARER_PREFIX = "Bearer ";

    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * Returns the token of the {@code Authorization: Bearer} header. The header name is
     * matched case-insensitively, since request modifiers may rewrite it.
     *
     * @return the bearer token, or null if the request carries none
     */
    public String bearerToken() {
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getKey().equalsIgnoreCase("Authorization")
                    && header.getValue() != null
                    && header.getValue().startsWith(BEARER_PREFIX)) {
                return header.getValue().substring(BEARER_PREFIX.length());
            }
        }
        return null;
    }
}
