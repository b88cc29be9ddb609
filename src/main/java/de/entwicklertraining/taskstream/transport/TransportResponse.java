package de.entwicklertraining.taskstream.transport;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A transport-level response.
 *
 * @param status the HTTP status code
 * @param headers response headers, never null
 * @param body the body; a String for plain calls, an InputStream for streams
 * @param <T> the body type
 */
public record TransportResponse<T>(int status, Map<String, List<String>> headers, T body) {
    public TransportResponse {
        if (headers == null) {
            headers = Map.of();
        }
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isUnauthorized() {
        return status == 401;
    }

    /**
     * Returns the first value of a header, matching the name case-insensitively.
     *
     * @param name the header name
     * @return the first value, if present
     */
    public Optional<String> firstHeader(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)
                    && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return Optional.of(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }
}
