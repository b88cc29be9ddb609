package de.entwicklertraining.taskstream.auth;

import java.util.Objects;

/**
 * An access/refresh token pair. Replaced as a whole, never field by field.
 *
 * @param accessToken bearer token sent with every request
 * @param refreshToken token exchanged for a new pair; may be null when refreshing is not possible
 */
public record Credential(String accessToken, String refreshToken) {
    public Credential {
        Objects.requireNonNull(accessToken, "accessToken");
        if (accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken must not be blank");
        }
        if (refreshToken != null && refreshToken.isBlank()) {
            refreshToken = null;
        }
    }

    public boolean hasRefreshToken() {
        return refreshToken != null;
    }

    /**
     * Shortens a token for log output.
     *
     * @param token the token
     * @return the first four characters followed by {@code ***}
     */
    public static String mask(String token) {
        if (token == null) {
            return "null";
        }
        if (token.length() <= 8) {
            return "***";
        }
        return token.substring(0, 4) + "***";
    }

    @Override
    public String toString() {
        return "Credential{accessToken=" + mask(accessToken) + ", refreshToken=" + mask(refreshToken) + '}';
    }
}
