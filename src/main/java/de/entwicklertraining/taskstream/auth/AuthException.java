package de.entwicklertraining.taskstream.auth;

import de.entwicklertraining.taskstream.TaskStreamClient;

/**
 * Authentication could not be restored: no refresh token was available, the refresh
 * endpoint rejected the refresh, or the request was rejected again after a refresh.
 */
public class AuthException extends TaskStreamClient.ApiClientException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
