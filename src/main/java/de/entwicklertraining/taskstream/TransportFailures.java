package de.entwicklertraining.taskstream;

import de.entwicklertraining.taskstream.TaskStreamClient.ApiClientException;
import de.entwicklertraining.taskstream.TaskStreamClient.ApiTimeoutException;
import de.entwicklertraining.taskstream.TaskStreamClient.TransientTransportException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures reported by an {@link de.entwicklertraining.taskstream.transport.HttpTransport}
 * onto the client's exception hierarchy. Timeouts and I/O failures become retryable
 * {@link TransientTransportException}s, everything else an {@link ApiClientException}.
 */
public final class TransportFailures {

    private TransportFailures() {
    }

    /**
     * @param failure the failure, possibly wrapped in an ExecutionException or CompletionException
     * @param request description of the request for the message
     * @return the translated exception, never null
     */
    public static ApiClientException translate(Throwable failure, String request) {
        Throwable cause = unwrap(failure);
        if (cause instanceof ApiClientException clientException) {
            return clientException;
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return new ApiTimeoutException(request + " timed out: " + cause.getMessage(), cause);
        }
        if (cause instanceof IOException) {
            return new TransientTransportException(request + " failed: " + describe(cause), cause);
        }
        return new ApiClientException(request + " failed: " + describe(cause), cause);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
