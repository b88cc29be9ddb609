package de.entwicklertraining.taskstream.auth;

import de.entwicklertraining.taskstream.ClientSettings;
import de.entwicklertraining.taskstream.HttpConfiguration;
import de.entwicklertraining.taskstream.HttpMethod;
import de.entwicklertraining.taskstream.cancellation.CancellationException;
import de.entwicklertraining.taskstream.cancellation.CancellationToken;
import de.entwicklertraining.taskstream.transport.HttpTransport;
import de.entwicklertraining.taskstream.transport.TransportRequest;
import de.entwicklertraining.taskstream.transport.TransportResponse;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exchanges the stored refresh token for a new credential pair.
 *
 * <p>Refreshes are single-flight: callers that ask for a refresh while one is running wait
 * for that one and share its outcome instead of sending their own request. A caller that
 * arrives after the running refresh finished starts a new one.
 *
 * <p>The endpoint receives {@code {"refresh_token": "..."}} and answers with
 * {@code {"payload": {"access_token": "...", "refresh_token": "..."}}}. A successful refresh
 * replaces the stored credential; any failure clears it, including a refresh that gets no
 * answer within the request timeout.
 */
public class TokenRefresher {
    private static final Logger logger = LoggerFactory.getLogger(TokenRefresher.class);

    private final HttpTransport transport;
    private final ClientSettings settings;
    private final HttpConfiguration httpConfig;
    private final CredentialStore store;

    private final Object lock = new Object();
    private CompletableFuture<Credential> inFlight;
    private final AtomicInteger refreshCount = new AtomicInteger();

    public TokenRefresher(HttpTransport transport,
                          ClientSettings settings,
                          HttpConfiguration httpConfig,
                          CredentialStore store) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.httpConfig = Objects.requireNonNull(httpConfig, "httpConfig");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Refreshes the credential, joining a refresh that is already running.
     *
     * @return the new credential
     * @throws AuthException if no refresh token is available or the refresh failed
     */
    public Credential refresh() {
        return refresh(CancellationToken.none());
    }

    /**
     * Refreshes the credential, joining a refresh that is already running. Cancelling the
     * token stops this caller's wait; the shared refresh keeps running for the others.
     *
     * @param token cancels the wait
     * @return the new credential
     * @throws AuthException if no refresh token is available or the refresh failed
     * @throws CancellationException if the token is cancelled before the refresh finished
     */
    public Credential refresh(CancellationToken token) {
        token.throwIfCancelled();
        CompletableFuture<Credential> flight;
        boolean leader = false;
        synchronized (lock) {
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                leader = true;
            }
            flight = inFlight;
        }

        if (leader) {
            CompletableFuture<Credential> refreshing;
            try {
                refreshing = startRefresh();
            } catch (RuntimeException e) {
                refreshing = CompletableFuture.failedFuture(e);
            }
            refreshing.whenComplete((credential, failure) -> {
                synchronized (lock) {
                    inFlight = null;
                }
                if (failure != null) {
                    flight.completeExceptionally(unwrap(failure));
                } else {
                    flight.complete(credential);
                }
            });
        } else {
            logger.debug("Joining refresh already in flight");
        }
        return await(flight, token);
    }

    /**
     * Called after a request carrying {@code rejectedAccessToken} was answered with 401.
     * If the store already holds a different access token, another caller has refreshed in
     * the meantime and that token is returned without a network call.
     *
     * @param rejectedAccessToken the access token the rejected request was sent with, or null
     * @return the credential to replay the request with
     * @throws AuthException if a refresh was needed and failed
     */
    public Credential refreshAfterRejection(String rejectedAccessToken) {
        return refreshAfterRejection(rejectedAccessToken, CancellationToken.none());
    }

    /**
     * Like {@link #refreshAfterRejection(String)}, giving up the wait when the token is cancelled.
     *
     * @param rejectedAccessToken the access token the rejected request was sent with, or null
     * @param token cancels the wait for the refresh
     * @return the credential to replay the request with
     * @throws AuthException if a refresh was needed and failed
     * @throws CancellationException if the token is cancelled before the refresh finished
     */
    public Credential refreshAfterRejection(String rejectedAccessToken, CancellationToken token) {
        Optional<Credential> current = store.get();
        if (current.isPresent() && rejectedAccessToken != null
                && !current.get().accessToken().equals(rejectedAccessToken)) {
            logger.debug("Credential already refreshed by another caller, skipping refresh");
            return current.get();
        }
        return refresh(token);
    }

    /**
     * Number of refresh requests actually sent to the endpoint.
     *
     * @return the count since construction
     */
    public int getRefreshCount() {
        return refreshCount.get();
    }

    private Credential await(CompletableFuture<Credential> flight, CancellationToken token) {
        // a private copy, so one caller's cancellation leaves the shared flight alone
        CompletableFuture<Credential> waiting = flight.copy();
        try (CancellationToken.Registration ignored = token.onCancel(() -> waiting.cancel(false))) {
            return waiting.get();
        } catch (java.util.concurrent.CancellationException e) {
            throw new CancellationException("Cancelled while waiting for token refresh", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthException("Interrupted while waiting for token refresh", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new AuthException("Token refresh failed", e.getCause());
        }
    }

    private CompletableFuture<Credential> startRefresh() {
        String refreshToken = store.get()
                .map(Credential::refreshToken)
                .or(() -> settings.getFallbackCredential().map(Credential::refreshToken))
                .orElse(null);
        if (refreshToken == null) {
            store.clear();
            return CompletableFuture.failedFuture(new AuthException("No refresh token available"));
        }

        refreshCount.incrementAndGet();
        logger.debug("Refreshing access token with refresh token {}", Credential.mask(refreshToken));

        TransportRequest request = buildRequest(refreshToken);
        CompletableFuture<TransportResponse<String>> sent;
        try {
            sent = transport.send(request);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        if (request.timeout() != null) {
            sent = sent.orTimeout(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        return sent.handle((response, failure) -> toCredential(request, response, failure, refreshToken));
    }

    private Credential toCredential(TransportRequest request,
                                    TransportResponse<String> response,
                                    Throwable failure,
                                    String refreshToken) {
        if (failure != null) {
            store.clear();
            Throwable cause = unwrap(failure);
            if (cause instanceof TimeoutException) {
                throw new AuthException("Token refresh got no response within "
                        + request.timeout().toMillis() + " ms", cause);
            }
            throw new AuthException("Token refresh failed: " + cause.getMessage(), cause);
        }

        if (!response.isSuccess()) {
            store.clear();
            throw new AuthException("Token refresh rejected with HTTP " + response.status());
        }

        Credential credential;
        try {
            credential = parseCredential(response.body(), refreshToken);
        } catch (JSONException | IllegalArgumentException e) {
            store.clear();
            throw new AuthException("Token refresh returned an unusable response: " + e.getMessage(), e);
        }
        store.set(credential);
        logger.info("Access token refreshed");
        return credential;
    }

    private static Throwable unwrap(Throwable failure) {
        if ((failure instanceof CompletionException || failure instanceof ExecutionException)
                && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private TransportRequest buildRequest(String refreshToken) {
        Map<String, String> headers = new LinkedHashMap<>(httpConfig.getGlobalHeaders());
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "application/json");
        String body = new JSONObject().put("refresh_token", refreshToken).toString();
        TransportRequest request = new TransportRequest(
                HttpMethod.POST,
                settings.resolve(settings.getRefreshPath()),
                headers,
                body,
                settings.getRequestTimeout());
        return httpConfig.applyModifiers(request);
    }

    private static Credential parseCredential(String body, String previousRefreshToken) {
        JSONObject payload = new JSONObject(body).getJSONObject("payload");
        String accessToken = payload.getString("access_token");
        String refreshToken = payload.optString("refresh_token", null);
        return new Credential(accessToken,
                refreshToken == null || refreshToken.isBlank() ? previousRefreshToken : refreshToken);
    }
}
