package de.entwicklertraining.taskstream.auth;

import de.entwicklertraining.taskstream.ClientSettings;
import de.entwicklertraining.taskstream.HttpConfiguration;
import de.entwicklertraining.taskstream.ScriptedTransport;
import de.entwicklertraining.taskstream.cancellation.CancellationException;
import de.entwicklertraining.taskstream.cancellation.CancellationToken;
import de.entwicklertraining.taskstream.transport.TransportRequest;
import de.entwicklertraining.taskstream.transport.TransportResponse;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

public class TokenRefresherTest {

    private ScriptedTransport transport;
    private InMemoryCredentialStore store;
    private ClientSettings settings;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        store = new InMemoryCredentialStore(new Credential("access-old", "refresh-old"));
        settings = ClientSettings.builder().baseUrl("https://api.example.com").build();
    }

    private TokenRefresher refresher() {
        return new TokenRefresher(transport, settings, HttpConfiguration.defaults(), store);
    }

    @Test
    @DisplayName("Successful refresh replaces the stored pair")
    void testRefresh() {
        transport.refreshSucceeds("access-new", "refresh-new");
        TokenRefresher refresher = refresher();

        Credential credential = refresher.refresh();

        assertEquals(new Credential("access-new", "refresh-new"), credential);
        assertEquals(credential, store.get().orElseThrow());
        assertEquals(1, refresher.getRefreshCount());

        TransportRequest request = transport.refreshRequests().get(0);
        assertEquals("https://api.example.com/api/v1/refresh-token", request.uri().toString());
        assertEquals("application/json", request.headers().get("Content-Type"));
        assertEquals("refresh-old", new JSONObject(request.body()).getString("refresh_token"));
    }

    @Test
    @DisplayName("A response without refresh token keeps the previous refresh token")
    void testRefreshKeepsRefreshToken() {
        transport.refreshResponds(200, "{\"payload\":{\"access_token\":\"access-new\"}}");

        Credential credential = refresher().refresh();

        assertEquals(new Credential("access-new", "refresh-old"), credential);
    }

    @Test
    @DisplayName("Rejected refresh clears the stored credential")
    void testRejectedRefresh() {
        transport.refreshResponds(401, "{\"status\":false}");

        assertThrows(AuthException.class, () -> refresher().refresh());
        assertTrue(store.get().isEmpty());
    }

    @Test
    @DisplayName("Unusable refresh response clears the stored credential")
    void testUnusableRefreshResponse() {
        transport.refreshResponds(200, "{\"payload\":{}}");

        assertThrows(AuthException.class, () -> refresher().refresh());
        assertTrue(store.get().isEmpty());
    }

    @Test
    @DisplayName("Transport failure during refresh clears the stored credential")
    void testTransportFailure() {
        transport.refreshWith(request -> CompletableFuture.failedFuture(new IOException("Connection refused")));

        AuthException ex = assertThrows(AuthException.class, () -> refresher().refresh());
        assertInstanceOf(IOException.class, ex.getCause());
        assertTrue(store.get().isEmpty());
    }

    @Test
    @DisplayName("Without any refresh token no request is sent")
    void testNoRefreshToken() {
        store.set(new Credential("access-old", null));

        assertThrows(AuthException.class, () -> refresher().refresh());
        assertTrue(transport.refreshRequests().isEmpty());
        assertTrue(store.get().isEmpty());
    }

    @Test
    @DisplayName("The configured fallback refresh token is used when the store is empty")
    void testFallbackRefreshToken() {
        store.clear();
        settings = settings.toBuilder().fallbackCredential(new Credential("access-env", "refresh-env")).build();
        transport.refreshSucceeds("access-new", "refresh-new");

        refresher().refresh();

        assertEquals("refresh-env", new JSONObject(transport.refreshRequests().get(0).body()).getString("refresh_token"));
        assertEquals("access-new", store.get().orElseThrow().accessToken());
    }

    @Test
    @DisplayName("No refresh when another caller already replaced the rejected token")
    void testRefreshAfterRejectionSkipsStaleToken() {
        store.set(new Credential("access-new", "refresh-new"));
        TokenRefresher refresher = refresher();

        Credential credential = refresher.refreshAfterRejection("access-old");

        assertEquals("access-new", credential.accessToken());
        assertEquals(0, refresher.getRefreshCount());
        assertTrue(transport.refreshRequests().isEmpty());
    }

    @Test
    @DisplayName("Rejection of the current token refreshes")
    void testRefreshAfterRejectionOfCurrentToken() {
        transport.refreshSucceeds("access-new", "refresh-new");
        TokenRefresher refresher = refresher();

        Credential credential = refresher.refreshAfterRejection("access-old");

        assertEquals("access-new", credential.accessToken());
        assertEquals(1, refresher.getRefreshCount());
    }

    @Test
    @Timeout(10)
    @DisplayName("Concurrent callers share one refresh request")
    void testSingleFlight() throws Exception {
        CompletableFuture<TransportResponse<String>> pending = new CompletableFuture<>();
        transport.refreshWith(request -> pending);
        TokenRefresher refresher = refresher();
        ExecutorService pool = Executors.newFixedThreadPool(5);

        try {
            List<Future<Credential>> results = new ArrayList<>();
            results.add(pool.submit(() -> refresher.refresh()));
            while (transport.refreshRequests().isEmpty()) {
                Thread.sleep(5);
            }
            for (int i = 0; i < 4; i++) {
                results.add(pool.submit(() -> refresher.refresh()));
            }
            Thread.sleep(100);

            pending.complete(new TransportResponse<>(200, Map.of(),
                    "{\"payload\":{\"access_token\":\"access-new\",\"refresh_token\":\"refresh-new\"}}"));

            for (Future<Credential> result : results) {
                assertEquals("access-new", result.get(5, TimeUnit.SECONDS).accessToken());
            }
            assertEquals(1, refresher.getRefreshCount());
            assertEquals(1, transport.refreshRequests().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @Timeout(10)
    @DisplayName("A refresh without answer fails after the request timeout and clears the store")
    void testRefreshTimeout() {
        settings = settings.toBuilder().requestTimeout(Duration.ofMillis(200)).build();
        transport.refreshWith(request -> new CompletableFuture<>());

        AuthException ex = assertThrows(AuthException.class, () -> refresher().refresh());

        assertInstanceOf(TimeoutException.class, ex.getCause());
        assertTrue(store.get().isEmpty());
    }

    @Test
    @Timeout(10)
    @DisplayName("A cancelled caller stops waiting while the shared refresh continues")
    void testCancelledWaitLeavesSharedRefresh() throws Exception {
        CompletableFuture<TransportResponse<String>> pending = new CompletableFuture<>();
        transport.refreshWith(request -> pending);
        TokenRefresher refresher = refresher();
        CancellationToken token = new CancellationToken();
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            Future<Credential> leader = pool.submit(() -> refresher.refresh());
            while (transport.refreshRequests().isEmpty()) {
                Thread.sleep(5);
            }
            Future<Credential> cancelled = pool.submit(() -> refresher.refresh(token));
            Thread.sleep(50);
            token.cancel();

            ExecutionException ex = assertThrows(ExecutionException.class, () -> cancelled.get(5, TimeUnit.SECONDS));
            assertInstanceOf(CancellationException.class, ex.getCause());
            assertFalse(leader.isDone());

            pending.complete(new TransportResponse<>(200, Map.of(),
                    "{\"payload\":{\"access_token\":\"access-new\",\"refresh_token\":\"refresh-new\"}}"));

            assertEquals("access-new", leader.get(5, TimeUnit.SECONDS).accessToken());
            assertEquals(1, transport.refreshRequests().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("An already cancelled token sends no refresh")
    void testRefreshWithCancelledToken() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(CancellationException.class, () -> refresher().refresh(token));
        assertTrue(transport.refreshRequests().isEmpty());
        assertTrue(store.get().isPresent());
    }

    @Test
    @DisplayName("A refresh after a finished one sends a new request")
    void testSequentialRefreshes() {
        transport.refreshSucceeds("access-1", "refresh-1").refreshSucceeds("access-2", "refresh-2");
        TokenRefresher refresher = refresher();

        assertEquals("access-1", refresher.refresh().accessToken());
        assertEquals("access-2", refresher.refresh().accessToken());
        assertEquals(2, refresher.getRefreshCount());
        assertEquals("refresh-1", new JSONObject(transport.refreshRequests().get(1).body()).getString("refresh_token"));
    }
}
