package de.entwicklertraining.taskstream;

import de.entwicklertraining.taskstream.TaskStreamClient.ApiTimeoutException;
import de.entwicklertraining.taskstream.auth.Credential;
import de.entwicklertraining.taskstream.auth.InMemoryCredentialStore;
import de.entwicklertraining.taskstream.cancellation.CancellationToken;
import de.entwicklertraining.taskstream.streaming.StreamIds;
import de.entwicklertraining.taskstream.streaming.StreamResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the client against a real HTTP server.
 */
public class TaskStreamClientIntegrationTest {

    private MockWebServer server;
    private InMemoryCredentialStore store;
    private TaskStreamClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        store = new InMemoryCredentialStore(new Credential("access-old", "refresh-old"));
        client = newClient(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        server.shutdown();
    }

    private TaskStreamClient newClient(Duration requestTimeout) {
        ClientSettings settings = ClientSettings.builder()
                .baseUrl(server.url("/").toString())
                .retryDelay(Duration.ofMillis(10))
                .requestTimeout(requestTimeout)
                .build();
        return TaskStreamClient.builder()
                .settings(settings)
                .credentialStore(store)
                .build();
    }

    private RecordedRequest take() throws InterruptedException {
        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request, "expected a request");
        return request;
    }

    @Test
    @DisplayName("401 is answered by refreshing and replaying with the new token")
    void testRefreshAndReplay() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(401));
        server.enqueue(new MockResponse().setBody(
                "{\"status\":true,\"payload\":{\"access_token\":\"access-new\",\"refresh_token\":\"refresh-new\"}}"));
        server.enqueue(new MockResponse().setBody("{\"status\":true,\"payload\":{\"task_id\":\"t1\"}}"));

        ApiResponse response = client.get("/api/v1/tasks/t1");

        assertEquals("t1", response.getPayloadObject().getString("task_id"));
        RecordedRequest first = take();
        RecordedRequest refresh = take();
        RecordedRequest replay = take();
        assertEquals("Bearer access-old", first.getHeader("Authorization"));
        assertEquals("/api/v1/refresh-token", refresh.getPath());
        assertEquals("refresh-old", new JSONObject(refresh.getBody().readUtf8()).getString("refresh_token"));
        assertEquals("Bearer access-new", replay.getHeader("Authorization"));
    }

    @Test
    @Timeout(15)
    @DisplayName("Stream split into tiny chunks is decoded completely")
    void testChunkedStream() throws Exception {
        String body = ""
                + "data: {\"conversation_id\":\"c1\",\"content\":\"Grüße \"}\n"
                + ": ping\n"
                + "data: {\"task_id\":\"t1\",\"content\":\"aus Köln 👋\"}\n"
                + "data: [DONE]\n";
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setChunkedBody(body, 3)
                .throttleBody(7, 5, TimeUnit.MILLISECONDS));
        RecordingListener listener = new RecordingListener();

        StreamResult result = client.stream("/api/v1/chat", new JSONObject().put("query", "hallo"), listener,
                CancellationToken.none());

        assertTrue(result.isSuccess());
        assertEquals(List.of("Grüße ", "aus Köln 👋"), listener.contents());
        assertEquals(List.of(new StreamIds("c1", "t1", "")), listener.completions());

        RecordedRequest request = take();
        assertEquals("POST", request.getMethod());
        assertEquals("text/event-stream", request.getHeader("Accept"));
        assertEquals("Bearer access-old", request.getHeader("Authorization"));
    }

    @Test
    @Timeout(15)
    @DisplayName("Stream reconnect after 401 carries the refreshed token")
    void testStreamReconnectAfterUnauthorized() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(401));
        server.enqueue(new MockResponse().setBody(
                "{\"payload\":{\"access_token\":\"access-new\",\"refresh_token\":\"refresh-new\"}}"));
        server.enqueue(new MockResponse().setBody("data: {\"content\":\"ok\"}\ndata: [DONE]\n"));
        RecordingListener listener = new RecordingListener();

        StreamResult result = client.stream(RequestDescriptor.get("/api/v1/tasks/t1/stream"), listener);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getRefreshes());
        take();
        take();
        assertEquals("Bearer access-new", take().getHeader("Authorization"));
    }

    @Test
    @Timeout(20)
    @DisplayName("A stream server that never answers times out after every attempt")
    void testStreamTimeout() {
        client.close();
        client = newClient(Duration.ofMillis(300));
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        RecordingListener listener = new RecordingListener();

        StreamResult result = client.stream(RequestDescriptor.get("/api/v1/tasks/t1/stream"), listener);

        assertFalse(result.isSuccess());
        assertEquals(3, result.getConnectionAttempts());
        assertEquals(1, listener.errors().size());
        assertInstanceOf(ApiTimeoutException.class, listener.errors().get(0));
    }

    @Test
    @Timeout(15)
    @DisplayName("Cancelling a running stream ends it silently")
    void testCancelRunningStream() throws Exception {
        String first = "data: {\"content\":\"one\"}\n";
        server.enqueue(new MockResponse()
                .setBody(first + "data: {\"content\":\"two\"}\n".repeat(5) + "data: [DONE]\n")
                .throttleBody(first.length(), 1, TimeUnit.SECONDS));
        RecordingListener listener = new RecordingListener();

        CompletableFuture<StreamResult> result = client.streamAsync(
                RequestDescriptor.post("/api/v1/chat", new JSONObject()), listener);
        assertTrue(listener.awaitFirstMessage(5));
        result.cancel(true);

        Thread.sleep(1500);
        assertEquals(List.of("one"), listener.contents());
        assertEquals(0, listener.terminalCallbacks());
    }
}
