package de.entwicklertraining.taskstream;

import de.entwicklertraining.taskstream.TaskStreamClient.ApiStatusException;
import de.entwicklertraining.taskstream.TaskStreamClient.ApiTimeoutException;
import de.entwicklertraining.taskstream.TaskStreamClient.TransientTransportException;
import de.entwicklertraining.taskstream.cancellation.CancellationException;
import de.entwicklertraining.taskstream.cancellation.CancellationToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RetryPolicyTest {

    @Test
    @DisplayName("Work that keeps timing out is attempted exactly maxAttempts times")
    void testAttemptCap() {
        RetryPolicy policy = RetryPolicy.of(3, Duration.ZERO);
        AtomicInteger attempts = new AtomicInteger();

        ApiTimeoutException ex = assertThrows(ApiTimeoutException.class, () -> policy.execute(n -> {
            attempts.incrementAndGet();
            throw new ApiTimeoutException("timeout " + n);
        }, CancellationToken.none()));

        assertEquals(3, attempts.get());
        assertEquals("timeout 3", ex.getMessage());
        assertEquals(2, ex.getSuppressed().length);
        assertEquals("timeout 1", ex.getSuppressed()[0].getMessage());
    }

    @Test
    @DisplayName("Single-attempt policy never retries")
    void testSingleAttempt() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(TransientTransportException.class, () -> RetryPolicy.once().execute(n -> {
            attempts.incrementAndGet();
            throw new TransientTransportException("reset");
        }, CancellationToken.none()));

        assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("Success after transient failures returns the result")
    void testEventualSuccess() {
        RetryPolicy policy = RetryPolicy.of(3, Duration.ofMillis(1));
        String result = policy.execute(n -> {
            if (n < 3) {
                throw new ApiTimeoutException("timeout");
            }
            return "ok-" + n;
        }, CancellationToken.none());

        assertEquals("ok-3", result);
    }

    @Test
    @DisplayName("Non-transient failures are not retried")
    void testNonTransientFailure() {
        RetryPolicy policy = RetryPolicy.of(5, Duration.ZERO);
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(ApiStatusException.class, () -> policy.execute(n -> {
            attempts.incrementAndGet();
            throw new ApiStatusException(500, "oops", "HTTP 500");
        }, CancellationToken.none()));

        assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("Cancelled token prevents the first attempt")
    void testCancelledBeforeStart() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(CancellationException.class,
                () -> RetryPolicy.of(3, Duration.ZERO).execute(n -> attempts.incrementAndGet(), token));
        assertEquals(0, attempts.get());
    }

    @Test
    @Timeout(5)
    @DisplayName("Cancellation wins over a pending retry delay")
    void testCancellationDuringDelay() throws Exception {
        RetryPolicy policy = RetryPolicy.of(3, Duration.ofSeconds(30));
        CancellationToken token = new CancellationToken();
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<Object> run = CompletableFuture.supplyAsync(() -> policy.execute(n -> {
            attempts.incrementAndGet();
            throw new ApiTimeoutException("timeout");
        }, token));

        Thread.sleep(100);
        token.cancel();

        Exception ex = assertThrows(Exception.class, () -> run.get(2, TimeUnit.SECONDS));
        assertInstanceOf(CancellationException.class, ex.getCause());
        assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("Backoff multiplier grows the delay per failed attempt")
    void testBackoff() {
        RetryPolicy fixed = RetryPolicy.of(4, Duration.ofMillis(100));
        assertEquals(100, fixed.delayAfter(1).toMillis());
        assertEquals(100, fixed.delayAfter(3).toMillis());

        RetryPolicy exponential = fixed.withBackoffMultiplier(2.0);
        assertEquals(100, exponential.delayAfter(1).toMillis());
        assertEquals(200, exponential.delayAfter(2).toMillis());
        assertEquals(400, exponential.delayAfter(3).toMillis());
    }

    @Test
    @DisplayName("Invalid policies are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(1, Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.once().withBackoffMultiplier(0.5));
    }
}
