package com.ivamare.rollout.connector;

import com.ivamare.rollout.exception.ConnectorCallException;
import com.ivamare.rollout.model.ErrorClassification;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConnectorRateLimiterTest {

    @Test
    void shouldBoundConcurrentCalls() throws Exception {
        ConnectorRateLimiter limiter = new ConnectorRateLimiter(
            name -> new ConnectorRateLimiter.Limits(1, 100), Duration.ofMillis(50));

        try (ConnectorRateLimiter.Permit permit = limiter.acquire("intune")) {
            ConnectorCallException ex = assertThrows(ConnectorCallException.class, () -> limiter.acquire("intune"));
            assertEquals(ErrorClassification.TRANSIENT, ex.getClassification());
            assertTrue(ex.getMessage().contains("concurrency limit"));
        }

        limiter.acquire("intune").close();
    }

    @Test
    void shouldBoundRequestRate() throws Exception {
        ConnectorRateLimiter limiter = new ConnectorRateLimiter(
            name -> new ConnectorRateLimiter.Limits(4, 1), Duration.ofMillis(50));

        limiter.acquire("jamf").close();

        ConnectorCallException ex = assertThrows(ConnectorCallException.class, () -> limiter.acquire("jamf"));
        assertTrue(ex.getMessage().contains("rate limit"));
        assertEquals(0, limiter.getAvailableTokens("jamf"));
    }

    @Test
    void shouldKeepLimitsPerConnector() throws Exception {
        ConnectorRateLimiter limiter = new ConnectorRateLimiter(
            name -> new ConnectorRateLimiter.Limits(1, 1), Duration.ofMillis(50));

        try (ConnectorRateLimiter.Permit intune = limiter.acquire("intune");
             ConnectorRateLimiter.Permit jamf = limiter.acquire("jamf")) {
            assertNotNull(intune);
            assertNotNull(jamf);
        }
    }

    @Test
    void shouldRejectNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new ConnectorRateLimiter.Limits(0, 1));
    }
}
