package com.flagship.event_ledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    @DisplayName("Delay doubles per attempt and stops at the cap")
    void testExponentialGrowthWithCap() {
        RetryPolicy policy = new RetryPolicy(100, 1000, 0);

        assertEquals(Duration.ofMillis(100), policy.delayFor(0));
        assertEquals(Duration.ofMillis(200), policy.delayFor(1));
        assertEquals(Duration.ofMillis(400), policy.delayFor(2));
        assertEquals(Duration.ofMillis(800), policy.delayFor(3));
        assertEquals(Duration.ofMillis(1000), policy.delayFor(4));
        assertEquals(Duration.ofMillis(1000), policy.delayFor(60));
    }

    @Test
    @DisplayName("Jitter stays within the configured band")
    void testJitterBounds() {
        RetryPolicy policy = new RetryPolicy(1000, 60_000, 0.2);

        for (int i = 0; i < 200; i++) {
            long delay = policy.delayFor(0).toMillis();
            assertTrue(delay >= 800 && delay <= 1200, "Delay out of band: " + delay);
        }
    }

    @Test
    @DisplayName("Invalid bounds are rejected")
    void testInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1000, 0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1000, 500, 0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(100, 1000, 1.5));
    }
}
