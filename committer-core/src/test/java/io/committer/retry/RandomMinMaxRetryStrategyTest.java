package io.committer.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RandomMinMaxRetryStrategyTest {

    @Test
    void delaysStayWithinBounds() {
        RandomMinMaxRetryStrategy strategy = new RandomMinMaxRetryStrategy(Duration.ofSeconds(1), Duration.ofSeconds(16));
        for (int attempts = 1; attempts <= 1_000; attempts++) {
            long delay = strategy.computeDelayMs(attempts);
            assertTrue(delay >= 1_000 && delay <= 16_000, "delay out of range: " + delay);
        }
    }

    @Test
    void equalBoundsGiveFixedDelay() {
        RandomMinMaxRetryStrategy strategy = new RandomMinMaxRetryStrategy(250, 250);
        assertEquals(250, strategy.computeDelayMs(1));
        assertEquals(250, strategy.computeDelayMs(99));
    }

    @Test
    void noDelayBeforeFirstFailure() {
        assertEquals(0, new RandomMinMaxRetryStrategy(100, 200).computeDelayMs(0));
    }

    @Test
    void neverExhausted() {
        RandomMinMaxRetryStrategy strategy = new RandomMinMaxRetryStrategy(1, 2);
        assertFalse(strategy.isExhausted(1));
        assertFalse(strategy.isExhausted(Integer.MAX_VALUE));
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new RandomMinMaxRetryStrategy(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> new RandomMinMaxRetryStrategy(10, 5));
        assertThrows(IllegalArgumentException.class, () -> new RandomMinMaxRetryStrategy(0, Long.MAX_VALUE));
        assertThrows(NullPointerException.class, () -> new RandomMinMaxRetryStrategy(null, Duration.ZERO));
    }
}
