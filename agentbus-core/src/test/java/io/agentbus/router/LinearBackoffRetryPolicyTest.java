package io.agentbus.router;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinearBackoffRetryPolicyTest {

    @Test
    void delayGrowsLinearly() {
        var policy = new LinearBackoffRetryPolicy(1000);

        assertEquals(1000, policy.computeDelayMs(1));
        assertEquals(2000, policy.computeDelayMs(2));
        assertEquals(3000, policy.computeDelayMs(3));
    }

    @Test
    void delaysStrictlyIncreaseBelowCap() {
        var policy = new LinearBackoffRetryPolicy(50, 10_000);

        long previous = 0;
        for (int attempt = 1; attempt <= 10; attempt++) {
            long delay = policy.computeDelayMs(attempt);
            assertTrue(delay > previous, "attempt " + attempt);
            previous = delay;
        }
    }

    @Test
    void delayIsCapped() {
        var policy = new LinearBackoffRetryPolicy(1000, 2500);

        assertEquals(2000, policy.computeDelayMs(2));
        assertEquals(2500, policy.computeDelayMs(3));
        assertEquals(2500, policy.computeDelayMs(Integer.MAX_VALUE));
    }

    @Test
    void nonPositiveAttemptHasNoDelay() {
        var policy = new LinearBackoffRetryPolicy(1000);

        assertEquals(0, policy.computeDelayMs(0));
        assertEquals(0, policy.computeDelayMs(-1));
    }

    @Test
    void invalidArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LinearBackoffRetryPolicy(-1));
        assertThrows(IllegalArgumentException.class, () -> new LinearBackoffRetryPolicy(100, 50));
    }
}
