package io.agentbus.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("agentbus-test-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertEquals("agentbus-test-1", thread.getName());
    }

    @Test
    void sequentialNaming() {
        DaemonThreadFactory factory = new DaemonThreadFactory("w-");

        assertEquals("w-1", factory.newThread(() -> { }).getName());
        assertEquals("w-2", factory.newThread(() -> { }).getName());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
