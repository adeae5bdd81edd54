package io.agentbus.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdsTest {

    @Test
    void idsAreUniqueAndSortable() {
        String first = Ids.next();
        String second = Ids.next();

        assertNotEquals(first, second);
        assertEquals(26, first.length());
        assertTrue(first.compareTo(second) < 0);
    }

    @Test
    void burstStaysUniqueAndOrdered() {
        Set<String> seen = new HashSet<>();
        String previous = "";
        for (int i = 0; i < 1_000; i++) {
            String id = Ids.next();
            assertTrue(seen.add(id), "duplicate " + id);
            assertTrue(id.compareTo(previous) > 0);
            previous = id;
        }
    }
}
