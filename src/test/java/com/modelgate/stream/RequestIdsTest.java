package com.modelgate.stream;

import org.junit.jupiter.api.Test;

import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

class RequestIdsTest {

    @Test
    void generatedIdsAreUrlSafe() {
        var seen = new HashSet<String>();
        for (int i = 0; i < 1000; i++) {
            var id = RequestIds.generate();
            assertEquals(16, id.length());
            assertTrue(id.matches("[A-Za-z0-9_-]+"), id);
            seen.add(id);
        }
        assertEquals(1000, seen.size());
    }

    @Test
    void liveIdCannotBeReused() {
        var ids = new RequestIds();
        assertEquals("req-1", ids.acquire("req-1"));
        assertThrows(IllegalArgumentException.class, () -> ids.acquire("req-1"));

        ids.release("req-1");
        assertFalse(ids.isLive("req-1"));
        assertEquals("req-1", ids.acquire("req-1"));
    }

    @Test
    void nullDrawsFreshId() {
        var ids = new RequestIds();
        var a = ids.acquire(null);
        var b = ids.acquire(null);
        assertNotEquals(a, b);
        assertEquals(2, ids.liveCount());
        assertThrows(IllegalArgumentException.class, () -> ids.acquire(" "));
    }
}
