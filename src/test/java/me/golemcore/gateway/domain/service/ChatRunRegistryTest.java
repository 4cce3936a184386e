package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.ChatRunEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatRunRegistryTest {

    private static final ChatRunEntry FIRST = new ChatRunEntry("main", "client-1");
    private static final ChatRunEntry SECOND = new ChatRunEntry("main", "client-2");
    private static final ChatRunEntry THIRD = new ChatRunEntry("side", "client-3");

    private ChatRunRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ChatRunRegistry();
    }

    @Test
    void shouldServeEntriesInArrivalOrder() {
        registry.add("run-1", FIRST);
        registry.add("run-1", SECOND);

        assertEquals(FIRST, registry.peek("run-1"));
        assertEquals(FIRST, registry.shift("run-1"));
        assertEquals(SECOND, registry.peek("run-1"));
        assertEquals(SECOND, registry.shift("run-1"));
        assertNull(registry.shift("run-1"));
    }

    @Test
    void shouldDeleteQueueWhenLastEntryShifted() {
        registry.add("run-1", FIRST);

        registry.shift("run-1");

        assertTrue(registry.isEmpty());
        assertEquals(0, registry.pendingCount("run-1"));
    }

    @Test
    void shouldRemoveEntryFromMiddleOfQueue() {
        registry.add("run-1", FIRST);
        registry.add("run-1", SECOND);
        registry.add("run-1", THIRD);

        ChatRunEntry removed = registry.remove("run-1", "client-2", "main");

        assertEquals(SECOND, removed);
        assertEquals(2, registry.pendingCount("run-1"));
        assertEquals(FIRST, registry.shift("run-1"));
        assertEquals(THIRD, registry.shift("run-1"));
    }

    @Test
    void shouldRequireMatchingSessionKeyWhenGiven() {
        registry.add("run-1", FIRST);

        assertNull(registry.remove("run-1", "client-1", "side"));
        assertEquals(FIRST, registry.remove("run-1", "client-1", null));
        assertTrue(registry.isEmpty());
    }

    @Test
    void shouldIgnoreRemovalOfUnknownEntries() {
        registry.add("run-1", FIRST);

        assertNull(registry.remove("run-2", "client-1", null));
        assertNull(registry.remove("run-1", "client-9", null));
        assertNull(registry.remove("run-1", null, null));
        assertFalse(registry.isEmpty());
    }

    @Test
    void shouldIgnoreBlankSessionIdOnAdd() {
        registry.add("", FIRST);
        registry.add("run-1", null);

        assertTrue(registry.isEmpty());
    }
}
