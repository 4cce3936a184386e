package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.RunContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunContextRegistryTest {

    private final RunContextRegistry registry = new RunContextRegistry();

    @Test
    void shouldKeepFirstSessionKeyOnRepeatedRegistration() {
        registry.register("run-1", RunContext.builder().sessionKey("main").build());
        registry.register("run-1", RunContext.builder().sessionKey("other").verboseLevel("full").build());

        RunContext context = registry.get("run-1");
        assertEquals("main", context.sessionKey());
        assertEquals("full", context.verboseLevel());
    }

    @Test
    void shouldFillSessionKeyRegisteredLater() {
        registry.register("run-1", RunContext.builder().heartbeat(true).build());
        registry.register("run-1", RunContext.builder().sessionKey("main").build());

        assertEquals("main", registry.getSessionKey("run-1"));
        assertTrue(registry.get("run-1").isHeartbeat());
    }

    @Test
    void shouldIgnoreBlankRunIdAndNullContext() {
        registry.register(" ", RunContext.builder().sessionKey("main").build());
        registry.register("run-1", null);

        assertEquals(0, registry.size());
        assertNull(registry.get(null));
        assertNull(registry.getSessionKey("run-1"));
    }

    @Test
    void shouldClearContext() {
        registry.register("run-1", RunContext.builder().sessionKey("main").build());

        registry.clear("run-1");
        registry.clear("run-1");

        assertNull(registry.get("run-1"));
        assertEquals(0, registry.size());
    }
}
