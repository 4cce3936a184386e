package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.RunContext;
import me.golemcore.gateway.domain.model.VerboseLevel;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.SessionSettingsPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolVerbosityResolverTest {

    private RunContextRegistry runContextRegistry;
    private SessionSettingsPort sessionSettingsPort;
    private GatewayProperties properties;
    private ToolVerbosityResolver resolver;

    @BeforeEach
    void setUp() {
        runContextRegistry = new RunContextRegistry();
        sessionSettingsPort = mock(SessionSettingsPort.class);
        properties = new GatewayProperties();
        resolver = new ToolVerbosityResolver(runContextRegistry, sessionSettingsPort, properties);
    }

    @Test
    void shouldPreferRunLevelOverride() {
        runContextRegistry.register("run-1", RunContext.builder().verboseLevel("full").build());
        when(sessionSettingsPort.getVerboseLevel("main")).thenReturn("off");

        assertEquals(VerboseLevel.FULL, resolver.resolve("run-1", "main"));
        verify(sessionSettingsPort, never()).getVerboseLevel("main");
    }

    @Test
    void shouldUseSessionSettingWithoutOverride() {
        when(sessionSettingsPort.getVerboseLevel("main")).thenReturn("on");

        assertEquals(VerboseLevel.PARTIAL, resolver.resolve("run-1", "main"));
    }

    @Test
    void shouldFallThroughUnknownValuesToDefault() {
        runContextRegistry.register("run-1", RunContext.builder().verboseLevel("loud").build());
        when(sessionSettingsPort.getVerboseLevel("main")).thenReturn("whatever");
        properties.getVerbose().setDefaultLevel("full");

        assertEquals(VerboseLevel.FULL, resolver.resolve("run-1", "main"));
    }

    @Test
    void shouldResolveOffWhenNothingIsConfigured() {
        properties.getVerbose().setDefaultLevel(null);

        assertEquals(VerboseLevel.OFF, resolver.resolve("run-1", "main"));
    }

    @Test
    void shouldResolveOffWithoutSessionKey() {
        properties.getVerbose().setDefaultLevel("full");

        assertEquals(VerboseLevel.OFF, resolver.resolve("run-1", null));
    }

    @Test
    void shouldResolveOffWhenSessionLookupFails() {
        properties.getVerbose().setDefaultLevel("full");
        when(sessionSettingsPort.getVerboseLevel("main")).thenThrow(new IllegalStateException("store down"));

        assertEquals(VerboseLevel.OFF, resolver.resolve("run-1", "main"));
    }
}
