package me.golemcore.gateway.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Test
    void shouldSerializeInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2026-03-01T12:00:00Z")));

        assertEquals("{\"at\":\"2026-03-01T12:00:00Z\"}", json);
    }

    @Test
    void shouldIgnoreUnknownProperties() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        Probe probe = mapper.readValue("{\"name\":\"x\",\"extra\":1}", Probe.class);

        assertEquals("x", probe.name());
    }

    @Test
    void shouldProvideSystemClock() {
        assertNotNull(AutoConfiguration.clock());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldLogStartupWithoutBuildInfo() {
        ObjectProvider<BuildProperties> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(null);
        AutoConfiguration configuration = new AutoConfiguration(new GatewayProperties(), provider);

        assertDoesNotThrow(configuration::init);
    }

    record Probe(String name) {
    }
}
