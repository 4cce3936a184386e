package me.golemcore.gateway.domain.service;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorMessageSupportTest {

    @Test
    void shouldFormatThrowableWithTypeAndMessage() {
        assertEquals("IllegalStateException: model unavailable",
                ErrorMessageSupport.format(new IllegalStateException("model unavailable")));
        assertEquals("IllegalStateException", ErrorMessageSupport.format(new IllegalStateException()));
    }

    @Test
    void shouldPreferMessageEntryOfMap() {
        assertEquals("rate limited", ErrorMessageSupport.format(Map.of("message", "rate limited", "code", 429)));
        assertEquals("{code=429}", ErrorMessageSupport.format(Map.of("code", 429)));
    }

    @Test
    void shouldTrimPlainValuesAndDropBlankOnes() {
        assertEquals("boom", ErrorMessageSupport.format("  boom \n"));
        assertNull(ErrorMessageSupport.format("   "));
        assertNull(ErrorMessageSupport.format(null));
    }

    @Test
    void shouldTruncateLongMessages() {
        String formatted = ErrorMessageSupport.format("x".repeat(5000));

        assertEquals(ErrorMessageSupport.MAX_LENGTH, formatted.length());
        assertTrue(formatted.endsWith("... [truncated]"));
    }
}
