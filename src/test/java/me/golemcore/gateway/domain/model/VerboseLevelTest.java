package me.golemcore.gateway.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class VerboseLevelTest {

    @ParameterizedTest
    @CsvSource({
            "off, OFF",
            "FALSE, OFF",
            "no, OFF",
            "0, OFF",
            "on, PARTIAL",
            "partial, PARTIAL",
            " true , PARTIAL",
            "yes, PARTIAL",
            "1, PARTIAL",
            "full, FULL",
            "All, FULL"
    })
    void shouldNormalizeKnownAliases(String raw, VerboseLevel expected) {
        assertEquals(expected, VerboseLevel.normalize(raw));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "  ", "loud", "2" })
    void shouldReturnNullForUnknownOrBlankInput(String raw) {
        assertNull(VerboseLevel.normalize(raw));
    }

    @Test
    void shouldExposeLowercaseWireValue() {
        assertEquals("partial", VerboseLevel.PARTIAL.wireValue());
    }
}
