package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.ChatLinkState;
import me.golemcore.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatRunStateTest {

    private MutableClock clock;
    private ChatRunState state;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        state = new ChatRunState(clock);
    }

    @Test
    void shouldReplaceBufferWithLatestText() {
        state.bufferText("client-1", "Hel");
        state.bufferText("client-1", "Hello");
        state.recordDeltaSent("client-1", 1000L);

        assertEquals("Hello", state.bufferedText("client-1"));
        assertEquals(1000L, state.lastDeltaSentAt("client-1"));
        assertEquals(0L, state.lastDeltaSentAt("client-2"));
    }

    @Test
    void shouldDrainBufferAndThrottleTimestamp() {
        state.bufferText("client-1", "Hello");
        state.recordDeltaSent("client-1", 1000L);

        assertEquals("Hello", state.drainBuffer("client-1"));
        assertFalse(state.hasBufferedState("client-1"));
        assertNull(state.drainBuffer("client-1"));
    }

    @Test
    void shouldTrackAbortMarkers() {
        state.markAborted("run-1");
        state.markAborted(" ");

        assertTrue(state.isAborted("run-1"));
        assertFalse(state.isAborted(null));

        state.clearAborted("run-1");
        assertFalse(state.isAborted("run-1"));
    }

    @Test
    void shouldEvictOnlyStaleAbortMarkers() {
        state.markAborted("run-old");
        clock.advance(Duration.ofMinutes(61));
        state.markAborted("run-new");

        int evicted = state.evictAbortMarkersBefore(clock.instant().minus(Duration.ofMinutes(60)));

        assertEquals(1, evicted);
        assertFalse(state.isAborted("run-old"));
        assertTrue(state.isAborted("run-new"));
    }

    @Test
    void shouldMoveLinkThroughStreamingToFinalized() {
        state.openLink("client-1");
        assertEquals(ChatLinkState.PENDING, state.linkState("client-1"));

        state.transition("client-1", ChatLinkState.STREAMING);
        assertEquals(ChatLinkState.STREAMING, state.linkState("client-1"));

        state.transition("client-1", ChatLinkState.FINALIZED);
        assertEquals(ChatLinkState.FINALIZED, state.linkState("client-1"));
    }

    @Test
    void shouldNotMoveTerminalLink() {
        state.openLink("client-1");
        state.transition("client-1", ChatLinkState.ABORTED);

        state.transition("client-1", ChatLinkState.STREAMING);
        state.transition("client-1", ChatLinkState.FINALIZED);

        assertEquals(ChatLinkState.ABORTED, state.linkState("client-1"));
    }

    @Test
    void shouldNotMoveLinkBackToPending() {
        state.openLink("client-1");
        state.transition("client-1", ChatLinkState.STREAMING);

        state.transition("client-1", ChatLinkState.PENDING);

        assertEquals(ChatLinkState.STREAMING, state.linkState("client-1"));
    }

    @Test
    void shouldEvictOnlyTerminalLinksPastCutoff() {
        state.openLink("client-done");
        state.transition("client-done", ChatLinkState.FINALIZED);
        state.openLink("client-live");
        state.transition("client-live", ChatLinkState.STREAMING);
        clock.advance(Duration.ofMinutes(11));

        int evicted = state.evictTerminalLinksBefore(clock.instant().minus(Duration.ofMinutes(10)));

        assertEquals(1, evicted);
        assertNull(state.linkState("client-done"));
        assertEquals(ChatLinkState.STREAMING, state.linkState("client-live"));
    }

    @Test
    void shouldClearEverything() {
        state.bufferText("client-1", "Hi");
        state.markAborted("run-1");
        state.openLink("client-1");

        state.clear();

        assertNull(state.bufferedText("client-1"));
        assertFalse(state.isAborted("run-1"));
        assertNull(state.linkState("client-1"));
    }
}
