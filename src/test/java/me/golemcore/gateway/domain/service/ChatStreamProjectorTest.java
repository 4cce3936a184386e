package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.ChatEvent;
import me.golemcore.gateway.domain.model.ChatEventState;
import me.golemcore.gateway.domain.model.ChatLinkState;
import me.golemcore.gateway.domain.model.DeliveryOptions;
import me.golemcore.gateway.domain.model.GatewayEvents;
import me.golemcore.gateway.domain.model.RunContext;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.GatewayBroadcastPort;
import me.golemcore.gateway.port.outbound.SessionDeliveryPort;
import me.golemcore.gateway.testsupport.MutableClock;
import me.golemcore.gateway.testsupport.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ChatStreamProjectorTest {

    private static final String RUN_ID = "run-1";
    private static final String CLIENT_RUN_ID = "client-1";
    private static final String SESSION_KEY = "main";

    private MutableClock clock;
    private RunContextRegistry runContextRegistry;
    private ChatRunState chatRunState;
    private GatewayProperties properties;
    private RecordingTransport transport;
    private ChatStreamProjector projector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        runContextRegistry = new RunContextRegistry();
        chatRunState = new ChatRunState(clock);
        properties = new GatewayProperties();
        transport = new RecordingTransport();
        projector = newProjector(transport, transport);
    }

    @Test
    void shouldThrottleDeltasButBufferLatestText() {
        assertTrue(projector.projectDelta(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 1, "Hel"));
        clock.advanceMillis(50);
        assertFalse(projector.projectDelta(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 2, "Hello"));
        clock.advanceMillis(100);
        assertTrue(projector.projectDelta(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 3, "Hello world"));

        List<ChatEvent> deltas = transport.broadcastPayloads(GatewayEvents.CHAT, ChatEvent.class);
        assertEquals(2, deltas.size());
        assertEquals("Hel", deltas.get(0).message().content().get(0).text());
        assertEquals("Hello world", deltas.get(1).message().content().get(0).text());
        assertEquals(3, deltas.get(1).seq());
        assertEquals(ChatLinkState.STREAMING, chatRunState.linkState(CLIENT_RUN_ID));
        assertTrue(transport.broadcasts().stream().allMatch(d -> d.options().dropIfSlow()));
    }

    @Test
    void shouldUseClientRunIdInChatPayload() {
        projector.projectDelta(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 1, "Hi");

        ChatEvent delta = transport.sessionPayloads(SESSION_KEY, GatewayEvents.CHAT, ChatEvent.class).get(0);
        assertEquals(CLIENT_RUN_ID, delta.runId());
        assertEquals(SESSION_KEY, delta.sessionKey());
        assertEquals(ChatEventState.DELTA, delta.state());
    }

    @Test
    void shouldEmitFinalWithTrimmedBufferedText() {
        projector.projectDelta(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 1, "Hel");
        clock.advanceMillis(10);
        projector.projectDelta(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 2, "Hello  ");

        projector.projectFinal(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 3);

        List<ChatEvent> events = transport.broadcastPayloads(GatewayEvents.CHAT, ChatEvent.class);
        ChatEvent finalEvent = events.get(events.size() - 1);
        assertEquals(ChatEventState.FINAL, finalEvent.state());
        assertEquals("Hello", finalEvent.message().content().get(0).text());
        assertFalse(chatRunState.hasBufferedState(CLIENT_RUN_ID));
        assertEquals(ChatLinkState.FINALIZED, chatRunState.linkState(CLIENT_RUN_ID));
    }

    @Test
    void shouldEmitFinalWithoutMessageWhenNothingBuffered() {
        projector.projectFinal(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 1);

        ChatEvent finalEvent = transport.broadcastPayloads(GatewayEvents.CHAT, ChatEvent.class).get(0);
        assertEquals(ChatEventState.FINAL, finalEvent.state());
        assertNull(finalEvent.message());
    }

    @Test
    void shouldEmitErrorOnGlobalBroadcastEvenForHeartbeatRuns() {
        runContextRegistry.register(RUN_ID, RunContext.builder().heartbeat(true).build());
        projector.projectDelta(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 1, "partial");

        projector.projectError(SESSION_KEY, CLIENT_RUN_ID, 2, new IllegalStateException("model unavailable"));

        List<ChatEvent> broadcast = transport.broadcastPayloads(GatewayEvents.CHAT, ChatEvent.class);
        assertEquals(1, broadcast.size());
        assertEquals(ChatEventState.ERROR, broadcast.get(0).state());
        assertEquals("IllegalStateException: model unavailable", broadcast.get(0).errorMessage());
        assertEquals(DeliveryOptions.DEFAULT, transport.broadcasts().get(0).options());
        assertFalse(chatRunState.hasBufferedState(CLIENT_RUN_ID));
    }

    @Test
    void shouldKeepHeartbeatChatOffGlobalBroadcast() {
        runContextRegistry.register(RUN_ID, RunContext.builder().sessionKey(SESSION_KEY).heartbeat(true).build());

        projector.projectDelta(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 1, "HEARTBEAT_OK");
        projector.projectFinal(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 2);

        assertTrue(transport.broadcasts().isEmpty());
        assertEquals(2, transport.sessionPayloads(SESSION_KEY, GatewayEvents.CHAT, ChatEvent.class).size());
    }

    @Test
    void shouldDiscardBufferOfAbortedRun() {
        chatRunState.openLink(CLIENT_RUN_ID);
        projector.projectDelta(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 1, "Hi");
        transport.reset();

        projector.discard(CLIENT_RUN_ID);

        assertFalse(chatRunState.hasBufferedState(CLIENT_RUN_ID));
        assertEquals(ChatLinkState.ABORTED, chatRunState.linkState(CLIENT_RUN_ID));
        assertTrue(transport.broadcasts().isEmpty());
        assertTrue(transport.sessionDeliveries().isEmpty());
    }

    @Test
    void shouldStillDeliverToSessionWhenBroadcastFails() {
        GatewayBroadcastPort failingBroadcast = mock(GatewayBroadcastPort.class);
        SessionDeliveryPort sessionDelivery = mock(SessionDeliveryPort.class);
        doThrow(new IllegalStateException("socket closed"))
                .when(failingBroadcast).broadcast(anyString(), any(), any());
        ChatStreamProjector failing = newProjector(failingBroadcast, sessionDelivery);

        failing.projectFinal(RUN_ID, SESSION_KEY, CLIENT_RUN_ID, 1);

        verify(sessionDelivery).sendToSession(eq(SESSION_KEY), eq(GatewayEvents.CHAT), any(ChatEvent.class));
    }

    private ChatStreamProjector newProjector(GatewayBroadcastPort broadcastPort,
            SessionDeliveryPort sessionDeliveryPort) {
        return new ChatStreamProjector(chatRunState, broadcastPort, sessionDeliveryPort,
                new HeartbeatVisibilityPolicy(runContextRegistry, properties), properties, clock);
    }
}
