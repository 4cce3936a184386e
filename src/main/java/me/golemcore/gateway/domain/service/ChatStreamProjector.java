package me.golemcore.gateway.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ChatEvent;
import me.golemcore.gateway.domain.model.ChatEventState;
import me.golemcore.gateway.domain.model.ChatLinkState;
import me.golemcore.gateway.domain.model.ChatMessage;
import me.golemcore.gateway.domain.model.DeliveryOptions;
import me.golemcore.gateway.domain.model.GatewayEvents;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.GatewayBroadcastPort;
import me.golemcore.gateway.port.outbound.SessionDeliveryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Projects assistant text and terminal lifecycle phases into the client chat
 * protocol.
 *
 * <p>
 * Assistant events carry cumulative text, so the buffer of a client run is
 * replaced by the latest text and deltas are throttled to one per
 * {@code gateway.chat.delta-interval}. The final event carries whatever was
 * buffered last, including text of throttled deltas.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatStreamProjector {

    private final ChatRunState chatRunState;
    private final GatewayBroadcastPort broadcastPort;
    private final SessionDeliveryPort sessionDeliveryPort;
    private final HeartbeatVisibilityPolicy heartbeatVisibilityPolicy;
    private final GatewayProperties properties;
    private final Clock clock;

    /**
     * Buffers {@code text} and emits a delta unless one was sent for this client
     * run within the throttle interval.
     *
     * @return whether a delta was emitted
     */
    public boolean projectDelta(String runId, String sessionKey, String clientRunId, int seq, String text) {
        chatRunState.bufferText(clientRunId, text);
        chatRunState.transition(clientRunId, ChatLinkState.STREAMING);

        long now = clock.millis();
        long last = chatRunState.lastDeltaSentAt(clientRunId);
        if (now - last < properties.getChat().getDeltaInterval().toMillis()) {
            return false;
        }
        chatRunState.recordDeltaSent(clientRunId, now);

        ChatEvent payload = ChatEvent.builder()
                .runId(clientRunId)
                .sessionKey(sessionKey)
                .seq(seq)
                .state(ChatEventState.DELTA)
                .message(ChatMessage.assistantText(text, now))
                .build();
        if (!heartbeatVisibilityPolicy.shouldSuppressGlobalBroadcast(runId)) {
            broadcastSafely(payload, DeliveryOptions.DROP_IF_SLOW);
        }
        sendToSessionSafely(sessionKey, payload);
        return true;
    }

    /**
     * Emits the final event of a successful run and clears its buffer.
     */
    public void projectFinal(String runId, String sessionKey, String clientRunId, int seq) {
        String buffered = chatRunState.drainBuffer(clientRunId);
        String text = buffered != null ? buffered.trim() : "";
        chatRunState.transition(clientRunId, ChatLinkState.FINALIZED);

        ChatEvent payload = ChatEvent.builder()
                .runId(clientRunId)
                .sessionKey(sessionKey)
                .seq(seq)
                .state(ChatEventState.FINAL)
                .message(text.isEmpty() ? null : ChatMessage.assistantText(text, clock.millis()))
                .build();
        if (!heartbeatVisibilityPolicy.shouldSuppressGlobalBroadcast(runId)) {
            broadcastSafely(payload, DeliveryOptions.DROP_IF_SLOW);
        }
        sendToSessionSafely(sessionKey, payload);
    }

    /**
     * Emits the error event of a failed run and clears its buffer. Errors are
     * never hidden from the global broadcast.
     */
    public void projectError(String sessionKey, String clientRunId, int seq, Object error) {
        chatRunState.drainBuffer(clientRunId);
        chatRunState.transition(clientRunId, ChatLinkState.FINALIZED);

        ChatEvent payload = ChatEvent.builder()
                .runId(clientRunId)
                .sessionKey(sessionKey)
                .seq(seq)
                .state(ChatEventState.ERROR)
                .errorMessage(ErrorMessageSupport.format(error))
                .build();
        broadcastSafely(payload, DeliveryOptions.DEFAULT);
        sendToSessionSafely(sessionKey, payload);
    }

    /**
     * Drops buffered state of an aborted client run without emitting anything.
     */
    public void discard(String clientRunId) {
        chatRunState.drainBuffer(clientRunId);
        chatRunState.transition(clientRunId, ChatLinkState.ABORTED);
    }

    private void broadcastSafely(ChatEvent payload, DeliveryOptions options) {
        try {
            broadcastPort.broadcast(GatewayEvents.CHAT, payload, options);
        } catch (RuntimeException e) { // NOSONAR - delivery is best effort
            log.warn("[ChatProjector] broadcast failed: runId={}, state={}: {}",
                    payload.runId(), payload.state().wireValue(), e.getMessage());
        }
    }

    private void sendToSessionSafely(String sessionKey, ChatEvent payload) {
        try {
            sessionDeliveryPort.sendToSession(sessionKey, GatewayEvents.CHAT, payload);
        } catch (RuntimeException e) { // NOSONAR - delivery is best effort
            log.warn("[ChatProjector] session delivery failed: sessionKey={}, runId={}: {}",
                    sessionKey, payload.runId(), e.getMessage());
        }
    }
}
