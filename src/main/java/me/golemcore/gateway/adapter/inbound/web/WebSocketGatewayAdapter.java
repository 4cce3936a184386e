package me.golemcore.gateway.adapter.inbound.web;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.DeliveryOptions;
import me.golemcore.gateway.domain.service.StringValueSupport;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.GatewayBroadcastPort;
import me.golemcore.gateway.port.outbound.SessionDeliveryPort;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket transport for gateway events. Keeps the registry of live
 * connections and their session bindings, and implements both outbound
 * delivery ports on top of it.
 *
 * <p>
 * Every connection owns a bounded outbound buffer. When it is full the
 * connection is a slow consumer: {@code dropIfSlow} deliveries skip it, any
 * other delivery closes it with status 1008.
 */
@Component
@Slf4j
public class WebSocketGatewayAdapter implements GatewayBroadcastPort, SessionDeliveryPort {

    static final CloseStatus SLOW_CONSUMER = new CloseStatus(1008, "slow consumer");

    private static final String KEY_TYPE = "type";
    private static final String KEY_EVENT = "event";
    private static final String KEY_PAYLOAD = "payload";
    private static final String VALUE_EVENT = "event";

    private final ObjectMapper objectMapper;
    private final int maxBufferedFrames;

    private final Map<String, GatewayConnection> connections = new ConcurrentHashMap<>();
    /** Maps sessionKey -> connectionIds subscribed to that session node. */
    private final Map<String, Set<String>> sessionSubscribers = new ConcurrentHashMap<>();

    public WebSocketGatewayAdapter(ObjectMapper objectMapper, GatewayProperties properties) {
        this.objectMapper = objectMapper;
        this.maxBufferedFrames = Math.max(1, properties.getWebsocket().getMaxBufferedFrames());
    }

    /**
     * Registers a connection and returns the stream of frames to write to it.
     * The stream completes when the connection is deregistered.
     */
    public Flux<String> registerConnection(String connectionId, WebSocketSession session) {
        GatewayConnection connection = new GatewayConnection(connectionId, session,
                Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(maxBufferedFrames).get()));
        GatewayConnection previous = connections.put(connectionId, connection);
        if (previous != null) {
            previous.complete();
        }
        return connection.sink.asFlux();
    }

    public void deregisterConnection(String connectionId) {
        if (connectionId == null) {
            return;
        }
        GatewayConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return;
        }
        for (String sessionKey : connection.sessionKeys) {
            unbind(sessionKey, connectionId);
        }
        connection.complete();
    }

    public void subscribeSession(String connectionId, String sessionKey) {
        if (StringValueSupport.isBlank(connectionId) || StringValueSupport.isBlank(sessionKey)) {
            return;
        }
        GatewayConnection connection = connections.get(connectionId);
        if (connection == null) {
            return;
        }
        connection.sessionKeys.add(sessionKey);
        sessionSubscribers.computeIfAbsent(sessionKey, key -> ConcurrentHashMap.newKeySet()).add(connectionId);
    }

    public void unsubscribeSession(String connectionId, String sessionKey) {
        if (StringValueSupport.isBlank(connectionId) || StringValueSupport.isBlank(sessionKey)) {
            return;
        }
        GatewayConnection connection = connections.get(connectionId);
        if (connection != null) {
            connection.sessionKeys.remove(sessionKey);
        }
        unbind(sessionKey, connectionId);
    }

    public Set<String> sessionSubscribers(String sessionKey) {
        Set<String> subscribers = sessionKey != null ? sessionSubscribers.get(sessionKey) : null;
        return subscribers != null ? Set.copyOf(subscribers) : Set.of();
    }

    public int connectionCount() {
        return connections.size();
    }

    @Override
    public void broadcast(String event, Object payload, DeliveryOptions options) {
        if (connections.isEmpty()) {
            return;
        }
        String frame = toFrame(event, payload);
        if (frame == null) {
            return;
        }
        for (GatewayConnection connection : List.copyOf(connections.values())) {
            deliver(connection, frame, event, options);
        }
    }

    @Override
    public void broadcastToConnections(String event, Object payload, Set<String> connectionIds,
            DeliveryOptions options) {
        if (connectionIds == null || connectionIds.isEmpty()) {
            return;
        }
        deliverTo(connectionIds, event, payload, options);
    }

    @Override
    public void sendToSession(String sessionKey, String event, Object payload) {
        if (StringValueSupport.isBlank(sessionKey)) {
            return;
        }
        Set<String> subscribers = sessionSubscribers.get(sessionKey);
        if (subscribers == null || subscribers.isEmpty()) {
            log.trace("[GatewayWS] No subscribers for session: {}", sessionKey);
            return;
        }
        deliverTo(List.copyOf(subscribers), event, payload, DeliveryOptions.DEFAULT);
    }

    private void deliverTo(Collection<String> connectionIds, String event, Object payload,
            DeliveryOptions options) {
        String frame = null;
        for (String connectionId : connectionIds) {
            GatewayConnection connection = connections.get(connectionId);
            if (connection == null) {
                continue;
            }
            if (frame == null) {
                frame = toFrame(event, payload);
                if (frame == null) {
                    return;
                }
            }
            deliver(connection, frame, event, options);
        }
    }

    private void deliver(GatewayConnection connection, String frame, String event, DeliveryOptions options) {
        Sinks.EmitResult result = connection.emit(frame);
        if (result.isSuccess()) {
            return;
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            if (options != null && options.dropIfSlow()) {
                log.debug("[GatewayWS] Dropped {} for slow connection {}", event, connection.id);
                return;
            }
            closeSlowConsumer(connection);
            return;
        }
        log.debug("[GatewayWS] Connection {} no longer accepts frames ({}), deregistering",
                connection.id, result);
        deregisterConnection(connection.id);
    }

    private void closeSlowConsumer(GatewayConnection connection) {
        log.warn("[GatewayWS] Closing slow consumer: connectionId={}", connection.id);
        deregisterConnection(connection.id);
        if (connection.session == null) {
            return;
        }
        connection.session.close(SLOW_CONSUMER).subscribe(
                unused -> {
                },
                error -> log.debug("[GatewayWS] Failed to close {}: {}", connection.id, error.getMessage()));
    }

    private String toFrame(String event, Object payload) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put(KEY_TYPE, VALUE_EVENT);
        envelope.put(KEY_EVENT, event);
        envelope.put(KEY_PAYLOAD, payload);
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.warn("[GatewayWS] Failed to serialize {} event: {}", event, e.getMessage());
            return null;
        }
    }

    private void unbind(String sessionKey, String connectionId) {
        sessionSubscribers.computeIfPresent(sessionKey, (key, subscribers) -> {
            subscribers.remove(connectionId);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    private static final class GatewayConnection {
        private final String id;
        private final WebSocketSession session;
        private final Sinks.Many<String> sink;
        private final Set<String> sessionKeys = ConcurrentHashMap.newKeySet();

        private GatewayConnection(String id, WebSocketSession session, Sinks.Many<String> sink) {
            this.id = id;
            this.session = session;
            this.sink = sink;
        }

        // Sinks reject concurrent emitters; deliveries arrive from any producer thread.
        private synchronized Sinks.EmitResult emit(String frame) {
            return sink.tryEmitNext(frame);
        }

        private synchronized void complete() {
            sink.tryEmitComplete();
        }
    }
}
