package me.golemcore.gateway.adapter.inbound.web;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.VerboseLevel;
import me.golemcore.gateway.domain.service.ChatRunService;
import me.golemcore.gateway.domain.service.StringValueSupport;
import me.golemcore.gateway.port.outbound.SessionSettingsPort;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

/**
 * Reactive WebSocket handler for gateway clients. Outbound frames come from
 * the connection's buffer in {@link WebSocketGatewayAdapter}; inbound frames
 * are JSON requests {@code {"method": "...", ...}}:
 * <ul>
 * <li>{@code sessions.subscribe} / {@code sessions.unsubscribe}
 * ({@code sessionKey})</li>
 * <li>{@code sessions.patch} ({@code sessionKey}, {@code verboseLevel})</li>
 * <li>{@code tools.subscribe} ({@code runId})</li>
 * <li>{@code chat.abort} ({@code runId}, {@code clientRunId})</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GatewayWebSocketHandler implements WebSocketHandler {

    private static final TypeReference<Map<String, Object>> FRAME_TYPE = new TypeReference<>() {
    };

    private final WebSocketGatewayAdapter gatewayAdapter;
    private final ChatRunService chatRunService;
    private final SessionSettingsPort sessionSettingsPort;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = UUID.randomUUID().toString();
        Flux<WebSocketMessage> outbound = gatewayAdapter.registerConnection(connectionId, session)
                .map(session::textMessage);
        log.info("[GatewayWS] Connection established: connectionId={}", connectionId);

        Mono<Void> inbound = session.receive()
                .doOnNext(wsMessage -> handleIncoming(wsMessage, connectionId))
                .doFinally(signal -> gatewayAdapter.deregisterConnection(connectionId))
                .then();

        return session.send(outbound)
                .and(inbound)
                .doFinally(signal -> {
                    gatewayAdapter.deregisterConnection(connectionId);
                    log.info("[GatewayWS] Connection closed: connectionId={}, signal={}", connectionId, signal);
                });
    }

    private void handleIncoming(WebSocketMessage wsMessage, String connectionId) {
        try {
            Map<String, Object> json = objectMapper.readValue(wsMessage.getPayloadAsText(), FRAME_TYPE);
            String method = asString(json.get("method"));
            if (method == null) {
                log.debug("[GatewayWS] Ignoring frame without method: connectionId={}", connectionId);
                return;
            }
            switch (method) {
            case "sessions.subscribe" -> gatewayAdapter.subscribeSession(connectionId, asString(json.get("sessionKey")));
            case "sessions.unsubscribe" -> gatewayAdapter.unsubscribeSession(connectionId,
                    asString(json.get("sessionKey")));
            case "sessions.patch" -> patchSession(asString(json.get("sessionKey")),
                    asString(json.get("verboseLevel")));
            case "tools.subscribe" -> chatRunService.subscribeToolEvents(asString(json.get("runId")), connectionId);
            case "chat.abort" -> chatRunService.abortChatRun(asString(json.get("runId")),
                    asString(json.get("clientRunId")));
            default -> log.debug("[GatewayWS] Unknown method '{}' from {}", method, connectionId);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.warn("[GatewayWS] Failed to process incoming frame: {}", e.getMessage());
        }
    }

    private void patchSession(String sessionKey, String verboseLevel) {
        if (StringValueSupport.isBlank(sessionKey)) {
            log.debug("[GatewayWS] sessions.patch without sessionKey ignored");
            return;
        }
        if (!StringValueSupport.isBlank(verboseLevel) && VerboseLevel.normalize(verboseLevel) == null) {
            log.warn("[GatewayWS] Rejected verbose level '{}' for session {}", verboseLevel, sessionKey);
            return;
        }
        sessionSettingsPort.setVerboseLevel(sessionKey, verboseLevel);
    }

    private String asString(Object value) {
        if (value instanceof String stringValue) {
            return stringValue;
        }
        return null;
    }
}
