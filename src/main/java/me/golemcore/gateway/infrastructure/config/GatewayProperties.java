package me.golemcore.gateway.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the gateway relay, bound from
 * application.properties under the {@code gateway.*} prefix.
 *
 * <ul>
 * <li>{@link ChatProperties} - chat projection throttling and abort
 * markers</li>
 * <li>{@link ToolEventsProperties} - tool-event recipient retention</li>
 * <li>{@link VerboseProperties} - tool verbosity defaults and per-session
 * levels</li>
 * <li>{@link HeartbeatProperties} - visibility of heartbeat runs</li>
 * <li>{@link MaintenanceProperties} - periodic sweep of stale run state</li>
 * <li>{@link WebSocketProperties} - WebSocket transport</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private ChatProperties chat = new ChatProperties();
    private ToolEventsProperties toolEvents = new ToolEventsProperties();
    private VerboseProperties verbose = new VerboseProperties();
    private HeartbeatProperties heartbeat = new HeartbeatProperties();
    private MaintenanceProperties maintenance = new MaintenanceProperties();
    private WebSocketProperties websocket = new WebSocketProperties();

    @Data
    public static class ChatProperties {
        private Duration deltaInterval = Duration.ofMillis(150);
        private Duration abortMarkerTtl = Duration.ofMinutes(60);
    }

    @Data
    public static class ToolEventsProperties {
        private Duration recipientTtl = Duration.ofMinutes(10);
        private Duration finalGrace = Duration.ofSeconds(30);
    }

    @Data
    public static class VerboseProperties {
        private String defaultLevel = "off";
        private Map<String, String> sessions = new HashMap<>();
    }

    @Data
    public static class HeartbeatProperties {
        private boolean showOk = false;
    }

    @Data
    public static class MaintenanceProperties {
        private boolean enabled = true;
        private Duration sweepInterval = Duration.ofSeconds(60);
        private Duration terminatedRunRetention = Duration.ofMinutes(10);
    }

    @Data
    public static class WebSocketProperties {
        private String path = "/ws/gateway";
        private int maxBufferedFrames = 256;
    }
}
