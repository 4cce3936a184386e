package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.model.DeliveryOptions;

import java.util.Set;

/**
 * Outbound port for delivering events to connected gateway clients.
 * Implementations treat delivery as best effort and must not block the caller
 * on a slow connection.
 */
public interface GatewayBroadcastPort {

    /**
     * Delivers an event to every connected client.
     */
    void broadcast(String event, Object payload, DeliveryOptions options);

    /**
     * Delivers an event to the given connections only.
     */
    void broadcastToConnections(String event, Object payload, Set<String> connectionIds, DeliveryOptions options);
}
