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
import me.golemcore.gateway.domain.model.RunContext;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;

/**
 * Decides whether chat output of heartbeat-triggered runs stays off the global
 * broadcast. The owning session still receives it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HeartbeatVisibilityPolicy {

    private final RunContextRegistry runContextRegistry;
    private final GatewayProperties properties;

    public boolean shouldSuppressGlobalBroadcast(String runId) {
        RunContext context = runContextRegistry.get(runId);
        if (context == null || !context.isHeartbeat()) {
            return false;
        }
        GatewayProperties.HeartbeatProperties heartbeat = properties.getHeartbeat();
        if (heartbeat == null) {
            log.debug("[HeartbeatVisibility] no heartbeat settings, suppressing: runId={}", runId);
            return true;
        }
        return !heartbeat.isShowOk();
    }
}
