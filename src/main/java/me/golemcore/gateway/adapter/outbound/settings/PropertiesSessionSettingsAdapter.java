package me.golemcore.gateway.adapter.outbound.settings;

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
import me.golemcore.gateway.domain.service.StringValueSupport;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.SessionSettingsPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session settings backed by {@code gateway.verbose.sessions.*} with in-memory
 * runtime overrides. Overrides win over configured values and are lost on
 * restart.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PropertiesSessionSettingsAdapter implements SessionSettingsPort {

    private final GatewayProperties properties;
    private final Map<String, String> verboseOverrides = new ConcurrentHashMap<>();

    @Override
    public String getVerboseLevel(String sessionKey) {
        if (StringValueSupport.isBlank(sessionKey)) {
            return null;
        }
        String override = verboseOverrides.get(sessionKey);
        if (override != null) {
            return override;
        }
        Map<String, String> configured = properties.getVerbose().getSessions();
        return configured != null ? configured.get(sessionKey) : null;
    }

    @Override
    public void setVerboseLevel(String sessionKey, String verboseLevel) {
        if (StringValueSupport.isBlank(sessionKey)) {
            throw new IllegalArgumentException("sessionKey must not be blank");
        }
        if (StringValueSupport.isBlank(verboseLevel)) {
            verboseOverrides.remove(sessionKey);
            log.debug("[SessionSettings] verbose override cleared: sessionKey={}", sessionKey);
            return;
        }
        verboseOverrides.put(sessionKey, verboseLevel.trim());
        log.debug("[SessionSettings] verbose override set: sessionKey={}, level={}", sessionKey, verboseLevel);
    }
}
