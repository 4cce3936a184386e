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
import me.golemcore.gateway.domain.model.VerboseLevel;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.SessionSettingsPort;
import org.springframework.stereotype.Component;

/**
 * Resolves how much tool telemetry a run exposes.
 *
 * <p>
 * Resolution order: run-level override, session setting, agent default,
 * {@link VerboseLevel#OFF}. Unrecognized values fall through to the next
 * source. A failing session lookup resolves to {@code OFF}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolVerbosityResolver {

    private final RunContextRegistry runContextRegistry;
    private final SessionSettingsPort sessionSettingsPort;
    private final GatewayProperties properties;

    public VerboseLevel resolve(String runId, String sessionKey) {
        RunContext context = runContextRegistry.get(runId);
        VerboseLevel runLevel = VerboseLevel.normalize(context != null ? context.verboseLevel() : null);
        if (runLevel != null) {
            return runLevel;
        }
        if (StringValueSupport.isBlank(sessionKey)) {
            return VerboseLevel.OFF;
        }

        try {
            VerboseLevel sessionLevel = VerboseLevel.normalize(sessionSettingsPort.getVerboseLevel(sessionKey));
            if (sessionLevel != null) {
                return sessionLevel;
            }
            VerboseLevel defaultLevel = VerboseLevel.normalize(properties.getVerbose().getDefaultLevel());
            return defaultLevel != null ? defaultLevel : VerboseLevel.OFF;
        } catch (RuntimeException e) { // NOSONAR - unresolvable verbosity degrades to off
            log.debug("[ToolVerbosity] lookup failed, using off: sessionKey={}: {}", sessionKey, e.getMessage());
            return VerboseLevel.OFF;
        }
    }
}
