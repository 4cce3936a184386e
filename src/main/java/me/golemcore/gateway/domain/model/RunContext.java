package me.golemcore.gateway.domain.model;

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

import lombok.Builder;

/**
 * Cached metadata about an in-flight run, consulted by routing stages instead
 * of re-deriving it from configuration on every event. All fields are
 * optional.
 */
@Builder(toBuilder = true)
public record RunContext(String sessionKey, String verboseLevel, Boolean heartbeat) {

    public static RunContext empty() {
        return new RunContext(null, null, null);
    }

    public boolean isHeartbeat() {
        return Boolean.TRUE.equals(heartbeat);
    }

    /**
     * Fills the fields absent here with the ones supplied by {@code incoming}.
     * Present fields are never overwritten, so a context that already has a
     * session key keeps it.
     */
    public RunContext mergeMissing(RunContext incoming) {
        if (incoming == null) {
            return this;
        }
        return new RunContext(
                isBlank(sessionKey) ? blankToNull(incoming.sessionKey()) : sessionKey,
                isBlank(verboseLevel) ? blankToNull(incoming.verboseLevel()) : verboseLevel,
                heartbeat == null ? incoming.heartbeat() : heartbeat);
    }

    public RunContext normalized() {
        return new RunContext(blankToNull(sessionKey), blankToNull(verboseLevel), heartbeat);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }
}
