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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sequenced event observed during an agent run. Immutable once emitted by the
 * {@code RunEventBus}; {@code seq} is strictly increasing per run starting at
 * 1.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunEvent(String runId, int seq, String stream, long ts, Map<String, Object> data, String sessionKey) {

    public RunEvent {
        data = copyData(data);
    }

    @JsonIgnore
    public boolean isStream(String candidate) {
        return candidate != null && candidate.equals(stream);
    }

    /**
     * Returns {@code data.phase} for lifecycle events, {@code null} otherwise.
     */
    @JsonIgnore
    public String lifecyclePhase() {
        if (!isStream(RunStreams.LIFECYCLE)) {
            return null;
        }
        return data.get("phase") instanceof String phase ? phase : null;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return LifecyclePhase.isTerminal(lifecyclePhase());
    }

    /**
     * Returns {@code data.text} when it is a string, {@code null} otherwise.
     */
    @JsonIgnore
    public String text() {
        return data.get("text") instanceof String text ? text : null;
    }

    public RunEvent withSessionKey(String newSessionKey) {
        return toBuilder().sessionKey(newSessionKey).build();
    }

    public RunEvent withData(Map<String, Object> newData) {
        return toBuilder().data(newData).build();
    }

    private static Map<String, Object> copyData(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
