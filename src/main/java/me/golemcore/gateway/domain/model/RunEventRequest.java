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

import java.util.Map;

/**
 * Event as handed to the bus by a producer, before sequencing and timestamping.
 * An explicit {@code sessionKey} wins over the one cached in the run context.
 */
@Builder
public record RunEventRequest(String runId, String stream, Map<String, Object> data, String sessionKey) {

    public static RunEventRequest of(String runId, String stream, Map<String, Object> data) {
        return new RunEventRequest(runId, stream, data, null);
    }
}
