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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Client-facing chat projection of a run. {@code runId} is the id the client
 * used for the request, not the internal run id.
 *
 * <ul>
 * <li>{@code delta}: {@code message} holds the cumulative assistant text so
 * far.</li>
 * <li>{@code final}: {@code message} holds the final text, or is absent when
 * the run produced none.</li>
 * <li>{@code error}: {@code errorMessage} describes the failure when
 * known.</li>
 * </ul>
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatEvent(String runId, String sessionKey, int seq, ChatEventState state, ChatMessage message,
        String errorMessage) {
}
