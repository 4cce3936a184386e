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
 * Dispatch of a simple chat request: binds an internal run to the session and
 * client run id that asked for it.
 *
 * @param runId
 *            internal run id the agent executor will emit events under
 * @param sessionKey
 *            session that owns the run
 * @param clientRunId
 *            id the client correlates chat events with; defaults to
 *            {@code runId}
 * @param connectionId
 *            requesting connection, registered as tool-event recipient when
 *            present
 * @param verboseLevel
 *            optional run-level verbosity override
 * @param heartbeat
 *            whether the run was triggered by a heartbeat wake
 */
@Builder
public record ChatRunRequest(String runId, String sessionKey, String clientRunId, String connectionId,
        String verboseLevel, boolean heartbeat) {
}
