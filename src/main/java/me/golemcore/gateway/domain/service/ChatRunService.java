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
import me.golemcore.gateway.domain.model.ChatLinkState;
import me.golemcore.gateway.domain.model.ChatRunEntry;
import me.golemcore.gateway.domain.model.ChatRunRequest;
import me.golemcore.gateway.domain.model.RunContext;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Entry point for chat requests: binds a dispatched run to its requesting
 * client before the agent executor emits its first event, and records
 * cancellation so late events of the run are kept out of the chat projection.
 *
 * <p>
 * Cancelling the run itself is the caller's business. The producer is
 * expected to still emit a terminal lifecycle event, which is when the abort
 * marker is cleaned up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatRunService {

    private final ChatRunRegistry chatRunRegistry;
    private final RunContextRegistry runContextRegistry;
    private final ToolEventRecipientRegistry toolEventRecipients;
    private final ChatRunState chatRunState;

    /**
     * Registers a chat request.
     *
     * @return the pending chat-link entry
     */
    public ChatRunEntry startChatRun(ChatRunRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (StringValueSupport.isBlank(request.runId())) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        if (StringValueSupport.isBlank(request.sessionKey())) {
            throw new IllegalArgumentException("sessionKey must not be blank");
        }

        String clientRunId = StringValueSupport.isBlank(request.clientRunId())
                ? request.runId()
                : request.clientRunId();
        ChatRunEntry entry = new ChatRunEntry(request.sessionKey(), clientRunId);

        runContextRegistry.register(request.runId(), RunContext.builder()
                .sessionKey(request.sessionKey())
                .verboseLevel(request.verboseLevel())
                .heartbeat(request.heartbeat())
                .build());
        chatRunState.openLink(clientRunId);
        chatRunRegistry.add(request.runId(), entry);
        toolEventRecipients.add(request.runId(), request.connectionId());

        log.debug("[ChatRun] started: runId={}, clientRunId={}, sessionKey={}",
                request.runId(), clientRunId, request.sessionKey());
        return entry;
    }

    /**
     * Marks a run as aborted. Idempotent.
     *
     * @param clientRunId
     *            client id of the request; may be {@code null} when the caller
     *            only knows the internal run id
     * @return whether the run was known to the gateway
     */
    public boolean abortChatRun(String runId, String clientRunId) {
        if (StringValueSupport.isBlank(runId) && StringValueSupport.isBlank(clientRunId)) {
            return false;
        }
        boolean known = !StringValueSupport.isBlank(runId)
                && (chatRunRegistry.peek(runId) != null || runContextRegistry.get(runId) != null);

        chatRunState.markAborted(runId);
        chatRunState.markAborted(clientRunId);
        log.info("[ChatRun] abort requested: runId={}, clientRunId={}, known={}", runId, clientRunId, known);
        return known;
    }

    public void subscribeToolEvents(String runId, String connectionId) {
        toolEventRecipients.add(runId, connectionId);
    }

    public ChatLinkState linkState(String clientRunId) {
        return chatRunState.linkState(clientRunId);
    }
}
