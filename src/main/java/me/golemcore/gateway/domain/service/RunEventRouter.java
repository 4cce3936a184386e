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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ChatRunEntry;
import me.golemcore.gateway.domain.model.DeliveryOptions;
import me.golemcore.gateway.domain.model.GatewayEvents;
import me.golemcore.gateway.domain.model.LifecyclePhase;
import me.golemcore.gateway.domain.model.RunEvent;
import me.golemcore.gateway.domain.model.RunStreams;
import me.golemcore.gateway.domain.model.VerboseLevel;
import me.golemcore.gateway.port.inbound.RunEventPort;
import me.golemcore.gateway.port.outbound.GatewayBroadcastPort;
import me.golemcore.gateway.port.outbound.SessionDeliveryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes every sequenced run event to its audiences.
 *
 * <p>
 * Per event:
 * <ol>
 * <li>resolves the session key and client run id (chat link first, then the
 * event, then the run context);</li>
 * <li>reports a sequence gap as a synthetic {@code error} stream event and
 * keeps going;</li>
 * <li>delivers tool events only to registered recipients, gated and redacted
 * by the run's tool verbosity; every other stream goes to the global
 * broadcast and the owning session;</li>
 * <li>projects assistant text and terminal phases into the chat protocol,
 * unless the run was aborted, in which case the terminal phase only cleans
 * up;</li>
 * <li>on {@code end}/{@code error}, finalizes tool recipients and clears the
 * run context.</li>
 * </ol>
 *
 * <p>
 * Each step fails on its own: an exception is logged and the remaining steps
 * still run. Nothing propagates to the producer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunEventRouter {

    private static final String GAP_REASON = "seq gap";

    private final RunEventPort runEventPort;
    private final RunContextRegistry runContextRegistry;
    private final ChatRunRegistry chatRunRegistry;
    private final ChatRunState chatRunState;
    private final ToolEventRecipientRegistry toolEventRecipients;
    private final ToolVerbosityResolver toolVerbosityResolver;
    private final ChatStreamProjector chatStreamProjector;
    private final GatewayBroadcastPort broadcastPort;
    private final SessionDeliveryPort sessionDeliveryPort;
    private final Clock clock;

    private final Map<String, SeqMark> lastSeqByRun = new ConcurrentHashMap<>();
    private volatile Runnable unsubscribe;

    @PostConstruct
    void start() {
        unsubscribe = runEventPort.subscribe(this::handle);
        log.info("[RunEventRouter] subscribed to run events");
    }

    @PreDestroy
    void stop() {
        Runnable handle = unsubscribe;
        if (handle != null) {
            handle.run();
            unsubscribe = null;
        }
    }

    public void handle(RunEvent event) {
        if (event == null || StringValueSupport.isBlank(event.runId())) {
            return;
        }
        try {
            route(event);
        } catch (RuntimeException e) { // NOSONAR - routing must never fail the producer
            log.warn("[RunEventRouter] routing failed: runId={}, seq={}: {}",
                    event.runId(), event.seq(), e.getMessage(), e);
        }
    }

    /**
     * Returns the last sequence number routed for a run, 0 when none.
     */
    public int lastSeenSeq(String runId) {
        SeqMark mark = runId != null ? lastSeqByRun.get(runId) : null;
        return mark != null ? mark.seq() : 0;
    }

    /**
     * Drops sequence tracking of runs that reached a terminal phase and whose
     * last event is older than {@code cutoff}. Times are the events' own
     * {@code ts}, the same instants the bus keeps for its sequence records.
     *
     * @return number of runs evicted
     */
    public int evictTerminatedBefore(Instant cutoff) {
        long cutoffMillis = cutoff.toEpochMilli();
        int before = lastSeqByRun.size();
        lastSeqByRun.entrySet().removeIf(entry -> entry.getValue().terminated()
                && entry.getValue().lastEventTs() < cutoffMillis);
        return before - lastSeqByRun.size();
    }

    private void route(RunEvent event) {
        String runId = event.runId();
        ChatRunEntry chatLink = chatRunRegistry.peek(runId);
        String sessionKey = StringValueSupport.firstNonBlank(
                chatLink != null ? chatLink.sessionKey() : null,
                event.sessionKey(),
                runContextRegistry.getSessionKey(runId));
        String clientRunId = chatLink != null ? chatLink.clientRunId() : runId;
        boolean aborted = chatRunState.isAborted(clientRunId) || chatRunState.isAborted(runId);
        boolean terminal = event.isTerminal();

        runStep("sequence", event, () -> trackSequence(event, sessionKey));

        if (event.isStream(RunStreams.TOOL)) {
            runStep("tool delivery", event, () -> deliverToolEvent(event, sessionKey));
        } else {
            runStep("agent delivery", event, () -> deliverAgentEvent(event, sessionKey));
        }

        if (aborted) {
            if (terminal) {
                runStep("abort cleanup", event, () -> cleanupAborted(runId, clientRunId, sessionKey, chatLink));
            }
        } else if (sessionKey != null) {
            runStep("chat projection", event, () -> projectChat(event, sessionKey, clientRunId, chatLink));
        }

        if (terminal) {
            runStep("terminal bookkeeping", event, () -> finishRun(runId));
        }
    }

    private void trackSequence(RunEvent event, String sessionKey) {
        String runId = event.runId();
        SeqMark previous = lastSeqByRun.get(runId);
        boolean terminated = event.isTerminal() || (previous != null && previous.terminated());
        lastSeqByRun.put(runId, new SeqMark(event.seq(), terminated, event.ts()));
        int expected = (previous != null ? previous.seq() : 0) + 1;
        if (event.seq() == expected) {
            return;
        }

        log.debug("[RunEventRouter] sequence gap: runId={}, expected={}, received={}",
                runId, expected, event.seq());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reason", GAP_REASON);
        data.put("expected", expected);
        data.put("received", event.seq());

        Map<String, Object> diagnostic = new LinkedHashMap<>();
        diagnostic.put("runId", runId);
        diagnostic.put("stream", RunStreams.ERROR);
        diagnostic.put("ts", clock.millis());
        if (sessionKey != null) {
            diagnostic.put("sessionKey", sessionKey);
        }
        diagnostic.put("data", data);
        broadcastPort.broadcast(GatewayEvents.AGENT, diagnostic, DeliveryOptions.DEFAULT);
    }

    private void deliverToolEvent(RunEvent event, String sessionKey) {
        VerboseLevel level = toolVerbosityResolver.resolve(event.runId(), sessionKey);
        if (level == VerboseLevel.OFF) {
            return;
        }

        RunEvent payload = withSessionKey(event, sessionKey);
        if (level != VerboseLevel.FULL) {
            payload = payload.withData(redactToolOutput(event.data()));
        }

        Set<String> recipients = toolEventRecipients.get(event.runId());
        if (recipients == null || recipients.isEmpty()) {
            return;
        }
        broadcastPort.broadcastToConnections(GatewayEvents.AGENT, payload, recipients, DeliveryOptions.DEFAULT);
    }

    private void deliverAgentEvent(RunEvent event, String sessionKey) {
        RunEvent payload = withSessionKey(event, sessionKey);
        try {
            broadcastPort.broadcast(GatewayEvents.AGENT, payload, DeliveryOptions.DEFAULT);
        } catch (RuntimeException e) { // NOSONAR - global delivery failure must not skip the session
            log.warn("[RunEventRouter] broadcast failed: runId={}, seq={}: {}",
                    event.runId(), event.seq(), e.getMessage());
        }
        if (sessionKey != null) {
            sessionDeliveryPort.sendToSession(sessionKey, GatewayEvents.AGENT, payload);
        }
    }

    private void projectChat(RunEvent event, String sessionKey, String clientRunId, ChatRunEntry chatLink) {
        if (event.isStream(RunStreams.ASSISTANT)) {
            String text = event.text();
            if (text != null && !text.isEmpty()) {
                chatStreamProjector.projectDelta(event.runId(), sessionKey, clientRunId, event.seq(), text);
            }
            return;
        }
        if (!event.isTerminal()) {
            return;
        }

        String targetSessionKey = sessionKey;
        String targetClientRunId = clientRunId;
        if (chatLink != null) {
            ChatRunEntry finished = chatRunRegistry.shift(event.runId());
            if (finished == null) {
                return;
            }
            targetSessionKey = finished.sessionKey();
            targetClientRunId = finished.clientRunId();
        }

        if (LifecyclePhase.ERROR.equals(event.lifecyclePhase())) {
            chatStreamProjector.projectError(targetSessionKey, targetClientRunId, event.seq(),
                    event.data().get("error"));
        } else {
            chatStreamProjector.projectFinal(event.runId(), targetSessionKey, targetClientRunId, event.seq());
        }
    }

    private void cleanupAborted(String runId, String clientRunId, String sessionKey, ChatRunEntry chatLink) {
        chatRunState.clearAborted(clientRunId);
        chatRunState.clearAborted(runId);
        chatStreamProjector.discard(clientRunId);
        if (chatLink != null) {
            chatRunRegistry.remove(runId, clientRunId, sessionKey);
        }
        log.debug("[RunEventRouter] aborted run finished: runId={}, clientRunId={}", runId, clientRunId);
    }

    private void finishRun(String runId) {
        try {
            toolEventRecipients.markFinal(runId);
        } finally {
            runContextRegistry.clear(runId);
        }
    }

    private void runStep(String step, RunEvent event, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) { // NOSONAR - a failed step degrades to skipping its delivery
            log.warn("[RunEventRouter] {} failed: runId={}, seq={}, stream={}: {}",
                    step, event.runId(), event.seq(), event.stream(), e.getMessage());
        }
    }

    private static RunEvent withSessionKey(RunEvent event, String sessionKey) {
        if (sessionKey == null || sessionKey.equals(event.sessionKey())) {
            return event;
        }
        return event.withSessionKey(sessionKey);
    }

    private static Map<String, Object> redactToolOutput(Map<String, Object> data) {
        Map<String, Object> redacted = new LinkedHashMap<>(data);
        redacted.remove("result");
        redacted.remove("partialResult");
        return redacted;
    }

    private record SeqMark(int seq, boolean terminated, long lastEventTs) {
    }
}
