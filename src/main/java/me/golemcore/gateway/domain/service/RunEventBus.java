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
import me.golemcore.gateway.domain.model.LifecyclePhase;
import me.golemcore.gateway.domain.model.RunEvent;
import me.golemcore.gateway.domain.model.RunEventRequest;
import me.golemcore.gateway.domain.model.RunStreams;
import me.golemcore.gateway.port.inbound.RunEventPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Sequences run events and fans them out to subscribers.
 *
 * <p>
 * For every accepted event the bus:
 * <ol>
 * <li>suppresses an assistant event whose non-empty {@code data.text} equals
 * the previous assistant text of the same run;</li>
 * <li>forgets that text when the run reaches {@code end} or {@code error}, so a
 * reused run id starts with a clean slate;</li>
 * <li>assigns the next per-run sequence number, starting at 1;</li>
 * <li>resolves the session key (explicit, else the cached
 * {@link RunContextRegistry} one) and stamps the wall-clock time;</li>
 * <li>invokes every subscriber in registration order, isolating
 * failures.</li>
 * </ol>
 *
 * <p>
 * All steps for one run happen under that run's monitor, so concurrent
 * producers of the same run still observe gapless, ordered delivery. Runs do
 * not contend with each other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunEventBus implements RunEventPort {

    private final Clock clock;
    private final RunContextRegistry runContextRegistry;

    private final Map<String, RunSequence> sequences = new ConcurrentHashMap<>();
    private final List<Consumer<RunEvent>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public RunEvent emit(RunEventRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (StringValueSupport.isBlank(request.runId())) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        if (StringValueSupport.isBlank(request.stream())) {
            throw new IllegalArgumentException("stream must not be blank");
        }

        while (true) {
            RunSequence sequence = sequences.computeIfAbsent(request.runId(), key -> new RunSequence());
            synchronized (sequence) {
                if (sequence.evicted) {
                    continue;
                }
                return emitLocked(sequence, request);
            }
        }
    }

    @Override
    public Runnable subscribe(Consumer<RunEvent> listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Returns the last sequence number assigned to a run, 0 when none.
     */
    public int currentSeq(String runId) {
        RunSequence sequence = runId != null ? sequences.get(runId) : null;
        if (sequence == null) {
            return 0;
        }
        synchronized (sequence) {
            return sequence.seq;
        }
    }

    /**
     * Drops bookkeeping of runs that reached a terminal phase and have seen no
     * event since before {@code cutoff}. Runs that never terminated are never
     * evicted.
     *
     * @return number of runs evicted
     */
    public int evictTerminatedBefore(Instant cutoff) {
        int evicted = 0;
        Iterator<Map.Entry<String, RunSequence>> iterator = sequences.entrySet().iterator();
        while (iterator.hasNext()) {
            RunSequence sequence = iterator.next().getValue();
            synchronized (sequence) {
                if (sequence.terminatedAt != null && sequence.lastActivityAt.isBefore(cutoff)) {
                    sequence.evicted = true;
                    iterator.remove();
                    evicted++;
                }
            }
        }
        return evicted;
    }

    public int trackedRunCount() {
        return sequences.size();
    }

    private RunEvent emitLocked(RunSequence sequence, RunEventRequest request) {
        String runId = request.runId();
        Map<String, Object> data = request.data() != null ? request.data() : Map.of();

        if (RunStreams.ASSISTANT.equals(request.stream()) && data.get("text") instanceof String text) {
            if (!text.isEmpty() && text.equals(sequence.lastAssistantText)) {
                log.trace("[RunEventBus] duplicate assistant text suppressed: runId={}", runId);
                return null;
            }
            sequence.lastAssistantText = text;
        }

        // Millisecond precision, so the router can stamp its own bookkeeping from ts.
        Instant now = Instant.ofEpochMilli(clock.millis());
        boolean terminal = RunStreams.LIFECYCLE.equals(request.stream())
                && data.get("phase") instanceof String phase
                && LifecyclePhase.isTerminal(phase);
        if (terminal) {
            sequence.lastAssistantText = null;
            sequence.terminatedAt = now;
        }
        sequence.lastActivityAt = now;

        sequence.seq++;
        String sessionKey = StringValueSupport.isBlank(request.sessionKey())
                ? runContextRegistry.getSessionKey(runId)
                : request.sessionKey();

        RunEvent event = RunEvent.builder()
                .runId(runId)
                .seq(sequence.seq)
                .stream(request.stream())
                .ts(now.toEpochMilli())
                .data(data)
                .sessionKey(sessionKey)
                .build();

        dispatch(event);
        return event;
    }

    private void dispatch(RunEvent event) {
        for (Consumer<RunEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) { // NOSONAR - one faulty subscriber must not break the others
                log.warn("[RunEventBus] subscriber failed: runId={}, seq={}, stream={}: {}",
                        event.runId(), event.seq(), event.stream(), e.getMessage(), e);
            }
        }
    }

    private static final class RunSequence {
        private int seq;
        private String lastAssistantText;
        private Instant terminatedAt;
        private Instant lastActivityAt;
        private boolean evicted;
    }
}
