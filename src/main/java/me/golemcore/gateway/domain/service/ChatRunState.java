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
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per client run bookkeeping of the chat projection: buffered assistant text,
 * time of the last delta, abort markers and the chat-link state machine.
 *
 * <p>
 * Every table is keyed by a single run id, so no operation spans keys.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatRunState {

    private final Clock clock;

    private final Map<String, BufferedText> buffers = new ConcurrentHashMap<>();
    private final Map<String, Long> deltaSentAt = new ConcurrentHashMap<>();
    private final Map<String, Instant> abortedRuns = new ConcurrentHashMap<>();
    private final Map<String, ChatLink> links = new ConcurrentHashMap<>();

    // ==================== BUFFERS ====================

    public void bufferText(String clientRunId, String text) {
        buffers.put(clientRunId, new BufferedText(text, clock.instant()));
    }

    public String bufferedText(String clientRunId) {
        BufferedText buffered = buffers.get(clientRunId);
        return buffered != null ? buffered.text() : null;
    }

    public long lastDeltaSentAt(String clientRunId) {
        return deltaSentAt.getOrDefault(clientRunId, 0L);
    }

    public void recordDeltaSent(String clientRunId, long sentAtMillis) {
        deltaSentAt.put(clientRunId, sentAtMillis);
    }

    /**
     * Drops the buffered text and throttle timestamp of a client run.
     *
     * @return the buffered text, or {@code null} when nothing was buffered
     */
    public String drainBuffer(String clientRunId) {
        deltaSentAt.remove(clientRunId);
        BufferedText buffered = buffers.remove(clientRunId);
        return buffered != null ? buffered.text() : null;
    }

    public boolean hasBufferedState(String clientRunId) {
        return buffers.containsKey(clientRunId) || deltaSentAt.containsKey(clientRunId);
    }

    /**
     * Drops buffered text and throttle timestamps of client runs that have no
     * live chat link and were last touched before {@code cutoff}. This is what
     * assistant events arriving after a run finished leave behind.
     *
     * @return number of client runs whose buffered state was dropped
     */
    public int evictOrphanedBuffersBefore(Instant cutoff) {
        long cutoffMillis = cutoff.toEpochMilli();
        Set<String> evicted = new HashSet<>();
        buffers.entrySet().removeIf(entry -> {
            boolean orphaned = !hasLiveLink(entry.getKey()) && entry.getValue().updatedAt().isBefore(cutoff);
            if (orphaned) {
                evicted.add(entry.getKey());
            }
            return orphaned;
        });
        deltaSentAt.entrySet().removeIf(entry -> {
            boolean orphaned = !buffers.containsKey(entry.getKey())
                    && !hasLiveLink(entry.getKey())
                    && entry.getValue() < cutoffMillis;
            if (orphaned) {
                evicted.add(entry.getKey());
            }
            return orphaned;
        });
        return evicted.size();
    }

    // ==================== ABORT MARKERS ====================

    public void markAborted(String runId) {
        if (!StringValueSupport.isBlank(runId)) {
            abortedRuns.putIfAbsent(runId, clock.instant());
        }
    }

    public boolean isAborted(String runId) {
        return runId != null && abortedRuns.containsKey(runId);
    }

    public void clearAborted(String runId) {
        if (runId != null) {
            abortedRuns.remove(runId);
        }
    }

    /**
     * @return number of abort markers removed
     */
    public int evictAbortMarkersBefore(Instant cutoff) {
        int before = abortedRuns.size();
        abortedRuns.entrySet().removeIf(entry -> entry.getValue().isBefore(cutoff));
        return before - abortedRuns.size();
    }

    // ==================== CHAT LINKS ====================

    public void openLink(String clientRunId) {
        links.put(clientRunId, new ChatLink(ChatLinkState.PENDING, clock.instant()));
    }

    /**
     * Moves a chat link to {@code target}. Terminal links do not move again,
     * and a link never goes back to {@link ChatLinkState#PENDING}.
     */
    public void transition(String clientRunId, ChatLinkState target) {
        if (clientRunId == null || target == null) {
            return;
        }
        Instant now = clock.instant();
        links.compute(clientRunId, (key, current) -> {
            if (current != null && (current.state().isTerminal() || current.state() == target)) {
                return current;
            }
            if (target == ChatLinkState.PENDING && current != null) {
                return current;
            }
            return new ChatLink(target, now);
        });
    }

    private boolean hasLiveLink(String clientRunId) {
        ChatLink link = links.get(clientRunId);
        return link != null && !link.state().isTerminal();
    }

    public ChatLinkState linkState(String clientRunId) {
        ChatLink link = clientRunId != null ? links.get(clientRunId) : null;
        return link != null ? link.state() : null;
    }

    /**
     * @return number of terminal links removed
     */
    public int evictTerminalLinksBefore(Instant cutoff) {
        int before = links.size();
        links.entrySet().removeIf(entry -> entry.getValue().state().isTerminal()
                && entry.getValue().updatedAt().isBefore(cutoff));
        return before - links.size();
    }

    public void clear() {
        buffers.clear();
        deltaSentAt.clear();
        abortedRuns.clear();
        links.clear();
        log.debug("[ChatRunState] cleared");
    }

    private record ChatLink(ChatLinkState state, Instant updatedAt) {
    }

    private record BufferedText(String text, Instant updatedAt) {
    }
}
