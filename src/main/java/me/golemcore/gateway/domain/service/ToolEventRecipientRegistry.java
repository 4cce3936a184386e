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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Connections entitled to a run's verbose tool telemetry.
 *
 * <p>
 * Retention is time bounded and pruned lazily on every access:
 * <ul>
 * <li>an entry not yet finalized expires {@code recipientTtl} (10 min) after
 * its last add/read;</li>
 * <li>a finalized entry expires {@code finalGrace} (30 s) after
 * {@link #markFinal(String)}, so a consumer fetching recipients for the run's
 * last tool event still gets them.</li>
 * </ul>
 */
@Component
@Slf4j
public class ToolEventRecipientRegistry {

    private final Clock clock;
    private final Duration recipientTtl;
    private final Duration finalGrace;

    private final Object lock = new Object();
    private final Map<String, RecipientEntry> recipients = new HashMap<>();

    public ToolEventRecipientRegistry(Clock clock, GatewayProperties properties) {
        this.clock = clock;
        this.recipientTtl = properties.getToolEvents().getRecipientTtl();
        this.finalGrace = properties.getToolEvents().getFinalGrace();
    }

    public void add(String runId, String connectionId) {
        if (StringValueSupport.isBlank(runId) || StringValueSupport.isBlank(connectionId)) {
            return;
        }
        Instant now = clock.instant();
        synchronized (lock) {
            pruneLocked(now);
            RecipientEntry entry = recipients.computeIfAbsent(runId, key -> new RecipientEntry());
            entry.connectionIds.add(connectionId);
            entry.updatedAt = now;
        }
    }

    /**
     * Returns a snapshot of the live recipients, or {@code null} when the run
     * has none. A read counts as activity.
     */
    public Set<String> get(String runId) {
        if (StringValueSupport.isBlank(runId)) {
            return null;
        }
        Instant now = clock.instant();
        synchronized (lock) {
            // Expire first: an entry idle past its cutoff must not be revived by the read.
            pruneLocked(now);
            RecipientEntry entry = recipients.get(runId);
            if (entry == null) {
                return null;
            }
            entry.updatedAt = now;
            return Set.copyOf(entry.connectionIds);
        }
    }

    public void markFinal(String runId) {
        if (StringValueSupport.isBlank(runId)) {
            return;
        }
        Instant now = clock.instant();
        synchronized (lock) {
            RecipientEntry entry = recipients.get(runId);
            if (entry == null) {
                return;
            }
            entry.finalizedAt = now;
            pruneLocked(now);
        }
    }

    /**
     * Removes expired entries.
     *
     * @return number of entries removed
     */
    public int prune() {
        synchronized (lock) {
            return pruneLocked(clock.instant());
        }
    }

    public int size() {
        synchronized (lock) {
            return recipients.size();
        }
    }

    private int pruneLocked(Instant now) {
        if (recipients.isEmpty()) {
            return 0;
        }
        int removed = 0;
        Iterator<Map.Entry<String, RecipientEntry>> iterator = recipients.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, RecipientEntry> candidate = iterator.next();
            RecipientEntry entry = candidate.getValue();
            Instant cutoff = entry.finalizedAt != null
                    ? entry.finalizedAt.plus(finalGrace)
                    : entry.updatedAt.plus(recipientTtl);
            if (!now.isBefore(cutoff)) {
                iterator.remove();
                removed++;
                log.debug("[ToolEventRecipients] expired recipients: runId={}", candidate.getKey());
            }
        }
        return removed;
    }

    private static final class RecipientEntry {
        private final Set<String> connectionIds = new LinkedHashSet<>();
        private Instant updatedAt;
        private Instant finalizedAt;
    }
}
