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
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic sweep of run state that lazy pruning alone would leave behind for
 * runs nobody touches again.
 *
 * <p>
 * A finished run is evicted once it has been idle for
 * {@code gateway.maintenance.terminated-run-retention}, counted from its last
 * event rather than from its terminal phase, so late events of a finished run
 * are swept as well. The bus and the router are evicted against the same
 * cutoff and both track event timestamps, so they always drop a run together.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RunMaintenanceService {

    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final GatewayProperties properties;
    private final Clock clock;
    private final ToolEventRecipientRegistry toolEventRecipients;
    private final ChatRunState chatRunState;
    private final RunEventBus runEventBus;
    private final RunEventRouter runEventRouter;

    private ScheduledExecutorService sweepExecutor;

    @PostConstruct
    void init() {
        GatewayProperties.MaintenanceProperties maintenance = properties.getMaintenance();
        if (!maintenance.isEnabled()) {
            log.info("[Maintenance] run state sweep disabled");
            return;
        }
        long intervalMs = Math.max(1000L, maintenance.getSweepInterval().toMillis());
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-run-maintenance");
            t.setDaemon(true);
            return t;
        });
        sweepExecutor.scheduleAtFixedRate(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Maintenance] run state sweep every {} ms", intervalMs);
    }

    @PreDestroy
    void destroy() {
        if (sweepExecutor == null) {
            return;
        }
        sweepExecutor.shutdownNow();
        try {
            sweepExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs one sweep.
     */
    public SweepResult sweep() {
        Instant now = clock.instant();
        Duration retention = properties.getMaintenance().getTerminatedRunRetention();
        Instant terminatedCutoff = now.minus(retention);
        Instant abortCutoff = now.minus(properties.getChat().getAbortMarkerTtl());

        SweepResult result = new SweepResult(
                toolEventRecipients.prune(),
                chatRunState.evictAbortMarkersBefore(abortCutoff),
                chatRunState.evictTerminalLinksBefore(terminatedCutoff),
                chatRunState.evictOrphanedBuffersBefore(terminatedCutoff),
                runEventBus.evictTerminatedBefore(terminatedCutoff) + runEventRouter.evictTerminatedBefore(
                        terminatedCutoff));
        if (result.total() > 0) {
            log.debug("[Maintenance] swept {}", result);
        }
        return result;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) { // NOSONAR - a failed sweep must not cancel the schedule
            log.warn("[Maintenance] sweep failed: {}", e.getMessage(), e);
        }
    }

    public record SweepResult(int toolRecipients, int abortMarkers, int chatLinks, int chatBuffers,
            int sequenceEntries) {

        public int total() {
            return toolRecipients + abortMarkers + chatLinks + chatBuffers + sequenceEntries;
        }
    }
}
