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
import me.golemcore.gateway.domain.model.RunContext;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide table of in-flight run metadata keyed by run id.
 *
 * <p>
 * Registration is an idempotent merge: a later registration only fills fields
 * that are still absent, so a context never loses its session key. Entries are
 * cleared when the run reaches a terminal lifecycle phase.
 */
@Component
@Slf4j
public class RunContextRegistry {

    private final Map<String, RunContext> contexts = new ConcurrentHashMap<>();

    public void register(String runId, RunContext context) {
        if (StringValueSupport.isBlank(runId) || context == null) {
            return;
        }
        contexts.merge(runId, context.normalized(), RunContext::mergeMissing);
    }

    public RunContext get(String runId) {
        if (StringValueSupport.isBlank(runId)) {
            return null;
        }
        return contexts.get(runId);
    }

    public String getSessionKey(String runId) {
        RunContext context = get(runId);
        return context != null ? context.sessionKey() : null;
    }

    public void clear(String runId) {
        if (StringValueSupport.isBlank(runId)) {
            return;
        }
        if (contexts.remove(runId) != null) {
            log.debug("[RunContextRegistry] cleared context: runId={}", runId);
        }
    }

    public int size() {
        return contexts.size();
    }
}
