package me.golemcore.gateway.port.outbound;

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

/**
 * Per-session settings owned by the session store.
 */
public interface SessionSettingsPort {

    /**
     * Returns the raw tool verbosity configured for a session, or {@code null}
     * when the session has none.
     */
    String getVerboseLevel(String sessionKey);

    /**
     * Stores the tool verbosity of a session. A {@code null} or blank level
     * removes the session's own setting.
     */
    void setVerboseLevel(String sessionKey, String verboseLevel);
}
