package me.golemcore.gateway.port.inbound;

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

import me.golemcore.gateway.domain.model.RunEvent;
import me.golemcore.gateway.domain.model.RunEventRequest;

import java.util.function.Consumer;

/**
 * Inbound port through which agent executors publish run events. Every
 * accepted event is sequenced per run and handed to all subscribers
 * synchronously, on the caller's thread.
 */
public interface RunEventPort {

    /**
     * Sequences and dispatches an event.
     *
     * @return the dispatched event, or {@code null} when the event was
     *         suppressed as a duplicate
     */
    RunEvent emit(RunEventRequest request);

    /**
     * Registers a subscriber.
     *
     * @return handle that removes the subscriber when run
     */
    Runnable subscribe(Consumer<RunEvent> listener);
}
