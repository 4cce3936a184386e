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

/**
 * Well-known run event streams. The stream of a {@link RunEvent} is an open
 * string, so extensions may emit streams not listed here; they are routed like
 * any other non-tool stream.
 */
public final class RunStreams {

    public static final String LIFECYCLE = "lifecycle";
    public static final String TOOL = "tool";
    public static final String ASSISTANT = "assistant";
    public static final String ERROR = "error";

    private RunStreams() {
    }
}
