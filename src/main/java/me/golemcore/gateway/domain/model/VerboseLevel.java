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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How much tool-call detail is exposed to an audience.
 */
public enum VerboseLevel {

    /** Tool events are not delivered at all. */
    OFF("off"),

    /** Call metadata is delivered, tool output is redacted. */
    PARTIAL("partial"),

    /** Everything, including tool output. */
    FULL("full");

    private final String wireValue;

    VerboseLevel(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses a configured level, returning {@code null} for blank or
     * unrecognized input so that callers can fall through to the next source.
     */
    public static VerboseLevel normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
        case "off", "false", "no", "0" -> OFF;
        case "on", "partial", "true", "yes", "1" -> PARTIAL;
        case "full", "all" -> FULL;
        default -> null;
        };
    }
}
