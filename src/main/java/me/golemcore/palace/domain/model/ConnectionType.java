package me.golemcore.palace.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of relationship a {@link KnowledgeConnection} expresses.
 */
public enum ConnectionType {

    SIMILAR("similar", "Similar concepts"),
    CAUSAL("causal", "Cause and effect"),
    CONTRADICTORY("contradictory", "Opposing views"),
    ELABORATIVE("elaborative", "Builds upon"),
    TEMPORAL("temporal", "Time-related"),
    THEMATIC("thematic", "Same theme");

    private final String value;
    private final String label;

    ConnectionType(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<ConnectionType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConnectionType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ConnectionType fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown connection type: " + value));
    }
}
