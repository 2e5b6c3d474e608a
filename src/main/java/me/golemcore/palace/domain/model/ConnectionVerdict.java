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

/**
 * Relationship verdict for one pair of nodes, as returned by the completion
 * service. {@code type}, {@code strength} and {@code description} are only set
 * when {@code connected} is true.
 */
public record ConnectionVerdict(
        boolean connected,
        ConnectionType type,
        double strength,
        String description) {

    public static ConnectionVerdict notConnected() {
        return new ConnectionVerdict(false, null, 0.0, null);
    }
}
