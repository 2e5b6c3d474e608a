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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A conversation owned by the surrounding application. The memory palace only
 * reads it and keeps non-owning references to its ids.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

    private String id;
    private String title;
    private Instant createdAt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    public boolean isEmpty() {
        return messages == null || messages.isEmpty();
    }

    /**
     * Message contents joined by newlines, in conversation order.
     */
    public String toTranscript() {
        if (isEmpty()) {
            return "";
        }
        return messages.stream()
                .map(Message::getContent)
                .filter(Objects::nonNull)
                .collect(Collectors.joining("\n"));
    }

    public List<String> getMessageIds() {
        if (isEmpty()) {
            return List.of();
        }
        return messages.stream()
                .map(Message::getId)
                .filter(Objects::nonNull)
                .toList();
    }
}
