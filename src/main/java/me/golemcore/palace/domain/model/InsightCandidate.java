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

import java.util.List;

/**
 * Unvalidated insight proposed by the completion service, before it is promoted
 * to a {@link MemoryNode}.
 */
public record InsightCandidate(
        String title,
        String content,
        String summary,
        List<String> keywords,
        String type,
        double importance) {

    public InsightCandidate {
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }
}
