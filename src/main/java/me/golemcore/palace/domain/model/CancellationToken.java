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
 * Cooperative cancellation flag for an in-flight ingestion. Checked before
 * every completion call and every commit; once cancelled, no further state is
 * mutated.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
