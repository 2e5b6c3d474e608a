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

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of decoding untrusted completion output: either a value or an
 * {@link ExtractionError} with a human-readable detail. Failures are ordinary
 * values, never exceptions.
 *
 * @param <T>
 *            decoded value type
 */
public record ParseResult<T>(T value, ExtractionError error, String detail) {

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> ParseResult<T> failure(ExtractionError error, String detail) {
        return new ParseResult<>(null, Objects.requireNonNull(error, "error"), detail);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public <R> ParseResult<R> flatMap(Function<T, ParseResult<R>> mapper) {
        return isSuccess() ? mapper.apply(value) : failure(error, detail);
    }

    /**
     * Short description for logs and error reporting.
     */
    public String describeError() {
        if (isSuccess()) {
            return "";
        }
        return detail != null && !detail.isBlank() ? error + ": " + detail : error.toString();
    }
}
