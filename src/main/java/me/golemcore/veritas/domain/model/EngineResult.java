package me.golemcore.veritas.domain.model;

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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of an engine operation: either a success payload or a failure kind
 * with a human-readable message. Operations report failures through this type
 * instead of throwing.
 *
 * @param <T>
 *            payload type
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class EngineResult<T> {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private final boolean success;
    private final T value;
    private final FailureKind failureKind;
    private final String message;

    public static <T> EngineResult<T> success(T value) {
        return new EngineResult<>(true, value, null, null);
    }

    public static <T> EngineResult<T> failure(FailureKind kind, String message) {
        return new EngineResult<>(false, null, kind, message);
    }

    public static <T> EngineResult<T> validation(String message) {
        return failure(FailureKind.VALIDATION, message);
    }

    public boolean isFailure() {
        return !success;
    }
}
