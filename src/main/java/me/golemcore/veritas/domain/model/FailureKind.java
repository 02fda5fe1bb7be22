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

/**
 * Classification of a failed engine operation. Transport adapters map each kind
 * to a distinct response.
 */
public enum FailureKind {

    /**
     * Missing or inconsistent input (absent query, mismatched session id).
     */
    VALIDATION,

    /**
     * Malformed payload, e.g. an import document that is not valid JSON.
     */
    PARSE,

    /**
     * Model backend unreachable, timed out or returned an unexpected shape.
     */
    PROVIDER,

    /**
     * Underlying persistence failed.
     */
    STORE,

    /**
     * Anything else.
     */
    INTERNAL
}
