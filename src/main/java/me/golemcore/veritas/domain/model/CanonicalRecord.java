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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Authoritative, edit-aware answer for a normalized query, stored under
 * {@code truth:<normalized-query>}.
 *
 * <p>
 * {@code created} is set when the record is first written and carried over by
 * every later write. {@code timestamp} is the time of the last write.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalRecord {

    public static final String EDITOR_AI = "ai";
    public static final String EDITOR_USER = "user";

    private String answer;
    private String lastEditedBy;
    private boolean edited;
    private Instant created;
    private Instant timestamp;
}
