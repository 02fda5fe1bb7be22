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
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only conversation transcript for one session id. Messages keep
 * insertion order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {

    private String sessionId;

    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();

    private Instant created;

    /**
     * Creates an empty transcript for the given session.
     */
    public static SessionRecord empty(String sessionId, Instant created) {
        return SessionRecord.builder()
                .sessionId(sessionId)
                .messages(new ArrayList<>())
                .created(created)
                .build();
    }
}
