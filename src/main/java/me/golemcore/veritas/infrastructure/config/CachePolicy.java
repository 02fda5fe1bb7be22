package me.golemcore.veritas.infrastructure.config;

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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable engine policy handed to the engine services at construction time.
 * Built once from {@link VeritasProperties} so that runtime code never reads
 * mutable configuration.
 */
@Value
@Builder(toBuilder = true)
public class CachePolicy {

    public static final int DEFAULT_PROMOTION_THRESHOLD = 5;
    public static final int DEFAULT_MAX_KEY_LENGTH = 100;
    public static final int DEFAULT_TOP_QUERIES_LIMIT = 10;
    public static final int DEFAULT_FOLLOW_UP_CONTEXT_MESSAGES = 2;
    public static final Duration DEFAULT_PROVIDER_TIMEOUT = Duration.ofSeconds(60);

    /**
     * A query is promoted once its usage count is strictly greater than this.
     */
    int promotionThreshold;
    int maxKeyLength;
    int topQueriesLimit;
    int followUpContextMessages;
    Duration providerTimeout;

    public static CachePolicy defaults() {
        return CachePolicy.builder()
                .promotionThreshold(DEFAULT_PROMOTION_THRESHOLD)
                .maxKeyLength(DEFAULT_MAX_KEY_LENGTH)
                .topQueriesLimit(DEFAULT_TOP_QUERIES_LIMIT)
                .followUpContextMessages(DEFAULT_FOLLOW_UP_CONTEXT_MESSAGES)
                .providerTimeout(DEFAULT_PROVIDER_TIMEOUT)
                .build();
    }

    public static CachePolicy from(VeritasProperties properties) {
        VeritasProperties.CacheProperties cache = properties.getCache();
        return CachePolicy.builder()
                .promotionThreshold(cache.getPromotionThreshold())
                .maxKeyLength(cache.getMaxKeyLength())
                .topQueriesLimit(cache.getTopQueriesLimit())
                .followUpContextMessages(cache.getFollowUpContextMessages())
                .providerTimeout(properties.getLlm().getTimeout())
                .build();
    }

    public boolean shouldPromote(long count) {
        return count > promotionThreshold;
    }
}
