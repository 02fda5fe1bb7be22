package me.golemcore.veritas.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.veritas.adapter.inbound.web.EngineFailureException;
import me.golemcore.veritas.adapter.inbound.web.dto.LoadRequest;
import me.golemcore.veritas.adapter.inbound.web.dto.LoadResponse;
import me.golemcore.veritas.adapter.inbound.web.dto.OperationResponse;
import me.golemcore.veritas.adapter.inbound.web.dto.QueryRequest;
import me.golemcore.veritas.adapter.inbound.web.dto.QueryResponse;
import me.golemcore.veritas.adapter.inbound.web.dto.SaveRequest;
import me.golemcore.veritas.domain.model.QueryAnswer;
import me.golemcore.veritas.domain.model.TopQuery;
import me.golemcore.veritas.domain.service.TruthEngineService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Answer lookup, editing, querying and popularity endpoints.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class TruthController {

    private final TruthEngineService engine;

    @PostMapping("/api/load")
    public Mono<ResponseEntity<LoadResponse>> load(@RequestBody(required = false) LoadRequest request) {
        String query = request != null ? request.getQuery() : null;
        return Mono.fromCallable(() -> {
            String answer = EngineFailureException.unwrap(engine.load(query));
            return ResponseEntity.ok(new LoadResponse(answer));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/api/save")
    public Mono<ResponseEntity<OperationResponse>> save(
            @RequestBody(required = false) SaveRequest request,
            @RequestParam(required = false) String sessionId) {
        SaveRequest body = request != null ? request : new SaveRequest();
        String resolvedSessionId = resolveSessionId(sessionId);
        return Mono.fromCallable(() -> {
            String normalizedQuery = EngineFailureException.unwrap(
                    engine.save(resolvedSessionId, body.getQuery(), body.getAnswer(), body.getEditor()));
            log.info("[API] Saved edited answer for '{}'", normalizedQuery);
            return ResponseEntity.ok(OperationResponse.ok("Saved successfully"));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/query")
    public Mono<ResponseEntity<QueryResponse>> query(
            @RequestBody(required = false) QueryRequest request,
            @RequestParam(required = false) String sessionId) {
        QueryRequest body = request != null ? request : new QueryRequest();
        String resolvedSessionId = resolveSessionId(sessionId);
        return Mono.fromCallable(() -> {
            QueryAnswer answer = EngineFailureException.unwrap(
                    engine.query(resolvedSessionId, body.getQuery(), body.isFollowUp()));
            return ResponseEntity.ok(QueryResponse.builder()
                    .answer(answer.getAnswer())
                    .sessionId(answer.getSessionId())
                    .source(answer.getSource() != null ? answer.getSource().name().toLowerCase(Locale.ROOT) : null)
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/top-queries")
    public Mono<ResponseEntity<List<TopQuery>>> topQueries(@RequestParam(required = false) Integer limit) {
        return Mono.fromCallable(() -> {
            List<TopQuery> top = EngineFailureException.unwrap(
                    limit != null ? engine.topQueries(limit) : engine.topQueries());
            return ResponseEntity.ok(top);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    static String resolveSessionId(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
    }
}
