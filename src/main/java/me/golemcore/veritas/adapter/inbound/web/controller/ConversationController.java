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
import me.golemcore.veritas.adapter.inbound.web.dto.AddExchangeRequest;
import me.golemcore.veritas.adapter.inbound.web.dto.OperationResponse;
import me.golemcore.veritas.domain.model.SessionRecord;
import me.golemcore.veritas.domain.service.TruthEngineService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Session transcript endpoints: append, read, export and import.
 */
@RestController
@RequestMapping("/conversation")
@RequiredArgsConstructor
@Slf4j
public class ConversationController {

    private final TruthEngineService engine;

    @PostMapping("/add")
    public Mono<ResponseEntity<OperationResponse>> add(
            @RequestBody(required = false) AddExchangeRequest request,
            @RequestParam(required = false) String sessionId) {
        AddExchangeRequest body = request != null ? request : new AddExchangeRequest();
        String resolvedSessionId = TruthController.resolveSessionId(sessionId);
        return Mono.fromCallable(() -> {
            EngineFailureException.unwrap(
                    engine.appendExchange(resolvedSessionId, body.getQuery(), body.getAnswer()));
            return ResponseEntity.ok(OperationResponse.ok(null));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/history")
    public Mono<ResponseEntity<SessionRecord>> history(@RequestParam(required = false) String sessionId) {
        String resolvedSessionId = TruthController.resolveSessionId(sessionId);
        return Mono.fromCallable(() -> ResponseEntity.ok(
                EngineFailureException.unwrap(engine.history(resolvedSessionId))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/export")
    public Mono<ResponseEntity<String>> export(@RequestParam(required = false) String sessionId) {
        String resolvedSessionId = TruthController.resolveSessionId(sessionId);
        return Mono.fromCallable(() -> {
            String json = EngineFailureException.unwrap(engine.exportSession(resolvedSessionId));
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setContentDisposition(ContentDisposition.attachment()
                    .filename("session-" + resolvedSessionId + ".json")
                    .build());
            return ResponseEntity.ok().headers(headers).body(json);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping(value = "/import", consumes = MediaType.ALL_VALUE)
    public Mono<ResponseEntity<OperationResponse>> importSession(
            @RequestBody(required = false) String data,
            @RequestParam(required = false) String sessionId) {
        String resolvedSessionId = TruthController.resolveSessionId(sessionId);
        return Mono.fromCallable(() -> {
            SessionRecord imported = EngineFailureException.unwrap(engine.importSession(resolvedSessionId, data));
            log.info("[API] Imported {} messages into session {}", imported.getMessages().size(),
                    resolvedSessionId);
            return ResponseEntity.ok(OperationResponse.ok("Import successful"));
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
