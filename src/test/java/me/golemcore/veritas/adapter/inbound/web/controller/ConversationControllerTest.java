package me.golemcore.veritas.adapter.inbound.web.controller;

import me.golemcore.veritas.adapter.inbound.web.EngineFailureException;
import me.golemcore.veritas.adapter.inbound.web.dto.AddExchangeRequest;
import me.golemcore.veritas.domain.model.EngineResult;
import me.golemcore.veritas.domain.model.FailureKind;
import me.golemcore.veritas.domain.model.SessionRecord;
import me.golemcore.veritas.domain.service.TruthEngineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationControllerTest {

    private TruthEngineService engine;
    private ConversationController controller;

    @BeforeEach
    void setUp() {
        engine = mock(TruthEngineService.class);
        controller = new ConversationController(engine);
    }

    @Test
    void addShouldAppendExchange() {
        when(engine.appendExchange("s1", "q", "a")).thenReturn(EngineResult.success(null));

        StepVerifier.create(controller.add(new AddExchangeRequest("q", "a"), "s1"))
                .assertNext(resp -> assertTrue(resp.getBody().isSuccess()))
                .verifyComplete();
        verify(engine).appendExchange("s1", "q", "a");
    }

    @Test
    void historyShouldReturnSessionRecord() {
        SessionRecord record = SessionRecord.empty("s1", Instant.parse("2026-03-01T10:00:00Z"));
        when(engine.history("s1")).thenReturn(EngineResult.success(record));

        StepVerifier.create(controller.history("s1"))
                .assertNext(resp -> assertEquals(record, resp.getBody()))
                .verifyComplete();
    }

    @Test
    void exportShouldReturnJsonAttachment() {
        when(engine.exportSession("s1")).thenReturn(EngineResult.success("{\"sessionId\":\"s1\"}"));

        StepVerifier.create(controller.export("s1"))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertEquals(MediaType.APPLICATION_JSON, resp.getHeaders().getContentType());
                    String disposition = resp.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION);
                    assertTrue(disposition.startsWith("attachment"));
                    assertTrue(disposition.contains("session-s1.json"));
                    assertEquals("{\"sessionId\":\"s1\"}", resp.getBody());
                })
                .verifyComplete();
    }

    @Test
    void importShouldReportSuccess() {
        when(engine.importSession("s1", "{}")).thenReturn(EngineResult.success(SessionRecord.empty("s1", null)));

        StepVerifier.create(controller.importSession("{}", "s1"))
                .assertNext(resp -> assertEquals("Import successful", resp.getBody().getMessage()))
                .verifyComplete();
    }

    @Test
    void importShouldSurfaceSessionMismatch() {
        when(engine.importSession("s1", "{\"sessionId\":\"s2\"}"))
                .thenReturn(EngineResult.validation("Invalid session ID"));

        StepVerifier.create(controller.importSession("{\"sessionId\":\"s2\"}", "s1"))
                .expectErrorSatisfies(error -> {
                    EngineFailureException failure = (EngineFailureException) error;
                    assertEquals(FailureKind.VALIDATION, failure.getKind());
                    assertEquals("Invalid session ID", failure.getMessage());
                })
                .verify();
    }

    @Test
    void importShouldSurfaceParseError() {
        when(engine.importSession("s1", "nope")).thenReturn(EngineResult.failure(FailureKind.PARSE,
                "Invalid JSON format"));

        StepVerifier.create(controller.importSession("nope", "s1"))
                .expectErrorSatisfies(error -> assertEquals(HttpStatus.BAD_REQUEST,
                        ((EngineFailureException) error).httpStatus()))
                .verify();
    }
}
