package me.golemcore.veritas.adapter.inbound.web;

import me.golemcore.veritas.domain.model.FailureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapValidationAndParseToBadRequest() {
        StepVerifier.create(handler.handleEngineFailure(
                new EngineFailureException(FailureKind.VALIDATION, "Query is required")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.BAD_REQUEST, resp.getStatusCode());
                    assertEquals(400, resp.getBody().getStatus());
                    assertEquals("VALIDATION", resp.getBody().getKind());
                    assertEquals("Query is required", resp.getBody().getMessage());
                })
                .verifyComplete();

        StepVerifier.create(handler.handleEngineFailure(
                new EngineFailureException(FailureKind.PARSE, "Invalid JSON format")))
                .assertNext(resp -> assertEquals(HttpStatus.BAD_REQUEST, resp.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldMapProviderToBadGateway() {
        StepVerifier.create(handler.handleEngineFailure(new EngineFailureException(FailureKind.PROVIDER, "down")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.BAD_GATEWAY, resp.getStatusCode());
                    assertEquals("PROVIDER", resp.getBody().getKind());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapStoreAndInternalToServerError() {
        StepVerifier.create(handler.handleEngineFailure(new EngineFailureException(FailureKind.STORE, "disk")))
                .assertNext(resp -> assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, resp.getStatusCode()))
                .verifyComplete();
        StepVerifier.create(handler.handleEngineFailure(new EngineFailureException(FailureKind.INTERNAL, "bug")))
                .assertNext(resp -> assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, resp.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldKeepResponseStatusReason() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.NOT_FOUND, "missing")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.NOT_FOUND, resp.getStatusCode());
                    assertEquals("missing", resp.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("secret")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, resp.getStatusCode());
                    assertEquals("Internal server error", resp.getBody().getMessage());
                })
                .verifyComplete();
    }
}
