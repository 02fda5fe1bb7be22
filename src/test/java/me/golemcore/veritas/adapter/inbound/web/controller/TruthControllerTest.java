package me.golemcore.veritas.adapter.inbound.web.controller;

import me.golemcore.veritas.adapter.inbound.web.EngineFailureException;
import me.golemcore.veritas.adapter.inbound.web.dto.LoadRequest;
import me.golemcore.veritas.adapter.inbound.web.dto.QueryRequest;
import me.golemcore.veritas.adapter.inbound.web.dto.SaveRequest;
import me.golemcore.veritas.domain.model.AnswerSource;
import me.golemcore.veritas.domain.model.EngineResult;
import me.golemcore.veritas.domain.model.FailureKind;
import me.golemcore.veritas.domain.model.QueryAnswer;
import me.golemcore.veritas.domain.model.TopQuery;
import me.golemcore.veritas.domain.service.TruthEngineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TruthControllerTest {

    private TruthEngineService engine;
    private TruthController controller;

    @BeforeEach
    void setUp() {
        engine = mock(TruthEngineService.class);
        controller = new TruthController(engine);
    }

    @Test
    void loadShouldReturnAnswer() {
        when(engine.load("What is truth?")).thenReturn(EngineResult.success("42"));

        StepVerifier.create(controller.load(new LoadRequest("What is truth?")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertNotNull(resp.getBody());
                    assertEquals("42", resp.getBody().getAnswer());
                })
                .verifyComplete();
    }

    @Test
    void loadShouldReturnNullAnswerWhenUnknown() {
        when(engine.load("unknown")).thenReturn(EngineResult.success(null));

        StepVerifier.create(controller.load(new LoadRequest("unknown")))
                .assertNext(resp -> assertNull(resp.getBody().getAnswer()))
                .verifyComplete();
    }

    @Test
    void loadShouldSurfaceValidationFailure() {
        when(engine.load(null)).thenReturn(EngineResult.validation("Query is required"));

        StepVerifier.create(controller.load(null))
                .expectErrorSatisfies(error -> {
                    EngineFailureException failure = assertInstanceOf(EngineFailureException.class, error);
                    assertEquals(FailureKind.VALIDATION, failure.getKind());
                    assertEquals(HttpStatus.BAD_REQUEST, failure.httpStatus());
                })
                .verify();
    }

    @Test
    void saveShouldUseGivenSessionId() {
        when(engine.save(eq("s1"), eq("q"), eq("a"), eq("alice"))).thenReturn(EngineResult.success("q"));

        StepVerifier.create(controller.save(new SaveRequest("q", "a", "alice"), "s1"))
                .assertNext(resp -> {
                    assertTrue(resp.getBody().isSuccess());
                    assertEquals("Saved successfully", resp.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void queryShouldGenerateSessionIdWhenMissing() {
        when(engine.query(anyString(), eq("hello"), eq(true))).thenAnswer(invocation -> EngineResult.success(
                QueryAnswer.builder()
                        .answer("hi")
                        .sessionId(invocation.getArgument(0))
                        .source(AnswerSource.MODEL)
                        .build()));

        StepVerifier.create(controller.query(new QueryRequest("hello", true), null))
                .assertNext(resp -> {
                    assertEquals("hi", resp.getBody().getAnswer());
                    assertNotNull(resp.getBody().getSessionId());
                    assertFalse(resp.getBody().getSessionId().isBlank());
                    assertEquals("model", resp.getBody().getSource());
                })
                .verifyComplete();

        ArgumentCaptor<String> sessionId = ArgumentCaptor.forClass(String.class);
        verify(engine).query(sessionId.capture(), eq("hello"), eq(true));
        assertEquals(36, sessionId.getValue().length());
    }

    @Test
    void queryShouldMapProviderFailureToBadGateway() {
        when(engine.query(any(), any(), anyBoolean()))
                .thenReturn(EngineResult.failure(FailureKind.PROVIDER, "Model provider timed out after 60s"));

        StepVerifier.create(controller.query(new QueryRequest("hello", false), "s1"))
                .expectErrorSatisfies(error -> assertEquals(HttpStatus.BAD_GATEWAY,
                        ((EngineFailureException) error).httpStatus()))
                .verify();
    }

    @Test
    void queryShouldReportSourceIndependentOfDefaultLocale() {
        when(engine.query(any(), any(), anyBoolean())).thenReturn(EngineResult.success(
                QueryAnswer.builder().answer("42").sessionId("s1").source(AnswerSource.CANONICAL).build()));
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            StepVerifier.create(controller.query(new QueryRequest("hello", false), "s1"))
                    .assertNext(resp -> assertEquals("canonical", resp.getBody().getSource()))
                    .verifyComplete();
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void topQueriesShouldReturnRanking() {
        List<TopQuery> top = List.of(TopQuery.builder().query("a").count(3).build());
        when(engine.topQueries()).thenReturn(EngineResult.success(top));
        when(engine.topQueries(1)).thenReturn(EngineResult.success(top));

        StepVerifier.create(controller.topQueries(null))
                .assertNext(resp -> assertEquals(top, resp.getBody()))
                .verifyComplete();
        StepVerifier.create(controller.topQueries(1))
                .assertNext(resp -> assertEquals(1, resp.getBody().size()))
                .verifyComplete();
    }

    @Test
    void resolveSessionIdShouldKeepProvidedValue() {
        assertEquals("abc", TruthController.resolveSessionId("abc"));
        assertNotNull(TruthController.resolveSessionId(" "));
    }
}
