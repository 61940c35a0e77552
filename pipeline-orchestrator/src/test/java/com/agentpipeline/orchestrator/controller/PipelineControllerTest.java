package com.agentpipeline.orchestrator.controller;

import com.agentpipeline.common.event.PipelineCompleteEvent;
import com.agentpipeline.common.event.PipelineStartEvent;
import com.agentpipeline.common.exception.PipelineStateException;
import com.agentpipeline.common.model.PipelineInput;
import com.agentpipeline.common.model.PipelineResult;
import com.agentpipeline.common.model.PipelineState;
import com.agentpipeline.common.model.Verdict;
import com.agentpipeline.orchestrator.service.PipelineService;
import com.agentpipeline.orchestrator.service.SessionNotFoundException;
import com.agentpipeline.orchestrator.session.PipelineSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = PipelineController.class)
class PipelineControllerTest {

    private static final String BASE = "/api/v1/pipeline";

    @Autowired WebTestClient client;
    @MockBean PipelineService service;

    private static PipelineResult result(String sessionId) {
        return new PipelineResult("p1", sessionId, 1.25, Verdict.SUPERVISED, "orange", 3, 1,
            "Verdict: SUPERVISED", false, Map.of());
    }

    @Test
    @DisplayName("POST /sessions → 201 with the session id")
    void createSession() {
        when(service.createSession(any(PipelineInput.class)))
            .thenReturn(new PipelineSession("s-1", null, Instant.now()));

        client.post().uri(BASE + "/sessions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"images":[{"id":"1","fileName":"a.jpg","categories":["EXTERIOR_FRONT"]}],"yearBuilt":1990}""")
            .exchange()
            .expectStatus().isCreated()
            .expectBody().jsonPath("$.sessionId").isEqualTo("s-1");
    }

    @Test
    @DisplayName("POST /start → final result")
    void start() {
        when(service.start(eq("s-1"), any())).thenReturn(Mono.just(result("s-1")));

        client.post().uri(BASE + "/start/s-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.verdict").isEqualTo("SUPERVISED")
            .jsonPath("$.verdictColor").isEqualTo("orange")
            .jsonPath("$.verdictCategory").isEqualTo(3);
    }

    @Test
    @DisplayName("POST /start on a started session → 409")
    void startConflict() {
        when(service.start(eq("s-1"), anyMap()))
            .thenReturn(Mono.error(new PipelineStateException("p1", "session s-1 has already been started")));

        client.post().uri(BASE + "/start/s-1")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("Guardian", "custom"))
            .exchange()
            .expectStatus().isEqualTo(409);
    }

    @Test
    @DisplayName("GET /results: result, then live state, then 404")
    void results() {
        when(service.result("done")).thenReturn(Optional.of(result("done")));
        when(service.result("running")).thenReturn(Optional.empty());
        when(service.state("running")).thenReturn(Optional.of(new PipelineState("p2", "running", true, false, Map.of())));
        when(service.result("fresh")).thenReturn(Optional.empty());
        when(service.state("fresh")).thenReturn(Optional.empty());

        client.get().uri(BASE + "/results/done").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.totalWarnings").isEqualTo(1);
        client.get().uri(BASE + "/results/running").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.running").isEqualTo(true);
        client.get().uri(BASE + "/results/fresh").exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("unknown session → 404")
    void unknownSession() {
        when(service.state("nope")).thenThrow(new SessionNotFoundException("nope"));

        client.get().uri(BASE + "/state/nope").exchange()
            .expectStatus().isNotFound()
            .expectBody().jsonPath("$.error").isEqualTo("Session not found: nope");
    }

    @Test
    @DisplayName("POST /agent/prompt validates body and agent name")
    void overridePrompt() {
        when(service.overridePrompt("s-1", "Guardian", "be strict")).thenReturn(true);
        when(service.overridePrompt("s-1", "Ghost", "x")).thenReturn(false);

        client.post().uri(BASE + "/agent/prompt/s-1/Guardian")
            .bodyValue(Map.of("systemPrompt", "be strict"))
            .exchange()
            .expectStatus().isOk();
        client.post().uri(BASE + "/agent/prompt/s-1/Guardian")
            .bodyValue(Map.of("prompt", "wrong field"))
            .exchange()
            .expectStatus().isBadRequest();
        client.post().uri(BASE + "/agent/prompt/s-1/Ghost")
            .bodyValue(Map.of("systemPrompt", "x"))
            .exchange()
            .expectStatus().isNotFound();

        verify(service).overridePrompt("s-1", "Guardian", "be strict");
    }

    @Test
    @DisplayName("POST /cancel reports whether cancellation took effect")
    void cancel() {
        when(service.cancel("s-1")).thenReturn(true);

        client.post().uri(BASE + "/cancel/s-1").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.cancelled").isEqualTo(true);
    }

    @Test
    @DisplayName("GET /stream emits server-sent events named after the event type")
    void stream() {
        when(service.events("s-1")).thenReturn(Flux.just(
            PipelineStartEvent.of("p1", "s-1", List.of("Guardian", "Strategist")),
            PipelineCompleteEvent.of(result("s-1"))));

        Flux<ServerSentEvent<Map<String, Object>>> body = client.get().uri(BASE + "/stream/s-1")
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus().isOk()
            .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
            .returnResult(new ParameterizedTypeReference<ServerSentEvent<Map<String, Object>>>() {})
            .getResponseBody();

        StepVerifier.create(body)
            .expectNextMatches(e -> PipelineStartEvent.TYPE.equals(e.event())
                && "s-1".equals(e.data().get("sessionId")))
            .expectNextMatches(e -> PipelineCompleteEvent.TYPE.equals(e.event()))
            .verifyComplete();
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        client.get().uri(BASE + "/health").exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
