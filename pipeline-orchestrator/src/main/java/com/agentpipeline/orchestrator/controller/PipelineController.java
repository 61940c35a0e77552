package com.agentpipeline.orchestrator.controller;

import com.agentpipeline.common.event.PipelineEvent;
import com.agentpipeline.common.exception.PipelineStateException;
import com.agentpipeline.common.model.PipelineInput;
import com.agentpipeline.common.model.PipelineResult;
import com.agentpipeline.orchestrator.service.PipelineService;
import com.agentpipeline.orchestrator.service.SessionNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private final PipelineService pipelineService;

    public PipelineController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @PostMapping("/sessions")
    public ResponseEntity<Map<String, String>> createSession(@RequestBody PipelineInput input) {
        String sessionId = pipelineService.createSession(input).sessionId();
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("sessionId", sessionId));
    }

    @PostMapping("/start/{sessionId}")
    public Mono<ResponseEntity<PipelineResult>> start(
            @PathVariable String sessionId,
            @RequestBody(required = false) Map<String, String> customPrompts) {
        return pipelineService.start(sessionId, customPrompts).map(ResponseEntity::ok);
    }

    /** Final result once completed, the live state while running, 404 before the start. */
    @GetMapping("/results/{sessionId}")
    public ResponseEntity<Object> results(@PathVariable String sessionId) {
        return pipelineService.result(sessionId)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .or(() -> pipelineService.state(sessionId).map(ResponseEntity::ok))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/state/{sessionId}")
    public ResponseEntity<Object> state(@PathVariable String sessionId) {
        return pipelineService.state(sessionId)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/agent/prompt/{sessionId}/{agentName}")
    public ResponseEntity<Map<String, String>> overridePrompt(
            @PathVariable String sessionId,
            @PathVariable String agentName,
            @RequestBody Map<String, String> body) {
        String prompt = body.get("systemPrompt");
        if (prompt == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "systemPrompt is required"));
        }
        if (!pipelineService.overridePrompt(sessionId, agentName, prompt)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "Unknown agent: " + agentName));
        }
        return ResponseEntity.ok(Map.of("status", "ok", "agent", agentName));
    }

    @PostMapping("/cancel/{sessionId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String sessionId) {
        return ResponseEntity.ok(Map.of("cancelled", pipelineService.cancel(sessionId)));
    }

    @GetMapping(value = "/stream/{sessionId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<PipelineEvent>> stream(@PathVariable String sessionId) {
        return pipelineService.events(sessionId)
            .map(event -> ServerSentEvent.<PipelineEvent>builder(event).event(event.type()).build());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, String>> sessionNotFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(PipelineStateException.class)
    public ResponseEntity<Map<String, String>> illegalState(PipelineStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }
}
