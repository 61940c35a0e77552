package com.agentpipeline.orchestrator.strategist;

import com.agentpipeline.common.aggregation.AggregationOutcome;
import com.agentpipeline.common.aggregation.MatrixEvaluation;
import com.agentpipeline.common.model.AgentResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link NarrativeGenerator} backed by the Anthropic Messages API.
 *
 * <p><strong>Reactive contract</strong>: fully non-blocking. The HTTP call is composed as a
 * {@code Mono} chain with a hard timeout. When no API key is configured the generator reports
 * itself unavailable by returning an empty {@code Mono}; transport and parsing failures are
 * propagated as errors for the caller to fall back on.
 */
@Service
public class AnthropicNarrativeGenerator implements NarrativeGenerator {

    private static final Logger log = LoggerFactory.getLogger(AnthropicNarrativeGenerator.class);

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.model:claude-3-5-haiku-latest}")
    private String model;

    @Value("${anthropic.max-tokens:1500}")
    private int maxTokens;

    @Value("${anthropic.timeout-ms:8000}")
    private long timeoutMs;

    public AnthropicNarrativeGenerator(WebClient anthropicWebClient, ObjectMapper objectMapper) {
        this.anthropicClient = anthropicWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<String> generate(AggregationOutcome outcome, String instructions) {
        if (anthropicApiKey == null || anthropicApiKey.isBlank()) {
            log.debug("[Narrative] No Anthropic API key configured, narrative generation disabled.");
            return Mono.empty();
        }
        return Mono.fromCallable(() -> buildPrompt(outcome))
            .flatMap(prompt -> callAnthropicApi(prompt, instructions))
            .map(String::trim)
            .filter(text -> !text.isEmpty())
            .doOnNext(text -> log.info("[Narrative] Report generated. verdict={} length={}",
                outcome.verdict(), text.length()));
    }

    // ── prompt construction ───────────────────────────────────────────────────

    private String buildPrompt(AggregationOutcome outcome) throws Exception {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("verdict", outcome.verdict().name());
        data.put("category", outcome.finalCategory());
        MatrixEvaluation matrix = outcome.matrixEvaluation();
        data.put("effectiveAge", matrix != null ? matrix.effectiveAge() : null);
        data.put("conditionScore", matrix != null ? matrix.conditionScore() : null);
        data.put("totalWarnings", outcome.totalWarnings());
        data.put("hasFail", outcome.hasFail());

        Map<String, Object> checks = new LinkedHashMap<>();
        for (Map.Entry<String, AgentResult> entry : outcome.findings().entrySet()) {
            AgentResult r = entry.getValue();
            if (r == null) {
                continue;
            }
            Map<String, Object> check = new LinkedHashMap<>();
            check.put("status", r.status().name());
            check.put("summary", r.summary());
            check.put("warnings", r.warnings());
            check.put("errors", r.errors());
            checks.put(entry.getKey(), check);
        }
        data.put("checks", checks);

        return "Write a short report based on this data:\n\n"
            + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
    }

    // ── Anthropic call ────────────────────────────────────────────────────────

    private Mono<String> callAnthropicApi(String prompt, String instructions) {
        Map<String, Object> requestBody = new LinkedHashMap<>();
        requestBody.put("model", model);
        requestBody.put("max_tokens", maxTokens);
        if (instructions != null && !instructions.isBlank()) {
            requestBody.put("system", instructions);
        }
        requestBody.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", anthropicApiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMs))
            )
            .map(this::extractText);
    }

    private String extractText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            return root.path("content").get(0).path("text").asText();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to extract text from Anthropic response", e);
        }
    }
}
