package com.agentpipeline.orchestrator.strategist;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.agentpipeline.common.aggregation.AggregationOutcome;
import com.agentpipeline.common.aggregation.VerdictPolicy;
import com.agentpipeline.common.matrix.DecisionMatrix;
import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.AgentStatus;
import com.agentpipeline.orchestrator.agent.AgentNames;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicNarrativeGeneratorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Logger generatorLogger;

    @BeforeEach
    void attachAppender() {
        generatorLogger = (Logger) LoggerFactory.getLogger(AnthropicNarrativeGenerator.class);
        appender.start();
        generatorLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        generatorLogger.detachAppender(appender);
    }

    private AnthropicNarrativeGenerator generator(String apiKey, String replyText) {
        String body = "{\"content\":[{\"type\":\"text\",\"text\":\"" + replyText + "\"}]}";
        WebClient client = WebClient.builder()
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        AnthropicNarrativeGenerator generator = new AnthropicNarrativeGenerator(client, new ObjectMapper());
        ReflectionTestUtils.setField(generator, "anthropicApiKey", apiKey);
        ReflectionTestUtils.setField(generator, "model", "test-model");
        ReflectionTestUtils.setField(generator, "maxTokens", 100);
        ReflectionTestUtils.setField(generator, "timeoutMs", 2000L);
        return generator;
    }

    private static AggregationOutcome outcome() {
        VerdictPolicy policy = new VerdictPolicy(DecisionMatrix.standard(),
            AgentNames.GUARDIAN, AgentNames.HISTORIAN, AgentNames.INSPECTOR, VerdictPolicy.DEFAULT_RETURN_THRESHOLD);
        return policy.evaluate(Map.of(AgentNames.GUARDIAN,
            AgentResult.builder(AgentStatus.SUCCESS).summary("complete").build()));
    }

    private boolean reportLogged() {
        return appender.list.stream().anyMatch(e -> e.getFormattedMessage().contains("Report generated"));
    }

    @Test
    @DisplayName("reply text is trimmed, returned and logged")
    void generatesReport() {
        StepVerifier.create(generator("key", "  All checks passed.  ").generate(outcome(), "Be brief."))
            .expectNext("All checks passed.")
            .expectComplete()
            .verify(TIMEOUT);

        assertEquals(1, requests.size());
        assertEquals("key", requests.get(0).headers().getFirst("x-api-key"));
        assertTrue(reportLogged());
    }

    @Test
    @DisplayName("blank reply → empty and no report logged")
    void blankReply() {
        StepVerifier.create(generator("key", "   ").generate(outcome(), null))
            .expectComplete()
            .verify(TIMEOUT);

        assertEquals(1, requests.size());
        assertFalse(reportLogged());
    }

    @Test
    @DisplayName("no API key → empty without calling the API")
    void noApiKey() {
        StepVerifier.create(generator("", "unused").generate(outcome(), null))
            .expectComplete()
            .verify(TIMEOUT);

        assertTrue(requests.isEmpty());
    }
}
