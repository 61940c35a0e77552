package com.agentpipeline.orchestrator;

import com.agentpipeline.common.model.ConditionReport;
import com.agentpipeline.common.model.Defect;
import com.agentpipeline.common.model.DefectSeverity;
import com.agentpipeline.common.model.ImageCategory;
import com.agentpipeline.common.model.ImageDescriptor;
import com.agentpipeline.common.model.PipelineInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full run over HTTP with the bundled agents and narrative generation disabled.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {"anthropic.api-key=", "pipeline.reference-year=2026"})
class PipelineOrchestratorApplicationTest {

    private static final String BASE = "/api/v1/pipeline";
    private static final double LAT = 50.0755;
    private static final double LON = 14.4378;

    @Autowired WebTestClient client;

    private static PipelineInput house(List<Defect> defects) {
        Instant taken = Instant.now().minus(Duration.ofDays(5));
        ImageCategory[][] categories = {
            {ImageCategory.EXTERIOR_FRONT}, {ImageCategory.EXTERIOR_REAR}, {ImageCategory.EXTERIOR_SIDE},
            {ImageCategory.INTERIOR_KITCHEN}, {ImageCategory.INTERIOR_LIVING_ROOM}, {ImageCategory.INTERIOR_BEDROOM},
            {ImageCategory.INTERIOR_BATHROOM}, {ImageCategory.SURROUNDINGS}, {ImageCategory.EXTERIOR_DETAIL}
        };
        List<ImageDescriptor> images = new ArrayList<>();
        for (int i = 0; i < categories.length; i++) {
            images.add(new ImageDescriptor("img-" + i, "img-" + i + ".jpg", List.of(categories[i]),
                LAT + i * 0.0001, LON, taken));
        }
        return new PipelineInput(images, 2016, null, "Main Street 1", LAT, LON,
            new ConditionReport(25, defects), Map.of());
    }

    private String createSession(PipelineInput input) {
        Map<String, String> created = client.post().uri(BASE + "/sessions")
            .bodyValue(input)
            .exchange()
            .expectStatus().isCreated()
            .expectBody(new ParameterizedTypeReference<Map<String, String>>() {})
            .returnResult().getResponseBody();
        return created.get("sessionId");
    }

    @Test
    @DisplayName("complete, recent, sound house → ONLINE, category 2")
    void onlineRun() {
        String sessionId = createSession(house(List.of()));

        client.post().uri(BASE + "/start/" + sessionId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.verdict").isEqualTo("ONLINE")
            .jsonPath("$.verdictColor").isEqualTo("green")
            .jsonPath("$.verdictCategory").isEqualTo(2)
            .jsonPath("$.totalWarnings").isEqualTo(0)
            .jsonPath("$.agents.Guardian.status").isEqualTo("SUCCESS")
            .jsonPath("$.agents.GeoValidator.status").isEqualTo("SUCCESS")
            .jsonPath("$.agents.Strategist.status").isEqualTo("SUCCESS");

        client.get().uri(BASE + "/results/" + sessionId)
            .exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.verdict").isEqualTo("ONLINE");
        client.post().uri(BASE + "/start/" + sessionId)
            .exchange()
            .expectStatus().isEqualTo(409);
    }

    @Test
    @DisplayName("critical defect → RETURN with the worst category")
    void criticalDefect() {
        String sessionId = createSession(house(List.of(
            new Defect("diagonal crack in load-bearing wall", DefectSeverity.CRITICAL))));

        client.post().uri(BASE + "/start/" + sessionId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.verdict").isEqualTo("RETURN")
            .jsonPath("$.verdictColor").isEqualTo("red")
            .jsonPath("$.verdictCategory").isEqualTo(5)
            .jsonPath("$.agents.Inspector.status").isEqualTo("FAIL");
    }

    @Test
    @DisplayName("staged prompt is visible in the agent snapshot")
    void stagedPrompt() {
        String sessionId = createSession(house(List.of()));
        client.post().uri(BASE + "/agent/prompt/" + sessionId + "/Historian")
            .bodyValue(Map.of("systemPrompt", "Use the cadastral year."))
            .exchange()
            .expectStatus().isOk();

        client.post().uri(BASE + "/start/" + sessionId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.agents.Historian.systemPrompt").isEqualTo("Use the cadastral year.");
    }

    @Test
    @DisplayName("unknown session → 404")
    void unknownSession() {
        client.post().uri(BASE + "/start/missing").exchange().expectStatus().isNotFound();
        assertNotNull(client.get().uri(BASE + "/health").exchange()
            .expectStatus().isOk().expectBody(String.class).returnResult().getResponseBody());
    }
}
