package com.govsentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsentinel.core.store.JsonMappers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link HealthServer}.
 */
class HealthServerTest {

    private final ObjectMapper mapper = JsonMappers.create();
    private final MonitorSupervisor supervisor = new MonitorSupervisor();
    private final HealthServer server = new HealthServer(supervisor, mapper);

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + server.getPort() + path))
                .GET()
                .build();
        return HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Should answer UP on /health and /readiness when nothing has failed")
    void shouldReportUp() throws Exception {
        server.start(0);

        assertThat(server.isRunning()).isTrue();
        for (String path : List.of("/health", "/readiness")) {
            HttpResponse<String> response = get(path);
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(response.body()).path("status").asText()).isEqualTo("UP");
        }
    }

    @Test
    @DisplayName("Should answer 503 once every source has failed")
    void shouldReportDownWhenAllSourcesFailed() throws Exception {
        supervisor.registerFailure("snapshot", "SLACK_BOT_TOKEN is not set");
        server.start(0);

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(503);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.path("status").asText()).isEqualTo("DOWN");
        assertThat(body.path("sources").get(0).path("name").asText()).isEqualTo("snapshot");
        assertThat(body.path("sources").get(0).path("error").asText()).contains("SLACK_BOT_TOKEN");
    }

    @Test
    @DisplayName("Should render pass timestamps as ISO-8601 and omit absent fields")
    void shouldRenderSourceStatus() throws Exception {
        SourceStatus status = new SourceStatus("snapshot", "SLEEPING", 3,
                Instant.parse("2024-06-01T12:00:00Z"), null, false, null);

        JsonNode source = mapper.readTree(server.render(true, List.of(status))).path("sources").get(0);

        assertThat(source.path("lastPassAt").asText()).isEqualTo("2024-06-01T12:00:00Z");
        assertThat(source.path("passes").asLong()).isEqualTo(3);
        assertThat(source.has("error")).isFalse();
        assertThat(source.has("notificationsSent")).isFalse();
    }

    @Test
    @DisplayName("Should not be running before start")
    void shouldNotRunBeforeStart() {
        assertThat(server.isRunning()).isFalse();
        assertThat(server.getPort()).isEqualTo(-1);
    }
}
