package com.ridershipforecast.controller;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ForecastControllerIntegrationTest {

    @Autowired TestRestTemplate restTemplate;

    private HttpEntity<Map<String, Object>> json(Map<String, Object> body, String requestId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (requestId != null) {
            headers.set("X-Request-ID", requestId);
        }
        return new HttpEntity<>(body, headers);
    }

    @Test
    void syncRun_forecastsKnownServiceAndSkipsUnknownOne() {
        Map<String, Object> body = Map.of(
            "services", List.of("Local Route", "Nope"),
            "runDate", "2024-05-01");

        ResponseEntity<JsonNode> response = restTemplate.postForEntity(
            "/api/v1/forecast-runs/sync", json(body, "sync-1"), JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getHeaders().getFirst("X-Request-ID")).isEqualTo("sync-1");
        JsonNode run = response.getBody();
        assertThat(run.get("runDate").asText()).isEqualTo("2024-05-01");
        assertThat(run.get("requested").asInt()).isEqualTo(2);
        assertThat(run.get("forecasted").asInt()).isEqualTo(1);
        assertThat(run.get("skipped").asInt()).isEqualTo(1);
        assertThat(run.get("results").get(1).get("skip_reason").asText()).isEqualTo("DATA_ERROR");

        ResponseEntity<JsonNode> stored = restTemplate.getForEntity(
            "/api/v1/results/2024-05-01/Local Route", JsonNode.class);
        assertThat(stored.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode record = stored.getBody();
        assertThat(record.get("status").asText()).isEqualTo("FORECAST");
        assertThat(record.get("forecast_values").size()).isEqualTo(7);
        assertThat(record.get("forecast_dates").get(0).asText()).isEqualTo("2023-05-01");
        assertThat(record.get("mae").asDouble()).isGreaterThanOrEqualTo(0.0);
        assertThat(record.get("rmse").asDouble()).isGreaterThanOrEqualTo(record.get("mae").asDouble());
        assertThat(record.has("mape")).isTrue();
    }

    @Test
    void asyncRun_acceptedAndCompletes() throws InterruptedException {
        ResponseEntity<JsonNode> accepted = restTemplate.postForEntity("/api/v1/forecast-runs",
            json(Map.of("services", List.of("School"), "runDate", "2024-05-02"), "async-1"), JsonNode.class);

        assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(accepted.getHeaders().getLocation()).isNotNull();
        assertThat(accepted.getBody().get("requestId").asText()).isEqualTo("async-1");
        String location = accepted.getHeaders().getLocation().toString();

        JsonNode job = null;
        for (int i = 0; i < 400; i++) {
            job = restTemplate.getForEntity(location, JsonNode.class).getBody();
            String status = job.get("status").asText();
            if (status.equals("COMPLETED") || status.equals("FAILED")) {
                break;
            }
            Thread.sleep(50);
        }
        assertThat(job.get("status").asText()).isEqualTo("COMPLETED");
        assertThat(job.get("progressPercent").asInt()).isEqualTo(100);
        assertThat(job.get("result").get("requested").asInt()).isEqualTo(1);
    }

    @Test
    void unknownDataset_returns400() {
        ResponseEntity<JsonNode> response = restTemplate.postForEntity("/api/v1/forecast-runs/sync",
            json(Map.of("datasetPath", "does/not/exist.csv"), null), JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().get("errorCode").asText()).isEqualTo("DATA_ERROR");
        assertThat(response.getBody().get("message").asText()).contains("exist.csv");
    }

    @Test
    void datasetOutsideDataRoot_rejectedWithoutLeakingContent() {
        for (String path : List.of("/etc/passwd", "../../../pom.xml")) {
            ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/forecast-runs/sync",
                json(Map.of("datasetPath", path), null), String.class);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(response.getBody())
                .contains("DATA_ERROR")
                .contains("inside the data directory")
                .doesNotContain("root:")
                .doesNotContain("<project");
        }
    }

    @Test
    void blankServiceName_returns422() {
        ResponseEntity<JsonNode> response = restTemplate.postForEntity("/api/v1/forecast-runs/sync",
            json(Map.of("services", List.of(" ")), null), JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().get("fieldErrors")).isNotEmpty();
    }

    @Test
    void unknownJob_returns404() {
        ResponseEntity<JsonNode> response = restTemplate.getForEntity(
            "/api/v1/jobs/" + UUID.randomUUID(), JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().get("errorCode").asText()).isEqualTo("JOB_NOT_FOUND");
    }

    @Test
    void malformedJobId_returns400() {
        ResponseEntity<JsonNode> response = restTemplate.getForEntity("/api/v1/jobs/not-a-uuid", JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void unknownResult_returns404() {
        ResponseEntity<JsonNode> response = restTemplate.getForEntity(
            "/api/v1/results/1999-01-01/Local Route", JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().get("errorCode").asText()).isEqualTo("RESULT_NOT_FOUND");
    }
}
