package com.pharmaintel.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class InventoryIntelligenceApiIntegrationTest {

    @Autowired TestRestTemplate restTemplate;

    private static Map<String, Object> series(String itemId, double... values) {
        List<Map<String, Object>> points = new ArrayList<>();
        LocalDate period = LocalDate.of(2024, 1, 1);
        for (double value : values) {
            points.add(Map.of("period", period.toString(), "quantity", value));
            period = period.plusDays(1);
        }
        return Map.of("itemId", itemId, "granularity", "DAY", "points", points);
    }

    private static Map<String, Object> batch(String itemId, double onHand) {
        return Map.of("itemId", itemId, "batchId", itemId + "-1", "quantityOnHand", onHand,
            "unitCost", 1.0, "leadTimeDays", 7);
    }

    @Test
    void checkInteractions_flagsSevereCombinationAndEchoesRequestId() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "trace-42");
        Map<String, Object> body = Map.of("drugNames", List.of("Warfarin 5mg tablet", "aspirin"));

        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/interactions/check", HttpMethod.POST,
            new HttpEntity<>(body, headers), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("trace-42");
        assertThat(resp.getBody().get("overallRisk")).isEqualTo("SEVERE");
        assertThat(resp.getBody().get("safe")).isEqualTo(false);
        assertThat((List<?>) resp.getBody().get("matchedPairs")).isNotEmpty();
    }

    @Test
    void checkInteractions_emptyListReturns422() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/interactions/check",
            Map.of("drugNames", List.of()), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("code")).isEqualTo("VALIDATION_ERROR");
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void forecast_returnsCreatedWithSelectedModel() {
        Map<String, Object> body = Map.of("itemId", "AMOX-500", "horizonPeriods", 7,
            "series", series("AMOX-500", 10, 12, 11, 13, 12, 14, 13, 15, 14, 16, 15, 17));

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/forecasts", body, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(resp.getBody()).containsKeys("modelName", "predictedQuantityPerPeriod", "confidenceInterval");
        assertThat((List<?>) resp.getBody().get("predictions")).hasSize(7);
    }

    @Test
    void forecast_tooShortHistoryReturns422() {
        Map<String, Object> body = Map.of("itemId", "NEW-1", "horizonPeriods", 7, "series", series("NEW-1", 4, 5));

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/forecasts", body, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("code")).isEqualTo("INSUFFICIENT_DATA");
    }

    @Test
    void reorder_belowReorderPointSuggestsOrder() {
        Map<String, Object> body = Map.of(
            "forecast", Map.of("itemId", "IBU-200", "granularity", "DAY",
                "predictedQuantityPerPeriod", 10.0, "forecastStdDev", 2.0),
            "state", batch("IBU-200", 20),
            "suppliers", List.of(Map.of("supplierId", "S1", "unitCost", 0.9)));

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/reorders", body, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("action")).isEqualTo("REORDER");
        assertThat(((Map<?, ?>) resp.getBody().get("suggestion")).get("supplierId")).isEqualTo("S1");
    }

    @Test
    void jobStatus_unknownJobReturns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/jobs/" + UUID.randomUUID(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody().get("code")).isEqualTo("JOB_NOT_FOUND");
    }

    @Test
    void run_overItemLimitReturns413() {
        List<Map<String, Object>> inventory = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            inventory.add(batch("ITEM-" + i, 10));
        }

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/runs", Map.of("inventory", inventory), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
        assertThat(resp.getBody().get("code")).isEqualTo("BATCH_SIZE_EXCEEDED");
    }

    @Test
    void runAsync_acceptsAndPointsToJob() {
        Map<String, Object> body = Map.of("inventory", List.of(batch("PARA-500", 40)));

        ResponseEntity<Map> created = restTemplate.postForEntity("/api/v1/runs/async", body, Map.class);

        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        String jobId = (String) created.getBody().get("jobId");
        assertThat(created.getHeaders().getLocation()).hasToString("/api/v1/jobs/" + jobId);

        ResponseEntity<Map> job = restTemplate.getForEntity("/api/v1/jobs/" + jobId, Map.class);
        assertThat(job.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(job.getBody()).containsKeys("status", "jobType");
    }
}
