package com.pharmaintel.controller;

import com.pharmaintel.config.RequestIdFilter;
import com.pharmaintel.dto.AsyncJobResponse;
import com.pharmaintel.dto.BatchRunRequest;
import com.pharmaintel.dto.BatchRunResponse;
import com.pharmaintel.dto.CacheStatsResponse;
import com.pharmaintel.service.AsyncJobService;
import com.pharmaintel.service.ForecastCache;
import com.pharmaintel.service.InventoryRunService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RunController {

    private final InventoryRunService runService;
    private final AsyncJobService asyncJobService;
    private final ForecastCache forecastCache;

    @PostMapping("/runs")
    public ResponseEntity<BatchRunResponse> run(@Valid @RequestBody BatchRunRequest request) {
        log.info("POST /runs | inventory={} | records={}", request.getInventory().size(), request.getRecords().size());
        return ResponseEntity.ok(runService.run(request));
    }

    @PostMapping("/runs/async")
    public ResponseEntity<AsyncJobResponse> runAsync(
            @Valid @RequestBody BatchRunRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        UUID jobId = asyncJobService.submit("INVENTORY_RUN", requestId, progress -> runService.run(request, progress));
        return ResponseEntity.accepted()
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @GetMapping("/cache/forecasts")
    public ResponseEntity<CacheStatsResponse> cacheStats() {
        return ResponseEntity.ok(forecastCache.stats());
    }

    @DeleteMapping("/cache/forecasts")
    public ResponseEntity<Void> clearCache(@RequestParam(required = false) String itemId) {
        if (itemId != null && !itemId.isBlank()) {
            forecastCache.invalidate(itemId);
        } else {
            forecastCache.clear();
        }
        return ResponseEntity.noContent().build();
    }

    private String resolveRequestId(HttpServletRequest request) {
        Object attribute = request.getAttribute(RequestIdFilter.MDC_KEY);
        return attribute != null ? attribute.toString() : UUID.randomUUID().toString();
    }
}
