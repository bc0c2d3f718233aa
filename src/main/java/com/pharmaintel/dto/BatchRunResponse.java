package com.pharmaintel.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class BatchRunResponse {
    UUID runId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    Summary summary;
    List<ItemRunResult> items;

    @Value
    @Builder
    public static class Summary {
        int items;
        int succeeded;
        int insufficientData;
        int failed;
        int reorders;
        int highRiskBatches;
        int anomalies;
    }
}
