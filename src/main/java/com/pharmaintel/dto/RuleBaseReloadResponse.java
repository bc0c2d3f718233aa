package com.pharmaintel.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RuleBaseReloadResponse {
    String version;
    int rules;
    int drugClasses;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant loadedAt;
}
