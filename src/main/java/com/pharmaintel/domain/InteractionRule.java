package com.pharmaintel.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class InteractionRule {

    @NotBlank(message = "drugA is required")
    String drugA;

    @NotBlank(message = "drugB is required")
    String drugB;

    @NotNull(message = "severity is required")
    InteractionSeverity severity;

    String description;

    String management;

    @Builder.Default
    List<String> substituteSuggestions = List.of();
}
