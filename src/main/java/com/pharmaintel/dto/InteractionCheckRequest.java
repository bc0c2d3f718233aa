package com.pharmaintel.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class InteractionCheckRequest {

    @NotEmpty(message = "drugNames must not be empty")
    @Size(max = 50, message = "drugNames must contain at most 50 entries")
    List<String> drugNames;
}
