package com.pharmaintel.dto;

import com.pharmaintel.domain.InventoryState;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class AbcRequest {

    @NotEmpty(message = "states must not be empty")
    List<@Valid InventoryState> states;
}
