package com.pharmaintel.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class InventoryState {

    @NotBlank(message = "itemId is required")
    String itemId;

    String batchId;

    @DecimalMin(value = "0.0", message = "quantityOnHand must be >= 0")
    double quantityOnHand;

    @DecimalMin(value = "0.0", message = "quantityInTransit must be >= 0")
    @Builder.Default
    double quantityInTransit = 0.0;

    @DecimalMin(value = "0.0", message = "unitCost must be >= 0")
    double unitCost;

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate expiryDate;

    @Min(value = 0, message = "leadTimeDays must be >= 0")
    @Builder.Default
    int leadTimeDays = 7;

    String supplierId;

    boolean returnWindowOpen;

    boolean redistributable;
}
