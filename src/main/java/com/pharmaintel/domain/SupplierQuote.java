package com.pharmaintel.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SupplierQuote {

    @NotBlank(message = "supplierId is required")
    String supplierId;

    String itemId;

    @DecimalMin(value = "0.0", message = "unitCost must be >= 0")
    double unitCost;

    @DecimalMin(value = "0.0", message = "fixedOrderCost must be >= 0")
    @Builder.Default
    double fixedOrderCost = 0.0;

    @Min(value = 0, message = "leadTimeDays must be >= 0")
    @Builder.Default
    int leadTimeDays = 7;

    @DecimalMin(value = "0.0", message = "minOrderQuantity must be >= 0")
    @Builder.Default
    double minOrderQuantity = 0.0;

    @DecimalMin(value = "0.0", message = "orderMultiple must be >= 0")
    Double orderMultiple;
}
