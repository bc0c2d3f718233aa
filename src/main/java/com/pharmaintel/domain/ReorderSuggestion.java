package com.pharmaintel.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class ReorderSuggestion {

    public static final String NO_SUPPLIER = "none";

    String itemId;
    String supplierId;
    double suggestedQuantity;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate suggestedOrderDate;
    double estimatedCost;
    List<String> rationaleTags;
    double reorderPoint;
    double safetyStock;
    double inventoryPosition;
    Double daysOfCover;
    RiskLevel priority;
    List<SupplierOption> supplierOptions;
}
