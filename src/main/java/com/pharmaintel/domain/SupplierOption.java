package com.pharmaintel.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SupplierOption {
    int rank;
    String supplierId;
    double quantity;
    double estimatedCost;
    int leadTimeDays;
}
