package com.pharmaintel.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AbcClassification {

    public enum AbcClass { A, B, C }

    String itemId;
    double inventoryValue;
    double cumulativeShare;
    AbcClass abcClass;
}
