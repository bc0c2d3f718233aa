package com.pharmaintel.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConsumptionShift {

    public enum Direction { INCREASE, DECREASE }

    String itemId;
    Direction direction;
    int window;
    double previousMean;
    double recentMean;
    double changeRatio;
}
