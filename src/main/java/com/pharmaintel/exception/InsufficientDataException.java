package com.pharmaintel.exception;

import lombok.Getter;

@Getter
public class InsufficientDataException extends InventoryIntelligenceException {
    private final String itemId;
    private final int availablePeriods;
    private final int requiredPeriods;

    public InsufficientDataException(String itemId, int availablePeriods, int requiredPeriods) {
        super("INSUFFICIENT_DATA",
              "Item '" + itemId + "' has " + availablePeriods + " period(s) of history, at least "
                  + requiredPeriods + " required.");
        this.itemId = itemId;
        this.availablePeriods = availablePeriods;
        this.requiredPeriods = requiredPeriods;
    }
}
