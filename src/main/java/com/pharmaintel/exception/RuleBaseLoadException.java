package com.pharmaintel.exception;

public class RuleBaseLoadException extends InventoryIntelligenceException {
    public RuleBaseLoadException(String location, Throwable cause) {
        super("RULE_BASE_LOAD_ERROR",
              "Interaction rule base could not be loaded from '" + location + "': " + cause.getMessage(),
              cause);
    }
}
