package com.pharmaintel.exception;

public class ComputationException extends InventoryIntelligenceException {
    public ComputationException(String message) {
        super("COMPUTATION_ERROR", message);
    }
    public ComputationException(String message, Throwable cause) {
        super("COMPUTATION_ERROR", message, cause);
    }
}
