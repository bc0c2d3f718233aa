package com.pharmaintel.exception;

public class InvalidEngineInputException extends InventoryIntelligenceException {
    public InvalidEngineInputException(String message) {
        super("ENGINE_INPUT_ERROR", message);
    }
}
