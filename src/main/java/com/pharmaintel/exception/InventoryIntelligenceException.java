package com.pharmaintel.exception;

import lombok.Getter;

@Getter
public abstract class InventoryIntelligenceException extends RuntimeException {
    private final String errorCode;
    protected InventoryIntelligenceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected InventoryIntelligenceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
