package com.pharmaintel.dto;

public enum ItemRunStatus {
    OK,
    INSUFFICIENT_DATA,
    FAILED
}
