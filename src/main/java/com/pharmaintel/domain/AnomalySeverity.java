package com.pharmaintel.domain;

public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH
}
