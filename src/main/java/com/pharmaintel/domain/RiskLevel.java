package com.pharmaintel.domain;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
