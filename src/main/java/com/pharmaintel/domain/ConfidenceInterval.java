package com.pharmaintel.domain;

public record ConfidenceInterval(double low, double high) {}
