package com.pharmaintel.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum InteractionSeverity {
    NONE,
    MINOR,
    MODERATE,
    SEVERE;

    @JsonCreator
    public static InteractionSeverity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return NONE;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        if ("MILD".equals(normalized)) {
            return MINOR;
        }
        return InteractionSeverity.valueOf(normalized);
    }

    public boolean isAtLeast(InteractionSeverity other) {
        return compareTo(other) >= 0;
    }

    public static InteractionSeverity max(InteractionSeverity a, InteractionSeverity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
