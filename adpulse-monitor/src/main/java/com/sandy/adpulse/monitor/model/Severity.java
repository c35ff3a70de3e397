package com.sandy.adpulse.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity shared by anomalies, thresholds and alerts. Declared in ascending order,
 * so {@link #rank()} can be used for sorting.
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int rank() {
        return ordinal() + 1;
    }

    @JsonCreator
    public static Severity fromCode(String code) {
        for (Severity s : values()) {
            if (s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code)) return s;
        }
        throw new IllegalArgumentException("Unknown severity: " + code);
    }
}
