package com.sandy.adpulse.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle of an ActiveAlert. Transitions only move forward. */
public enum AlertStatus {
    ACTIVE("active"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved");

    private final String code;

    AlertStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AlertStatus fromCode(String code) {
        for (AlertStatus v : values()) {
            if (v.code.equalsIgnoreCase(code) || v.name().equalsIgnoreCase(code)) return v;
        }
        throw new IllegalArgumentException("Unknown AlertStatus: " + code);
    }
}
