package com.sandy.adpulse.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Shape of a detected deviation. */
public enum AnomalyType {
    SPIKE("spike"),
    DROP("drop"),
    TREND_CHANGE("trend_change"),
    SEASONAL_DEVIATION("seasonal_deviation"),
    OUTLIER("outlier");

    private final String code;

    AnomalyType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AnomalyType fromCode(String code) {
        for (AnomalyType v : values()) {
            if (v.code.equalsIgnoreCase(code) || v.name().equalsIgnoreCase(code)) return v;
        }
        throw new IllegalArgumentException("Unknown AnomalyType: " + code);
    }
}
