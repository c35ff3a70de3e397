package com.sandy.adpulse.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum InsightType {
    RECURRING_ANOMALY("recurring_anomaly"),
    PERFORMANCE_CORRELATION("performance_correlation"),
    SEASONAL_PATTERN("seasonal_pattern"),
    CAMPAIGN_INTERFERENCE("campaign_interference");

    private final String code;

    InsightType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static InsightType fromCode(String code) {
        for (InsightType v : values()) {
            if (v.code.equalsIgnoreCase(code) || v.name().equalsIgnoreCase(code)) return v;
        }
        throw new IllegalArgumentException("Unknown InsightType: " + code);
    }
}
