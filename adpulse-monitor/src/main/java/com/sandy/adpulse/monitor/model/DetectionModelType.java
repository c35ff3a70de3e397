package com.sandy.adpulse.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Strategy tag of a detection model config. MACHINE_LEARNING has no evaluator yet. */
public enum DetectionModelType {
    STATISTICAL("statistical"),
    SEASONAL("seasonal"),
    THRESHOLD("threshold"),
    MACHINE_LEARNING("machine_learning");

    private final String code;

    DetectionModelType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static DetectionModelType fromCode(String code) {
        for (DetectionModelType v : values()) {
            if (v.code.equalsIgnoreCase(code) || v.name().equalsIgnoreCase(code)) return v;
        }
        throw new IllegalArgumentException("Unknown DetectionModelType: " + code);
    }
}
