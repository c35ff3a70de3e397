package com.sandy.adpulse.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AbTestStatus {
    DRAFT("draft"),
    RUNNING("running"),
    PAUSED("paused"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String code;

    AbTestStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AbTestStatus fromCode(String code) {
        for (AbTestStatus v : values()) {
            if (v.code.equalsIgnoreCase(code) || v.name().equalsIgnoreCase(code)) return v;
        }
        throw new IllegalArgumentException("Unknown AbTestStatus: " + code);
    }
}
