package com.sandy.adpulse.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/** Retention selector for reading a metric series. */
public enum TimeRange {
    LAST_HOUR("1h", 1),
    LAST_6_HOURS("6h", 6),
    LAST_DAY("24h", 24),
    LAST_WEEK("7d", 168),
    LAST_MONTH("30d", 720);

    private final String code;
    private final int hours;

    TimeRange(String code, int hours) {
        this.code = code;
        this.hours = hours;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Duration toDuration() {
        return Duration.ofHours(hours);
    }

    @JsonCreator
    public static TimeRange fromCode(String code) {
        for (TimeRange r : values()) {
            if (r.code.equalsIgnoreCase(code) || r.name().equalsIgnoreCase(code)) return r;
        }
        throw new IllegalArgumentException("Unknown time range: " + code);
    }
}
