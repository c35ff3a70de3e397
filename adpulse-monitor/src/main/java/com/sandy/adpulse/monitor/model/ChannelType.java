package com.sandy.adpulse.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Delivery medium of a notification channel. */
public enum ChannelType {
    EMAIL("email"),
    SLACK("slack"),
    WEBHOOK("webhook"),
    PUSH("push");

    private final String code;

    ChannelType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ChannelType fromCode(String code) {
        for (ChannelType v : values()) {
            if (v.code.equalsIgnoreCase(code) || v.name().equalsIgnoreCase(code)) return v;
        }
        throw new IllegalArgumentException("Unknown ChannelType: " + code);
    }
}
