package com.tether.device.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle status of a per-device server session. */
public enum SessionStatus {
    STARTING("Starting"),
    RUNNING("Running"),
    FAILED("Failed"),
    STOPPED("Stopped");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static SessionStatus fromValue(String value) {
        if (value == null || value.isBlank()) return STOPPED;
        for (SessionStatus v : values()) {
            if (v.value.equalsIgnoreCase(value.trim())) {
                return v;
            }
        }
        return STOPPED;
    }
}
