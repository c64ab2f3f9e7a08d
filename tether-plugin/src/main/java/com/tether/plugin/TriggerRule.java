package com.tether.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Device event that auto-starts a definition ({@code triggerOn}). A definition without a rule is
 * started only at agent startup (when enabled) or explicitly.
 */
public enum TriggerRule {
    DEVICE_CONNECTED("device-connected"),
    DEVICE_DISCONNECTED("device-disconnected");

    private final String value;

    TriggerRule(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** Parses a trigger tag case-insensitively; blank or unrecognised tags yield null (no trigger). */
    @JsonCreator
    public static TriggerRule fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        for (TriggerRule r : values()) {
            if (r.value.equalsIgnoreCase(value.trim())) {
                return r;
            }
        }
        return null;
    }
}
