package com.tether.device.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Connection state reported by the device detector. */
public enum DeviceState {
    CONNECTED("Connected"),
    DISCONNECTED("Disconnected"),
    OFFLINE("Offline"),
    UNAUTHORIZED("Unauthorized");

    private final String value;

    DeviceState(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static DeviceState fromValue(String value) {
        if (value == null || value.isBlank()) return DISCONNECTED;
        for (DeviceState v : values()) {
            if (v.value.equalsIgnoreCase(value.trim())) {
                return v;
            }
        }
        return DISCONNECTED;
    }
}
