package com.tether.device.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of device: real hardware or a virtual device. */
public enum DeviceType {
    PHYSICAL("Physical"),
    EMULATOR("Emulator"),
    SIMULATOR("Simulator");

    private final String value;

    DeviceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static DeviceType fromValue(String value) {
        if (value == null || value.isBlank()) return PHYSICAL;
        for (DeviceType v : values()) {
            if (v.value.equalsIgnoreCase(value.trim())) {
                return v;
            }
        }
        return PHYSICAL;
    }
}
