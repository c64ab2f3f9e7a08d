package com.tether.device.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Mobile platform of a device. Each platform needs a fixed number of consecutive ports per
 * server session: Android uses the server port plus {@code systemPort}; iOS uses the server port
 * plus {@code wdaLocalPort} and {@code mjpegServerPort}.
 */
public enum DevicePlatform {
    ANDROID("Android", 2),
    IOS("iOS", 3);

    private final String value;
    private final int portsRequired;

    DevicePlatform(String value, int portsRequired) {
        this.value = value;
        this.portsRequired = portsRequired;
    }

    public int getPortsRequired() {
        return portsRequired;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static DevicePlatform fromValue(String value) {
        if (value == null || value.isBlank()) return ANDROID;
        for (DevicePlatform p : values()) {
            if (p.value.equalsIgnoreCase(value.trim()) || p.name().equalsIgnoreCase(value.trim())) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown device platform: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
