package com.tether.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Worker variant selected by a definition's {@code type} tag. Anything other than {@code script}
 * (including a missing tag) is a direct-executable {@link #PROCESS} worker.
 */
public enum PluginType {
    PROCESS,
    SCRIPT;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PluginType fromValue(String value) {
        if (value == null || value.isBlank()) return PROCESS;
        return "script".equalsIgnoreCase(value.trim()) ? SCRIPT : PROCESS;
    }
}
