package com.tether.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** What the health monitor does with an unhealthy instance. Default {@link #ON_FAILURE}. */
public enum RestartPolicy {
    /** Log only; never restart automatically. */
    NEVER("Never"),
    /** Stop and start the instance again, subject to the restart backoff. */
    ON_FAILURE("OnFailure");

    private final String value;

    RestartPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static RestartPolicy fromValue(String value) {
        if (value == null || value.isBlank()) return ON_FAILURE;
        String v = value.trim();
        return NEVER.value.equalsIgnoreCase(v) || "NEVER".equalsIgnoreCase(v) ? NEVER : ON_FAILURE;
    }
}
