package com.tether.plugin;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-start correlation context: install folder, variables (looked up case-insensitively, e.g.
 * {@code device}, {@code deviceId}) and the effective health-check timeout. Immutable.
 */
public final class PluginContext {

    public static final String DEVICE_VARIABLE = "device";
    public static final String DEVICE_ID_VARIABLE = "deviceId";

    private static final PluginContext EMPTY = builder().build();

    private final String installFolder;
    private final Map<String, Object> variables;
    private final Integer healthCheckTimeoutSeconds;

    private PluginContext(Builder b) {
        this.installFolder = b.installFolder;
        TreeMap<String, Object> vars = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        vars.putAll(b.variables);
        this.variables = Collections.unmodifiableMap(vars);
        this.healthCheckTimeoutSeconds = b.healthCheckTimeoutSeconds;
    }

    public static PluginContext empty() {
        return EMPTY;
    }

    public String getInstallFolder() {
        return installFolder;
    }

    /** Case-insensitive, read-only view of the variables. */
    public Map<String, Object> getVariables() {
        return variables;
    }

    /** Returns the variable value (case-insensitive name), or null. */
    public Object getVariable(String name) {
        return name != null ? variables.get(name) : null;
    }

    /** Device id carried by the context, or null when this is not a per-device start. */
    public String getDeviceId() {
        Object v = variables.get(DEVICE_ID_VARIABLE);
        if (v == null) return null;
        String s = v.toString();
        return s.isBlank() ? null : s;
    }

    /** Effective health-check timeout for the started instance; null = not set. */
    public Integer getHealthCheckTimeoutSeconds() {
        return healthCheckTimeoutSeconds;
    }

    public Builder toBuilder() {
        return new Builder()
                .installFolder(installFolder)
                .variables(variables)
                .healthCheckTimeoutSeconds(healthCheckTimeoutSeconds);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PluginContext{installFolder=" + installFolder + ", variables=" + variables.keySet() + "}";
    }

    public static final class Builder {
        private String installFolder = "";
        private final Map<String, Object> variables = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private Integer healthCheckTimeoutSeconds;

        private Builder() {
        }

        public Builder installFolder(String installFolder) {
            this.installFolder = installFolder != null ? installFolder : "";
            return this;
        }

        public Builder variable(String name, Object value) {
            this.variables.put(name, value);
            return this;
        }

        public Builder variables(Map<String, ?> variables) {
            if (variables != null) {
                this.variables.putAll(variables);
            }
            return this;
        }

        public Builder healthCheckTimeoutSeconds(Integer healthCheckTimeoutSeconds) {
            this.healthCheckTimeoutSeconds = healthCheckTimeoutSeconds;
            return this;
        }

        public PluginContext build() {
            return new PluginContext(this);
        }
    }
}
