package com.tether.plugin;

/**
 * Health-monitor tuning.
 *
 * @param monitorIntervalSeconds    tick interval, and the probe interval for definitions that set none
 * @param restartBackoffSeconds     minimum gap between two automatic restarts of one instance
 * @param healthCheckTimeoutSeconds probe timeout for definitions that set none
 */
public record MonitorSettings(int monitorIntervalSeconds, int restartBackoffSeconds, int healthCheckTimeoutSeconds) {

    public static final MonitorSettings DEFAULTS = new MonitorSettings(10, 5, 5);

    public MonitorSettings {
        if (monitorIntervalSeconds <= 0) {
            throw new IllegalArgumentException("monitorIntervalSeconds must be positive: " + monitorIntervalSeconds);
        }
        if (healthCheckTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("healthCheckTimeoutSeconds must be positive: " + healthCheckTimeoutSeconds);
        }
        restartBackoffSeconds = Math.max(0, restartBackoffSeconds);
    }
}
