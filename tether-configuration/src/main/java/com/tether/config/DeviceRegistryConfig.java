package com.tether.config;

import java.util.Objects;

/**
 * Storage settings for the device registry file: whether persistence is enabled, the file path,
 * and the periodic autosave interval.
 */
public final class DeviceRegistryConfig {

    public static final String DEFAULT_FILE_PATH = "device-registry.json";
    public static final int DEFAULT_SAVE_INTERVAL_SECONDS = 30;

    private final boolean enabled;
    private final String filePath;
    private final boolean autoSave;
    private final int saveIntervalSeconds;

    public DeviceRegistryConfig(boolean enabled, String filePath, boolean autoSave, int saveIntervalSeconds) {
        if (saveIntervalSeconds <= 0) {
            throw new IllegalArgumentException("saveIntervalSeconds must be positive: " + saveIntervalSeconds);
        }
        this.enabled = enabled;
        this.filePath = Objects.requireNonNull(filePath, "filePath");
        this.autoSave = autoSave;
        this.saveIntervalSeconds = saveIntervalSeconds;
    }

    public static DeviceRegistryConfig defaults() {
        return new DeviceRegistryConfig(true, DEFAULT_FILE_PATH, true, DEFAULT_SAVE_INTERVAL_SECONDS);
    }

    /** When false the registry is memory-only and never reads or writes the file. */
    public boolean isEnabled() {
        return enabled;
    }

    public String getFilePath() {
        return filePath;
    }

    public boolean isAutoSave() {
        return autoSave;
    }

    public int getSaveIntervalSeconds() {
        return saveIntervalSeconds;
    }
}
