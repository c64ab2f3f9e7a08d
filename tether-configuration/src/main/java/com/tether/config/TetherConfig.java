package com.tether.config;

import java.util.Objects;

/**
 * Configuration loaded from environment variables for the tether agent.
 * <p>
 * Install folder: TETHER_INSTALL_FOLDER. Plugin definitions: TETHER_PLUGINS_FILE (JSON).
 * Monitor: TETHER_MONITOR_INTERVAL_SECONDS, TETHER_RESTART_BACKOFF_SECONDS, TETHER_HEALTH_CHECK_TIMEOUT_SECONDS.
 * Sessions: TETHER_AUTO_START_SESSIONS, TETHER_SESSION_SCRIPT. Ports: TETHER_PORT_MIN, TETHER_PORT_MAX.
 * Registry: TETHER_REGISTRY_ENABLED, TETHER_REGISTRY_FILE, TETHER_REGISTRY_AUTOSAVE, TETHER_REGISTRY_SAVE_INTERVAL_SECONDS.
 */
public final class TetherConfig {

    private static final String ENV_INSTALL_FOLDER = "TETHER_INSTALL_FOLDER";
    private static final String ENV_PLUGINS_FILE = "TETHER_PLUGINS_FILE";
    private static final String ENV_MONITOR_INTERVAL_SECONDS = "TETHER_MONITOR_INTERVAL_SECONDS";
    private static final String ENV_RESTART_BACKOFF_SECONDS = "TETHER_RESTART_BACKOFF_SECONDS";
    private static final String ENV_HEALTH_CHECK_TIMEOUT_SECONDS = "TETHER_HEALTH_CHECK_TIMEOUT_SECONDS";
    private static final String ENV_AUTO_START_SESSIONS = "TETHER_AUTO_START_SESSIONS";
    private static final String ENV_SESSION_SCRIPT = "TETHER_SESSION_SCRIPT";
    private static final String ENV_PORT_MIN = "TETHER_PORT_MIN";
    private static final String ENV_PORT_MAX = "TETHER_PORT_MAX";
    private static final String ENV_REGISTRY_ENABLED = "TETHER_REGISTRY_ENABLED";
    private static final String ENV_REGISTRY_FILE = "TETHER_REGISTRY_FILE";
    private static final String ENV_REGISTRY_AUTOSAVE = "TETHER_REGISTRY_AUTOSAVE";
    private static final String ENV_REGISTRY_SAVE_INTERVAL_SECONDS = "TETHER_REGISTRY_SAVE_INTERVAL_SECONDS";

    private static final String DEFAULT_PLUGINS_FILE = "plugins.json";
    private static final int DEFAULT_MONITOR_INTERVAL_SECONDS = 10;
    private static final int DEFAULT_RESTART_BACKOFF_SECONDS = 5;
    private static final int DEFAULT_HEALTH_CHECK_TIMEOUT_SECONDS = 5;
    private static final boolean DEFAULT_AUTO_START_SESSIONS = true;

    private final String installFolder;
    private final String pluginsFile;
    private final int monitorIntervalSeconds;
    private final int restartBackoffSeconds;
    private final int healthCheckTimeoutSeconds;
    private final boolean autoStartSessions;
    private final String sessionScript;
    private final PortRangeConfig portRange;
    private final DeviceRegistryConfig deviceRegistry;

    private TetherConfig(Builder b) {
        this.installFolder = b.installFolder;
        this.pluginsFile = b.pluginsFile;
        this.monitorIntervalSeconds = positive(b.monitorIntervalSeconds, "monitorIntervalSeconds");
        this.restartBackoffSeconds = Math.max(0, b.restartBackoffSeconds);
        this.healthCheckTimeoutSeconds = positive(b.healthCheckTimeoutSeconds, "healthCheckTimeoutSeconds");
        this.autoStartSessions = b.autoStartSessions;
        this.sessionScript = b.sessionScript;
        this.portRange = b.portRange;
        this.deviceRegistry = b.deviceRegistry;
    }

    /** Folder the toolchain was installed into; substituted for {@code {installFolder}} and {@code ${INSTALL_FOLDER}}. */
    public String getInstallFolder() {
        return installFolder;
    }

    /** JSON file holding plugin definitions. Default {@value #DEFAULT_PLUGINS_FILE}. */
    public String getPluginsFile() {
        return pluginsFile;
    }

    /** Health-monitor tick interval and fallback per-instance probe interval. Default 10. */
    public int getMonitorIntervalSeconds() {
        return monitorIntervalSeconds;
    }

    /** Minimum seconds between two automatic restarts of the same instance. Default 5. */
    public int getRestartBackoffSeconds() {
        return restartBackoffSeconds;
    }

    /** Health-check probe timeout used when a definition does not set its own. Default 5. */
    public int getHealthCheckTimeoutSeconds() {
        return healthCheckTimeoutSeconds;
    }

    /** Whether a per-device server session is started when a device connects. Default true. */
    public boolean isAutoStartSessions() {
        return autoStartSessions;
    }

    /** Script launched per device session (receives install folder and ports); null = none configured. */
    public String getSessionScript() {
        return sessionScript;
    }

    public PortRangeConfig getPortRange() {
        return portRange;
    }

    public DeviceRegistryConfig getDeviceRegistry() {
        return deviceRegistry;
    }

    public static TetherConfig fromEnvironment() {
        PortRangeConfig ports = new PortRangeConfig(
                parseInt(System.getenv(ENV_PORT_MIN), PortRangeConfig.DEFAULT_MIN_PORT),
                parseInt(System.getenv(ENV_PORT_MAX), PortRangeConfig.DEFAULT_MAX_PORT));
        DeviceRegistryConfig registry = new DeviceRegistryConfig(
                parseBoolean(System.getenv(ENV_REGISTRY_ENABLED), true),
                getEnv(ENV_REGISTRY_FILE, DeviceRegistryConfig.DEFAULT_FILE_PATH),
                parseBoolean(System.getenv(ENV_REGISTRY_AUTOSAVE), true),
                parseInt(System.getenv(ENV_REGISTRY_SAVE_INTERVAL_SECONDS), DeviceRegistryConfig.DEFAULT_SAVE_INTERVAL_SECONDS));

        return builder()
                .installFolder(getEnv(ENV_INSTALL_FOLDER, System.getProperty("user.dir")))
                .pluginsFile(getEnv(ENV_PLUGINS_FILE, DEFAULT_PLUGINS_FILE))
                .monitorIntervalSeconds(parseInt(System.getenv(ENV_MONITOR_INTERVAL_SECONDS), DEFAULT_MONITOR_INTERVAL_SECONDS))
                .restartBackoffSeconds(parseInt(System.getenv(ENV_RESTART_BACKOFF_SECONDS), DEFAULT_RESTART_BACKOFF_SECONDS))
                .healthCheckTimeoutSeconds(parseInt(System.getenv(ENV_HEALTH_CHECK_TIMEOUT_SECONDS), DEFAULT_HEALTH_CHECK_TIMEOUT_SECONDS))
                .autoStartSessions(parseBoolean(System.getenv(ENV_AUTO_START_SESSIONS), DEFAULT_AUTO_START_SESSIONS))
                .sessionScript(getEnv(ENV_SESSION_SCRIPT, null))
                .portRange(ports)
                .deviceRegistry(registry)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int positive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String installFolder = "";
        private String pluginsFile = DEFAULT_PLUGINS_FILE;
        private int monitorIntervalSeconds = DEFAULT_MONITOR_INTERVAL_SECONDS;
        private int restartBackoffSeconds = DEFAULT_RESTART_BACKOFF_SECONDS;
        private int healthCheckTimeoutSeconds = DEFAULT_HEALTH_CHECK_TIMEOUT_SECONDS;
        private boolean autoStartSessions = DEFAULT_AUTO_START_SESSIONS;
        private String sessionScript;
        private PortRangeConfig portRange = PortRangeConfig.defaults();
        private DeviceRegistryConfig deviceRegistry = DeviceRegistryConfig.defaults();

        public Builder installFolder(String installFolder) {
            this.installFolder = installFolder != null ? installFolder : "";
            return this;
        }

        public Builder pluginsFile(String pluginsFile) {
            this.pluginsFile = pluginsFile != null ? pluginsFile : DEFAULT_PLUGINS_FILE;
            return this;
        }

        public Builder monitorIntervalSeconds(int monitorIntervalSeconds) {
            this.monitorIntervalSeconds = monitorIntervalSeconds;
            return this;
        }

        public Builder restartBackoffSeconds(int restartBackoffSeconds) {
            this.restartBackoffSeconds = restartBackoffSeconds;
            return this;
        }

        public Builder healthCheckTimeoutSeconds(int healthCheckTimeoutSeconds) {
            this.healthCheckTimeoutSeconds = healthCheckTimeoutSeconds;
            return this;
        }

        public Builder autoStartSessions(boolean autoStartSessions) {
            this.autoStartSessions = autoStartSessions;
            return this;
        }

        public Builder sessionScript(String sessionScript) {
            this.sessionScript = sessionScript;
            return this;
        }

        public Builder portRange(PortRangeConfig portRange) {
            this.portRange = Objects.requireNonNull(portRange, "portRange");
            return this;
        }

        public Builder deviceRegistry(DeviceRegistryConfig deviceRegistry) {
            this.deviceRegistry = Objects.requireNonNull(deviceRegistry, "deviceRegistry");
            return this;
        }

        public TetherConfig build() {
            return new TetherConfig(this);
        }
    }
}
