package com.tether.config;

/**
 * Inclusive port range from which consecutive session ports are allocated.
 * Defaults cover the usual Appium server range ({@value #DEFAULT_MIN_PORT}-{@value #DEFAULT_MAX_PORT}).
 */
public final class PortRangeConfig {

    public static final int DEFAULT_MIN_PORT = 4723;
    public static final int DEFAULT_MAX_PORT = 5000;

    private final int minPort;
    private final int maxPort;

    /**
     * @param minPort first port of the range (inclusive), 1..65535
     * @param maxPort last port of the range (inclusive), not below {@code minPort}
     * @throws IllegalArgumentException if the bounds are outside 1..65535 or inverted
     */
    public PortRangeConfig(int minPort, int maxPort) {
        if (minPort < 1 || maxPort > 65535) {
            throw new IllegalArgumentException("Port range must lie within 1-65535: " + minPort + "-" + maxPort);
        }
        if (maxPort < minPort) {
            throw new IllegalArgumentException("Port range is inverted: " + minPort + "-" + maxPort);
        }
        this.minPort = minPort;
        this.maxPort = maxPort;
    }

    public static PortRangeConfig defaults() {
        return new PortRangeConfig(DEFAULT_MIN_PORT, DEFAULT_MAX_PORT);
    }

    public int getMinPort() {
        return minPort;
    }

    public int getMaxPort() {
        return maxPort;
    }

    /** Number of ports in the range. */
    public int size() {
        return maxPort - minPort + 1;
    }

    @Override
    public String toString() {
        return minPort + "-" + maxPort;
    }
}
