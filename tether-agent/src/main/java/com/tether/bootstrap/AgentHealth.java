package com.tether.bootstrap;

import java.time.Duration;
import java.util.Map;

/**
 * Point-in-time view of the agent.
 *
 * @param healthy          false when a component reports {@code Unhealthy}
 * @param connectedDevices devices currently in the Connected state
 * @param activeSessions   device server sessions that are running
 * @param runningPlugins   plugin instances in the Running state
 * @param componentStatus  component name → {@code Healthy}, {@code NoDevices}, {@code NoSessions}, {@code Stopped} or {@code Unhealthy}
 * @param uptime           time since the agent started
 */
public record AgentHealth(boolean healthy, int connectedDevices, int activeSessions, int runningPlugins,
                          Map<String, String> componentStatus, Duration uptime) {

    public static final String HEALTHY = "Healthy";
    public static final String NO_DEVICES = "NoDevices";
    public static final String NO_SESSIONS = "NoSessions";
    public static final String STOPPED = "Stopped";
    public static final String UNHEALTHY = "Unhealthy";

    public AgentHealth {
        componentStatus = Map.copyOf(componentStatus);
    }
}
