package com.tether.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.search.Search;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters and gauges for the supervisor: device connect/disconnect per platform, session
 * start/stop/failure, port allocation failures, and plugin unhealthy/restart events per instance.
 * Backed by a Micrometer {@link MeterRegistry}; a {@link SimpleMeterRegistry} is used when none is supplied.
 */
public final class SupervisorMetrics {

    static final String DEVICES_CONNECTED = "tether.devices.connected";
    static final String DEVICES_DISCONNECTED = "tether.devices.disconnected";
    static final String DEVICES_ACTIVE = "tether.devices.active";
    static final String SESSIONS_STARTED = "tether.sessions.started";
    static final String SESSIONS_STOPPED = "tether.sessions.stopped";
    static final String SESSIONS_FAILED = "tether.sessions.failed";
    static final String SESSIONS_ACTIVE = "tether.sessions.active";
    static final String PORT_ALLOCATION_FAILURES = "tether.ports.allocation.failures";
    static final String PLUGIN_UNHEALTHY = "tether.plugin.unhealthy";
    static final String PLUGIN_RESTARTS = "tether.plugin.restarts";

    private final MeterRegistry registry;
    /** platform tag → live connected-device count, exported as a gauge. */
    private final Map<String, AtomicInteger> activeDevices = new ConcurrentHashMap<>();
    private final AtomicInteger activeSessions = new AtomicInteger();

    public SupervisorMetrics() {
        this(new SimpleMeterRegistry());
    }

    public SupervisorMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        registry.gauge(SESSIONS_ACTIVE, activeSessions);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void recordDeviceConnected(String platform) {
        String tag = tag(platform);
        registry.counter(DEVICES_CONNECTED, "platform", tag).increment();
        activeDevicesFor(tag).incrementAndGet();
    }

    public void recordDeviceDisconnected(String platform) {
        String tag = tag(platform);
        registry.counter(DEVICES_DISCONNECTED, "platform", tag).increment();
        activeDevicesFor(tag).updateAndGet(v -> Math.max(0, v - 1));
    }

    public void recordSessionStarted(String platform) {
        registry.counter(SESSIONS_STARTED, "platform", tag(platform)).increment();
        activeSessions.incrementAndGet();
    }

    public void recordSessionStopped(String platform) {
        registry.counter(SESSIONS_STOPPED, "platform", tag(platform)).increment();
        activeSessions.updateAndGet(v -> Math.max(0, v - 1));
    }

    public void recordSessionFailed(String platform, String reason) {
        registry.counter(SESSIONS_FAILED, "platform", tag(platform), "reason", tag(reason)).increment();
    }

    public void recordPortAllocationFailure() {
        registry.counter(PORT_ALLOCATION_FAILURES).increment();
    }

    public void recordPluginUnhealthy(String instanceId) {
        registry.counter(PLUGIN_UNHEALTHY, "instance", tag(instanceId)).increment();
    }

    public void recordPluginRestart(String instanceId) {
        registry.counter(PLUGIN_RESTARTS, "instance", tag(instanceId)).increment();
    }

    public int getActiveDevices(String platform) {
        AtomicInteger v = activeDevices.get(tag(platform));
        return v != null ? v.get() : 0;
    }

    public int getActiveSessions() {
        return activeSessions.get();
    }

    public long getSessionsStartedTotal() {
        return total(SESSIONS_STARTED);
    }

    public long getSessionsFailedTotal() {
        return total(SESSIONS_FAILED);
    }

    public long getPortAllocationFailuresTotal() {
        return total(PORT_ALLOCATION_FAILURES);
    }

    public long getPluginRestartsTotal() {
        return total(PLUGIN_RESTARTS);
    }

    public long getPluginUnhealthyTotal() {
        return total(PLUGIN_UNHEALTHY);
    }

    /** Plugin restarts recorded for one instance id. */
    public long getPluginRestarts(String instanceId) {
        Counter c = registry.find(PLUGIN_RESTARTS).tag("instance", tag(instanceId)).counter();
        return c != null ? (long) c.count() : 0L;
    }

    /** Percentage of session starts that succeeded; 100 when nothing was attempted. */
    public double getSessionStartSuccessRate() {
        long started = getSessionsStartedTotal();
        long failed = getSessionsFailedTotal();
        return started + failed > 0 ? (double) started / (started + failed) * 100.0 : 100.0;
    }

    /** One-line summary for periodic logging. */
    public String summary() {
        StringBuilder devices = new StringBuilder();
        activeDevices.forEach((platform, count) -> {
            if (devices.length() > 0) devices.append(", ");
            devices.append(count.get()).append(' ').append(platform);
        });
        return String.format(Locale.ROOT,
                "Devices: %s | Sessions: %d active, %d started, %d failed (%.1f%% success) | Port failures: %d | Plugin restarts: %d",
                devices.length() > 0 ? devices : "none",
                getActiveSessions(), getSessionsStartedTotal(), getSessionsFailedTotal(),
                getSessionStartSuccessRate(), getPortAllocationFailuresTotal(), getPluginRestartsTotal());
    }

    private AtomicInteger activeDevicesFor(String platformTag) {
        return activeDevices.computeIfAbsent(platformTag, p -> {
            AtomicInteger value = new AtomicInteger();
            registry.gauge(DEVICES_ACTIVE, Tags.of("platform", p), value);
            return value;
        });
    }

    private long total(String name) {
        return (long) Search.in(registry).name(name).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    private static String tag(String value) {
        return value != null && !value.isBlank() ? value : "unknown";
    }
}
