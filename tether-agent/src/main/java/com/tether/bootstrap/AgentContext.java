package com.tether.bootstrap;

import com.tether.annotations.ResourceCleanup;
import com.tether.config.TetherConfig;
import com.tether.device.DeviceConnectionHandler;
import com.tether.device.DeviceDetector;
import com.tether.device.registry.DeviceRegistry;
import com.tether.device.session.SessionManager;
import com.tether.events.EventBus;
import com.tether.metrics.SupervisorMetrics;
import com.tether.plugin.Plugin;
import com.tether.plugin.PluginContext;
import com.tether.plugin.PluginOrchestrator;
import com.tether.plugin.PluginRegistry;
import com.tether.plugin.PluginState;
import com.tether.ports.PortAllocator;
import com.tether.triggers.DeviceEventTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The wired agent built by {@link TetherBootstrap}. {@link #start()} brings the components up in
 * dependency order; {@link #onExit()} runs their {@link ResourceCleanup#onExit()} in reverse.
 */
public final class AgentContext implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(AgentContext.class);

    private final TetherConfig config;
    private final EventBus bus;
    private final SupervisorMetrics metrics;
    private final PortAllocator ports;
    private final DeviceRegistry deviceRegistry;
    private final SessionManager sessions;
    private final DeviceConnectionHandler connectionHandler;
    private final PluginRegistry pluginRegistry;
    private final PluginOrchestrator orchestrator;
    private final DeviceEventTrigger trigger;
    private final DeviceDetector detector;
    private final PluginContext baseContext;
    private final Clock clock;

    private final List<ResourceCleanup> started = new ArrayList<>();
    private Instant startedAt;
    private boolean stopped;

    AgentContext(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.bus = Objects.requireNonNull(b.bus, "bus");
        this.metrics = Objects.requireNonNull(b.metrics, "metrics");
        this.ports = Objects.requireNonNull(b.ports, "ports");
        this.deviceRegistry = Objects.requireNonNull(b.deviceRegistry, "deviceRegistry");
        this.sessions = Objects.requireNonNull(b.sessions, "sessions");
        this.connectionHandler = Objects.requireNonNull(b.connectionHandler, "connectionHandler");
        this.pluginRegistry = Objects.requireNonNull(b.pluginRegistry, "pluginRegistry");
        this.orchestrator = Objects.requireNonNull(b.orchestrator, "orchestrator");
        this.trigger = Objects.requireNonNull(b.trigger, "trigger");
        this.detector = b.detector;
        this.baseContext = Objects.requireNonNull(b.baseContext, "baseContext");
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
    }

    /**
     * Starts registry autosave, the enabled definitions without a trigger rule, the health monitor and
     * the device detector.
     */
    public synchronized void start() {
        if (startedAt != null) {
            return;
        }
        startedAt = clock.instant();

        deviceRegistry.startAutoSave();
        started.add(deviceRegistry);
        started.add(sessions);

        orchestrator.startEnabledDefinitions(baseContext, d -> d.getTriggerOn() == null);
        orchestrator.startMonitoring(baseContext);
        started.add(orchestrator);
        started.add(trigger);

        if (detector != null) {
            detector.start(connectionHandler);
            started.add(detector::stop);
        } else {
            log.warn("No device detector configured; devices are only reported through the connection handler");
        }
        log.info("Agent started: {} plugin definitions, {} instances running, ports {}-{}",
                pluginRegistry.getDefinitions().size(), runningPlugins(), ports.getMinPort(), ports.getMaxPort());
    }

    /** Stops the detector, triggers, plugins and sessions, then saves the device registry. Runs once. */
    @Override
    public synchronized void onExit() {
        if (stopped) {
            return;
        }
        stopped = true;
        log.info("Shutting down agent...");
        if (!started.contains(trigger)) {
            // subscribed at build time, so it needs stopping even when start() never ran
            started.add(trigger);
        }
        for (int i = started.size() - 1; i >= 0; i--) {
            ResourceCleanup component = started.get(i);
            try {
                component.onExit();
            } catch (Exception e) {
                log.warn("Component {} onExit failed: {}", component, e.getMessage(), e);
            }
        }
        started.clear();
        log.info("Agent stopped. {}", metrics.summary());
    }

    public AgentHealth health() {
        int connected = deviceRegistry.getConnected().size();
        int activeSessions = sessions.getActiveSessionCount();
        int running = runningPlugins();

        Map<String, String> status = new LinkedHashMap<>();
        status.put("DeviceRegistry", deviceRegistry.getAll().isEmpty() ? AgentHealth.NO_DEVICES : AgentHealth.HEALTHY);
        status.put("SessionManager", activeSessions > 0 ? AgentHealth.HEALTHY : AgentHealth.NO_SESSIONS);
        status.put("PluginMonitor", orchestrator.isMonitoring() ? AgentHealth.HEALTHY : AgentHealth.STOPPED);
        status.put("EventBus", AgentHealth.HEALTHY);
        boolean healthy = !status.containsValue(AgentHealth.UNHEALTHY);

        Instant since = startedAt != null ? startedAt : clock.instant();
        return new AgentHealth(healthy, connected, activeSessions, running, status,
                Duration.between(since, clock.instant()));
    }

    private int runningPlugins() {
        int n = 0;
        for (Plugin p : pluginRegistry.getInstances()) {
            if (p.getState() == PluginState.RUNNING) n++;
        }
        return n;
    }

    public TetherConfig getConfig() {
        return config;
    }

    public EventBus getBus() {
        return bus;
    }

    public SupervisorMetrics getMetrics() {
        return metrics;
    }

    public PortAllocator getPorts() {
        return ports;
    }

    public DeviceRegistry getDeviceRegistry() {
        return deviceRegistry;
    }

    public SessionManager getSessions() {
        return sessions;
    }

    /** Handler a detector reports connects and disconnects to. */
    public DeviceConnectionHandler getConnectionHandler() {
        return connectionHandler;
    }

    public PluginRegistry getPluginRegistry() {
        return pluginRegistry;
    }

    public PluginOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public DeviceEventTrigger getTrigger() {
        return trigger;
    }

    public PluginContext getBaseContext() {
        return baseContext;
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private TetherConfig config;
        private EventBus bus;
        private SupervisorMetrics metrics;
        private PortAllocator ports;
        private DeviceRegistry deviceRegistry;
        private SessionManager sessions;
        private DeviceConnectionHandler connectionHandler;
        private PluginRegistry pluginRegistry;
        private PluginOrchestrator orchestrator;
        private DeviceEventTrigger trigger;
        private DeviceDetector detector;
        private PluginContext baseContext;
        private Clock clock;

        Builder config(TetherConfig config) {
            this.config = config;
            return this;
        }

        Builder bus(EventBus bus) {
            this.bus = bus;
            return this;
        }

        Builder metrics(SupervisorMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        Builder ports(PortAllocator ports) {
            this.ports = ports;
            return this;
        }

        Builder deviceRegistry(DeviceRegistry deviceRegistry) {
            this.deviceRegistry = deviceRegistry;
            return this;
        }

        Builder sessions(SessionManager sessions) {
            this.sessions = sessions;
            return this;
        }

        Builder connectionHandler(DeviceConnectionHandler connectionHandler) {
            this.connectionHandler = connectionHandler;
            return this;
        }

        Builder pluginRegistry(PluginRegistry pluginRegistry) {
            this.pluginRegistry = pluginRegistry;
            return this;
        }

        Builder orchestrator(PluginOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
            return this;
        }

        Builder trigger(DeviceEventTrigger trigger) {
            this.trigger = trigger;
            return this;
        }

        Builder detector(DeviceDetector detector) {
            this.detector = detector;
            return this;
        }

        Builder baseContext(PluginContext baseContext) {
            this.baseContext = baseContext;
            return this;
        }

        Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        AgentContext build() {
            return new AgentContext(this);
        }
    }
}
