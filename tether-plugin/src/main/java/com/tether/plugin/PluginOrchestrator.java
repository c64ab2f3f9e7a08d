package com.tether.plugin;

import com.tether.annotations.ResourceCleanup;
import com.tether.metrics.SupervisorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Starts and stops plugin instances and keeps them healthy.
 * <p>
 * An instance is created per definition, or per definition and device when the start context carries
 * a device id. Starting an instance that is already registered is a no-op that reports success; two
 * racing starts of the same new instance are resolved by an atomic insert, and the loser reports success
 * without launching anything.
 * <p>
 * The health monitor runs on one daemon thread. Each tick probes every running instance at most once per
 * its own interval ({@code healthCheckIntervalSeconds}, else the tick interval). An unhealthy instance is
 * restarted (stop, then start with the context it was started with) unless its restart policy is
 * {@link RestartPolicy#NEVER} or it was restarted within the backoff window. A restart that fails
 * unregisters the instance. Stop, start and restart of one instance are serialized on the instance, and a
 * restart is skipped once the instance has been unregistered.
 */
public final class PluginOrchestrator implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(PluginOrchestrator.class);

    private final PluginRegistry registry;
    private final PluginFactory factory;
    private final SupervisorMetrics metrics;
    private final MonitorSettings settings;
    private final Clock clock;

    /** instance id → last health probe */
    private final Map<String, Instant> lastHealthCheck = new ConcurrentHashMap<>();
    /** instance id → last automatic restart */
    private final Map<String, Instant> lastRestart = new ConcurrentHashMap<>();

    private final Object monitorLock = new Object();
    private Thread monitorThread;
    private CountDownLatch monitorCancel;

    public PluginOrchestrator(PluginRegistry registry, PluginFactory factory, SupervisorMetrics metrics,
                              MonitorSettings settings) {
        this(registry, factory, metrics, settings, Clock.systemUTC());
    }

    public PluginOrchestrator(PluginRegistry registry, PluginFactory factory, SupervisorMetrics metrics,
                              MonitorSettings settings, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PluginRegistry getRegistry() {
        return registry;
    }

    /** {@code definitionId}, or {@code definitionId:deviceId} when the context carries a device id. */
    public static String instanceIdFor(String definitionId, PluginContext context) {
        String deviceId = context != null ? context.getDeviceId() : null;
        return deviceId == null ? definitionId : definitionId + ":" + deviceId;
    }

    /**
     * Creates, registers and starts an instance of the definition.
     *
     * @return true if the instance started or was already registered; false if the definition is unknown
     *         or the launch failed
     */
    public boolean startInstance(String definitionId, PluginContext context) {
        PluginDefinition definition = registry.getDefinition(definitionId);
        if (definition == null) {
            log.warn("Plugin definition {} not found", definitionId);
            return false;
        }
        PluginContext base = context != null ? context : PluginContext.empty();
        String instanceId = instanceIdFor(definitionId, base);
        if (registry.getInstance(instanceId) != null) {
            log.info("Plugin instance {} already running", instanceId);
            return true;
        }

        Integer timeout = definition.getHealthCheckTimeoutSeconds() != null
                ? definition.getHealthCheckTimeoutSeconds()
                : Integer.valueOf(settings.healthCheckTimeoutSeconds());
        PluginContext ctx = base.toBuilder().healthCheckTimeoutSeconds(timeout).build();

        Plugin instance;
        try {
            instance = factory.create(instanceId, definition);
        } catch (RuntimeException e) {
            log.error("Failed to create plugin instance {} (definition={})", instanceId, definitionId, e);
            return false;
        }
        Plugin existing = registry.registerInstanceIfAbsent(instance);
        if (existing != null) {
            log.info("Plugin instance {} was registered concurrently; keeping the existing instance", instanceId);
            return true;
        }

        log.info("Starting plugin instance {} (definition={}, type={})", instanceId, definitionId, definition.getType());
        synchronized (instance) {
            if (registry.getInstance(instanceId) != instance) {
                log.info("Plugin instance {} was stopped before it started", instanceId);
                return false;
            }
            boolean started;
            try {
                started = instance.start(ctx);
            } catch (RuntimeException e) {
                log.error("Plugin instance {} threw on start", instanceId, e);
                started = false;
            }
            if (!started) {
                log.warn("Plugin instance {} failed to start", instanceId);
                registry.removeInstance(instanceId, instance);
            }
            return started;
        }
    }

    /**
     * Stops the instance and removes it from the registry.
     *
     * @return false if no such instance is registered
     */
    public boolean stopInstance(String instanceId) {
        Plugin instance = registry.getInstance(instanceId);
        if (instance == null) {
            log.warn("Plugin instance {} not found", instanceId);
            return false;
        }
        log.info("Stopping plugin instance {}", instanceId);
        synchronized (instance) {
            registry.removeInstance(instanceId, instance);
            try {
                instance.stop();
            } catch (RuntimeException e) {
                log.error("Failed to stop plugin instance {}", instanceId, e);
            }
        }
        lastHealthCheck.remove(instanceId);
        lastRestart.remove(instanceId);
        return true;
    }

    /** Starts every enabled definition in registration order. */
    public void startEnabledDefinitions(PluginContext context) {
        startEnabledDefinitions(context, d -> true);
    }

    /** Starts every enabled definition accepted by {@code filter}, in registration order. */
    public void startEnabledDefinitions(PluginContext context, Predicate<PluginDefinition> filter) {
        for (PluginDefinition definition : registry.getDefinitions()) {
            if (!definition.isEnabled() || !filter.test(definition)) {
                continue;
            }
            try {
                if (!startInstance(definition.getId(), context)) {
                    log.warn("Plugin definition {} did not start", definition.getId());
                }
            } catch (RuntimeException e) {
                log.error("Exception while starting plugin definition {}", definition.getId(), e);
            }
        }
    }

    /** Stops and unregisters every instance. */
    public void stopAll() {
        for (Plugin plugin : registry.getInstances()) {
            try {
                stopInstance(plugin.getId());
            } catch (RuntimeException e) {
                log.error("Exception while stopping plugin {}", plugin.getId(), e);
            }
        }
    }

    /**
     * Starts the health monitor unless it is already running.
     *
     * @param context fallback start context for restarts of instances that have none recorded
     */
    public void startMonitoring(PluginContext context) {
        PluginContext ctx = context != null ? context : PluginContext.empty();
        synchronized (monitorLock) {
            if (monitorThread != null && monitorThread.isAlive()) {
                return;
            }
            CountDownLatch cancel = new CountDownLatch(1);
            Thread t = new Thread(() -> monitorLoop(ctx, cancel), "tether-plugin-monitor");
            t.setDaemon(true);
            monitorCancel = cancel;
            monitorThread = t;
            t.start();
        }
    }

    /** Signals the monitor to stop and waits for the in-flight tick to finish. */
    public void stopMonitoring() {
        Thread t;
        synchronized (monitorLock) {
            if (monitorThread == null) {
                return;
            }
            monitorCancel.countDown();
            t = monitorThread;
            monitorThread = null;
            monitorCancel = null;
        }
        try {
            t.join(TimeUnit.SECONDS.toMillis(settings.healthCheckTimeoutSeconds() + 10L));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isMonitoring() {
        synchronized (monitorLock) {
            return monitorThread != null && monitorThread.isAlive();
        }
    }

    private void monitorLoop(PluginContext context, CountDownLatch cancel) {
        log.info("Plugin health monitor started (interval={}s, restartBackoff={}s)",
                settings.monitorIntervalSeconds(), settings.restartBackoffSeconds());
        try {
            do {
                try {
                    runHealthCheckCycle(context);
                } catch (RuntimeException e) {
                    log.warn("Plugin monitor cycle encountered an error", e);
                }
            } while (!cancel.await(settings.monitorIntervalSeconds(), TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Plugin health monitor stopped");
    }

    /** One monitor tick over every running instance. Failures are isolated per instance. */
    public void runHealthCheckCycle(PluginContext context) {
        for (Plugin plugin : registry.getInstances()) {
            try {
                checkInstance(plugin, context);
            } catch (RuntimeException e) {
                log.warn("Error while monitoring plugin {}", plugin.getId(), e);
            }
        }
    }

    private void checkInstance(Plugin plugin, PluginContext context) {
        if (plugin.getState() != PluginState.RUNNING) {
            return;
        }
        String instanceId = plugin.getId();
        PluginDefinition definition = plugin.getDefinition();
        int interval = settings.monitorIntervalSeconds();
        if (definition.getHealthCheckIntervalSeconds() != null && definition.getHealthCheckIntervalSeconds() > 0) {
            interval = definition.getHealthCheckIntervalSeconds();
        }

        Instant now = clock.instant();
        Instant lastCheck = lastHealthCheck.get(instanceId);
        if (lastCheck != null && Duration.between(lastCheck, now).compareTo(Duration.ofSeconds(interval)) < 0) {
            return;
        }
        lastHealthCheck.put(instanceId, now);

        boolean healthy;
        try {
            healthy = plugin.checkHealth();
        } catch (RuntimeException e) {
            log.warn("Health check for plugin {} threw an exception", instanceId, e);
            healthy = false;
        }
        if (healthy) {
            return;
        }

        RestartPolicy policy = definition.getRestartPolicy();
        log.warn("Plugin {} reported unhealthy; applying restart policy {}", instanceId, policy.toValue());
        metrics.recordPluginUnhealthy(instanceId);
        if (policy == RestartPolicy.NEVER) {
            log.info("Restart disabled for plugin {}", instanceId);
            return;
        }

        Instant restartAt = clock.instant();
        Instant last = lastRestart.get(instanceId);
        if (last != null && Duration.between(last, restartAt).compareTo(Duration.ofSeconds(settings.restartBackoffSeconds())) < 0) {
            log.info("Skipping restart for {} due to recent restart", instanceId);
            return;
        }
        lastRestart.put(instanceId, restartAt);
        restart(plugin, context);
    }

    private void restart(Plugin plugin, PluginContext fallback) {
        String instanceId = plugin.getId();
        synchronized (plugin) {
            if (registry.getInstance(instanceId) != plugin) {
                log.info("Plugin {} was stopped while being checked; not restarting", instanceId);
                return;
            }
            try {
                plugin.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping plugin {} before restart", instanceId, e);
            }
            PluginContext ctx = plugin.getStartContext() != null ? plugin.getStartContext() : fallback;
            boolean started;
            try {
                started = plugin.start(ctx);
            } catch (RuntimeException e) {
                log.error("Plugin {} threw on restart", instanceId, e);
                started = false;
            }
            if (started) {
                log.info("Plugin {} restarted successfully", instanceId);
                metrics.recordPluginRestart(instanceId);
            } else {
                log.error("Failed to restart plugin {}; removing it so a later start can retry", instanceId);
                registry.removeInstance(instanceId, plugin);
            }
        }
    }

    @Override
    public void onExit() {
        stopMonitoring();
        stopAll();
    }
}
