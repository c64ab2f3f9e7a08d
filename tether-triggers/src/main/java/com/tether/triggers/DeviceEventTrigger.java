package com.tether.triggers;

import com.tether.annotations.ResourceCleanup;
import com.tether.device.event.DeviceConnectedEvent;
import com.tether.device.event.DeviceDisconnectedEvent;
import com.tether.device.model.Device;
import com.tether.events.EventBus;
import com.tether.plugin.PluginContext;
import com.tether.plugin.PluginDefinition;
import com.tether.plugin.PluginOrchestrator;
import com.tether.plugin.PluginRegistry;
import com.tether.plugin.TriggerRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Starts and stops plugin instances in response to device connectivity events.
 * <p>
 * On connect, every enabled {@code device-connected} definition gets a per-device instance. On disconnect,
 * every enabled {@code device-disconnected} definition is started the same way, and the device's instance of
 * each {@code device-connected} definition with {@code stopOnDisconnect} is stopped.
 * <p>
 * Bus handlers only enqueue the work; it runs on the trigger's executor so process launches never block
 * the publisher. Failures are logged per definition.
 */
public final class DeviceEventTrigger implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(DeviceEventTrigger.class);

    static final int DEFAULT_QUEUE_CAPACITY = 256;

    private final EventBus bus;
    private final PluginRegistry registry;
    private final PluginOrchestrator orchestrator;
    private final PluginContext baseContext;
    private final ExecutorService executor;

    public DeviceEventTrigger(EventBus bus, PluginRegistry registry, PluginOrchestrator orchestrator,
                              PluginContext baseContext) {
        this(bus, registry, orchestrator, baseContext, defaultExecutor());
    }

    /**
     * @param baseContext context every triggered start is derived from (install folder, health-check timeout)
     * @param executor    runs the per-event work; shut down by {@link #onExit()}
     */
    public DeviceEventTrigger(EventBus bus, PluginRegistry registry, PluginOrchestrator orchestrator,
                              PluginContext baseContext, ExecutorService executor) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.baseContext = baseContext != null ? baseContext : PluginContext.empty();
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    private static ExecutorService defaultExecutor() {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(DEFAULT_QUEUE_CAPACITY), r -> {
                    Thread t = new Thread(r, "tether-device-trigger");
                    t.setDaemon(true);
                    return t;
                });
    }

    /** Subscribes to device connect/disconnect events. */
    public void register() {
        bus.subscribe(DeviceConnectedEvent.class, e -> submit("connected", e.device(), () -> handleDeviceConnected(e.device())));
        bus.subscribe(DeviceDisconnectedEvent.class, e -> submit("disconnected", e.device(), () -> handleDeviceDisconnected(e.device())));
    }

    private void submit(String kind, Device device, Runnable work) {
        try {
            executor.execute(() -> {
                try {
                    work.run();
                } catch (RuntimeException ex) {
                    log.error("Device trigger failed to handle {} device {}", kind, device.getId(), ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.warn("Dropping {} event for device {}: trigger queue rejected it", kind, device.getId());
        }
    }

    /** Starts a per-device instance of every enabled {@code device-connected} definition. */
    public void handleDeviceConnected(Device device) {
        log.info("Device trigger handling connected device {}", device.getId());
        PluginContext ctx = contextFor(device);
        for (PluginDefinition def : registry.getDefinitions()) {
            if (def.getTriggerOn() != TriggerRule.DEVICE_CONNECTED || !def.isEnabled()) {
                continue;
            }
            try {
                orchestrator.startInstance(def.getId(), ctx);
            } catch (RuntimeException e) {
                log.error("Failed to start plugin {} for device {}", def.getId(), device.getId(), e);
            }
        }
    }

    /**
     * Starts every enabled {@code device-disconnected} definition for the device and stops the device's
     * instances of {@code device-connected} definitions marked {@code stopOnDisconnect}.
     */
    public void handleDeviceDisconnected(Device device) {
        log.info("Device trigger handling disconnected device {}", device.getId());
        PluginContext ctx = contextFor(device);
        for (PluginDefinition def : registry.getDefinitions()) {
            TriggerRule trigger = def.getTriggerOn();
            if (trigger == TriggerRule.DEVICE_DISCONNECTED && def.isEnabled()) {
                try {
                    orchestrator.startInstance(def.getId(), ctx);
                } catch (RuntimeException e) {
                    log.error("Failed to start plugin {} for device disconnect {}", def.getId(), device.getId(), e);
                }
            }
            if (trigger == TriggerRule.DEVICE_CONNECTED && def.isStopOnDisconnect()) {
                String instanceId = def.getId() + ":" + device.getId();
                try {
                    log.info("Stopping plugin instance {} due to device disconnect", instanceId);
                    orchestrator.stopInstance(instanceId);
                } catch (RuntimeException e) {
                    log.error("Failed to stop plugin instance {} for device disconnect {}", instanceId, device.getId(), e);
                }
            }
        }
    }

    PluginContext contextFor(Device device) {
        return baseContext.toBuilder()
                .variable(PluginContext.DEVICE_VARIABLE, device)
                .variable(PluginContext.DEVICE_ID_VARIABLE, device.getId())
                .build();
    }

    /** True once {@link #onExit()} has shut the executor down. */
    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void onExit() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Device trigger work still running after 10s; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
