package com.tether.device.registry;

import com.tether.device.event.DeviceConnectedEvent;
import com.tether.device.event.DeviceDisconnectedEvent;
import com.tether.device.event.SessionStartedEvent;
import com.tether.device.event.SessionStoppedEvent;
import com.tether.device.model.Device;
import com.tether.device.model.DeviceState;
import com.tether.events.EventBus;
import com.tether.metrics.SupervisorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Keeps the {@link DeviceRegistry} in step with device and session events published on the bus,
 * and records device connect/disconnect metrics.
 */
public final class DeviceRegistryUpdater {

    private static final Logger log = LoggerFactory.getLogger(DeviceRegistryUpdater.class);

    private final DeviceRegistry registry;
    private final SupervisorMetrics metrics;
    private final Clock clock;

    public DeviceRegistryUpdater(DeviceRegistry registry, SupervisorMetrics metrics) {
        this(registry, metrics, Clock.systemUTC());
    }

    public DeviceRegistryUpdater(DeviceRegistry registry, SupervisorMetrics metrics, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Subscribes this updater to the bus. */
    public void register(EventBus bus) {
        bus.subscribe(DeviceConnectedEvent.class, e -> onConnected(e.device()));
        bus.subscribe(DeviceDisconnectedEvent.class, e -> onDisconnected(e.device()));
        bus.subscribe(SessionStartedEvent.class, this::onSessionStarted);
        bus.subscribe(SessionStoppedEvent.class, this::onSessionStopped);
    }

    void onConnected(Device device) {
        Device d = device.copy();
        d.setState(DeviceState.CONNECTED);
        d.setDisconnectedAt(null);
        if (d.getConnectedAt() == null) {
            d.setConnectedAt(clock.instant());
        }
        registry.upsert(d);
        metrics.recordDeviceConnected(d.getPlatform().toValue());
    }

    void onDisconnected(Device device) {
        if (!registry.markDisconnected(device.getId())) {
            Device d = device.copy();
            d.setState(DeviceState.DISCONNECTED);
            Instant now = clock.instant();
            d.setDisconnectedAt(now);
            registry.upsert(d);
            log.info("Disconnect for unknown device {}; recorded as disconnected", d.getId());
        }
        metrics.recordDeviceDisconnected(device.getPlatform().toValue());
    }

    void onSessionStarted(SessionStartedEvent event) {
        Device d = currentOrEventDevice(event.device());
        d.setSession(event.session());
        registry.upsert(d);
    }

    void onSessionStopped(SessionStoppedEvent event) {
        Device d = registry.get(event.device().getId());
        if (d == null) return;
        d.setSession(null);
        registry.upsert(d);
    }

    private Device currentOrEventDevice(Device fromEvent) {
        Device d = registry.get(fromEvent.getId());
        return d != null ? d : fromEvent.copy();
    }
}
