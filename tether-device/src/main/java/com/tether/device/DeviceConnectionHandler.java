package com.tether.device;

import com.tether.device.event.DeviceConnectedEvent;
import com.tether.device.event.DeviceDisconnectedEvent;
import com.tether.device.model.Device;
import com.tether.device.model.DeviceState;
import com.tether.device.session.SessionManager;
import com.tether.events.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for a {@link DeviceDetector}. A connect publishes {@link DeviceConnectedEvent} and then,
 * when enabled, starts the device's server session; a disconnect stops the session first and then
 * publishes {@link DeviceDisconnectedEvent}.
 */
public final class DeviceConnectionHandler {

    private static final Logger log = LoggerFactory.getLogger(DeviceConnectionHandler.class);

    private final EventBus bus;
    private final SessionManager sessions;
    private final boolean autoStartSessions;

    public DeviceConnectionHandler(EventBus bus, SessionManager sessions, boolean autoStartSessions) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.autoStartSessions = autoStartSessions;
    }

    public void onConnected(Device device) {
        log.info("Device connected: {} ({}, {}) - {}", device.getId(), device.getPlatform(), device.getType(), device.getName());
        Device d = device.copy();
        d.setState(DeviceState.CONNECTED);
        bus.publish(new DeviceConnectedEvent(d));
        if (autoStartSessions) {
            sessions.startSession(d);
        }
    }

    public void onDisconnected(Device device) {
        log.info("Device disconnected: {}", device.getId());
        Device d = device.copy();
        sessions.stopSession(d);
        d.setSession(null);
        d.setState(DeviceState.DISCONNECTED);
        bus.publish(new DeviceDisconnectedEvent(d));
    }
}
