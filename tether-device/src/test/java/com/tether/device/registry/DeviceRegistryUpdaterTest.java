package com.tether.device.registry;

import com.tether.config.DeviceRegistryConfig;
import com.tether.device.event.DeviceConnectedEvent;
import com.tether.device.event.DeviceDisconnectedEvent;
import com.tether.device.event.SessionStartedEvent;
import com.tether.device.event.SessionStoppedEvent;
import com.tether.device.model.Device;
import com.tether.device.model.DevicePlatform;
import com.tether.device.model.DeviceSession;
import com.tether.device.model.DeviceState;
import com.tether.device.model.DeviceType;
import com.tether.events.EventBus;
import com.tether.metrics.SupervisorMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class DeviceRegistryUpdaterTest {

    private EventBus bus;
    private DeviceRegistry registry;
    private SupervisorMetrics metrics;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        registry = new DeviceRegistry(new DeviceRegistryConfig(false, "unused.json", false, 30));
        metrics = new SupervisorMetrics();
        new DeviceRegistryUpdater(registry, metrics).register(bus);
    }

    private static Device device() {
        return new Device("R58M", DevicePlatform.ANDROID, DeviceType.PHYSICAL, "Galaxy");
    }

    @Test
    void connectedEvent_upsertsConnectedDeviceAndCountsIt() {
        bus.publish(new DeviceConnectedEvent(device()));

        Device stored = registry.get("R58M");
        assertNotNull(stored);
        assertEquals(DeviceState.CONNECTED, stored.getState());
        assertNotNull(stored.getConnectedAt());
        assertEquals(1, metrics.getActiveDevices("Android"));
    }

    @Test
    void disconnectedEvent_marksKnownDeviceDisconnected() {
        bus.publish(new DeviceConnectedEvent(device()));
        bus.publish(new DeviceDisconnectedEvent(device()));

        Device stored = registry.get("R58M");
        assertEquals(DeviceState.DISCONNECTED, stored.getState());
        assertNotNull(stored.getDisconnectedAt());
        assertEquals(0, metrics.getActiveDevices("Android"));
    }

    @Test
    void disconnectedEvent_recordsUnknownDevice() {
        bus.publish(new DeviceDisconnectedEvent(device()));

        assertEquals(DeviceState.DISCONNECTED, registry.get("R58M").getState());
    }

    @Test
    void sessionEvents_attachAndClearSession() {
        bus.publish(new DeviceConnectedEvent(device()));
        DeviceSession session = new DeviceSession();
        session.setSessionId("tether_R58M");
        session.setAppiumPort(4723);
        session.setSystemPort(4724);

        bus.publish(new SessionStartedEvent(device(), session));
        assertEquals(session, registry.get("R58M").getSession());

        bus.publish(new SessionStoppedEvent(device(), session));
        assertNull(registry.get("R58M").getSession());
    }
}
