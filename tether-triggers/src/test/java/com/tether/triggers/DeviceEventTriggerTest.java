package com.tether.triggers;

import com.tether.device.event.DeviceConnectedEvent;
import com.tether.device.event.DeviceDisconnectedEvent;
import com.tether.device.model.Device;
import com.tether.device.model.DevicePlatform;
import com.tether.device.model.DeviceType;
import com.tether.events.EventBus;
import com.tether.metrics.SupervisorMetrics;
import com.tether.plugin.MonitorSettings;
import com.tether.plugin.Plugin;
import com.tether.plugin.PluginContext;
import com.tether.plugin.PluginDefinition;
import com.tether.plugin.PluginOrchestrator;
import com.tether.plugin.PluginRegistry;
import com.tether.plugin.PluginState;
import com.tether.plugin.PluginStateListener;
import com.tether.plugin.PluginType;
import com.tether.plugin.TriggerRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeviceEventTriggerTest {

    /** Records the context it was started with. */
    static final class RecordingPlugin implements Plugin {
        final String id;
        final PluginDefinition definition;
        volatile PluginState state = PluginState.DISABLED;
        volatile PluginContext context;
        volatile boolean stopped;

        RecordingPlugin(String id, PluginDefinition definition) {
            this.id = id;
            this.definition = definition;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public PluginType getType() {
            return definition.getType();
        }

        @Override
        public PluginState getState() {
            return state;
        }

        @Override
        public PluginDefinition getDefinition() {
            return definition;
        }

        @Override
        public PluginContext getStartContext() {
            return context;
        }

        @Override
        public boolean start(PluginContext context) {
            if (definition.getExecutable().equals("explode")) {
                throw new IllegalStateException("launch exploded");
            }
            this.context = context;
            state = PluginState.RUNNING;
            return true;
        }

        @Override
        public void stop() {
            stopped = true;
            state = PluginState.STOPPED;
        }

        @Override
        public boolean checkHealth() {
            return true;
        }

        @Override
        public void addStateListener(PluginStateListener listener) {
        }
    }

    private EventBus bus;
    private PluginRegistry registry;
    private final Map<String, RecordingPlugin> created = new ConcurrentHashMap<>();
    private DeviceEventTrigger trigger;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        registry = new PluginRegistry();
        PluginOrchestrator orchestrator = new PluginOrchestrator(registry, (id, def) -> {
            RecordingPlugin p = new RecordingPlugin(id, def);
            created.put(id, p);
            return p;
        }, new SupervisorMetrics(), MonitorSettings.DEFAULTS);
        PluginContext base = PluginContext.builder().installFolder("/opt/tether").build();
        trigger = new DeviceEventTrigger(bus, registry, orchestrator, base, new DirectExecutorService());
        trigger.register();
    }

    private static Device device(String id) {
        return new Device(id, DevicePlatform.ANDROID, DeviceType.PHYSICAL, "Pixel");
    }

    private void define(String id, TriggerRule trigger, boolean enabled, boolean stopOnDisconnect) {
        registry.registerDefinition(PluginDefinition.builder(id)
                .executable("tool")
                .triggerOn(trigger)
                .enabled(enabled)
                .stopOnDisconnect(stopOnDisconnect)
                .build());
    }

    @Test
    void connected_startsOnlyEnabledConnectTriggers() {
        define("logcat", TriggerRule.DEVICE_CONNECTED, true, false);
        define("disabled", TriggerRule.DEVICE_CONNECTED, false, false);
        define("cleanup", TriggerRule.DEVICE_DISCONNECTED, true, false);
        define("always", null, true, false);

        bus.publish(new DeviceConnectedEvent(device("emulator-5554")));

        assertEquals(List.of("logcat:emulator-5554"), List.copyOf(created.keySet()));
        assertNotNull(registry.getInstance("logcat:emulator-5554"));
    }

    @Test
    void connected_contextCarriesDeviceAndBase() {
        define("logcat", TriggerRule.DEVICE_CONNECTED, true, false);
        Device d = device("R58M");

        bus.publish(new DeviceConnectedEvent(d));

        PluginContext ctx = created.get("logcat:R58M").context;
        assertEquals("R58M", ctx.getDeviceId());
        assertSame(d, ctx.getVariable("device"));
        assertEquals("/opt/tether", ctx.getInstallFolder());
    }

    @Test
    void connected_failureOnOneDefinitionDoesNotBlockOthers() {
        registry.registerDefinition(PluginDefinition.builder("bad").executable("explode")
                .triggerOn(TriggerRule.DEVICE_CONNECTED).build());
        define("good", TriggerRule.DEVICE_CONNECTED, true, false);

        bus.publish(new DeviceConnectedEvent(device("A")));

        assertNotNull(registry.getInstance("good:A"));
    }

    @Test
    void disconnected_startsDisconnectTriggersAndStopsMarkedInstances() {
        define("logcat", TriggerRule.DEVICE_CONNECTED, true, true);
        define("recorder", TriggerRule.DEVICE_CONNECTED, true, false);
        define("cleanup", TriggerRule.DEVICE_DISCONNECTED, true, false);
        define("cleanup-off", TriggerRule.DEVICE_DISCONNECTED, false, false);
        bus.publish(new DeviceConnectedEvent(device("A")));
        bus.publish(new DeviceConnectedEvent(device("B")));

        bus.publish(new DeviceDisconnectedEvent(device("A")));

        assertTrue(created.get("logcat:A").stopped);
        assertNull(registry.getInstance("logcat:A"));
        assertNotNull(registry.getInstance("logcat:B"));
        assertNotNull(registry.getInstance("recorder:A"));
        assertNotNull(registry.getInstance("cleanup:A"));
        assertNull(registry.getInstance("cleanup-off:A"));
    }

    @Test
    void disconnected_unknownInstanceIsHarmless() {
        define("logcat", TriggerRule.DEVICE_CONNECTED, true, true);

        bus.publish(new DeviceDisconnectedEvent(device("never-connected")));

        assertTrue(registry.getInstances().isEmpty());
    }

    @Test
    void defaultExecutor_runsWorkOffThePublisherThread() throws Exception {
        define("logcat", TriggerRule.DEVICE_CONNECTED, true, false);
        EventBus asyncBus = new EventBus();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        PluginOrchestrator orchestrator = new PluginOrchestrator(registry, RecordingPlugin::new,
                new SupervisorMetrics(), MonitorSettings.DEFAULTS);
        DeviceEventTrigger async = new DeviceEventTrigger(asyncBus, registry, orchestrator, PluginContext.empty(), executor);
        async.register();

        asyncBus.publish(new DeviceConnectedEvent(device("C")));
        async.onExit();

        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertNotNull(registry.getInstance("logcat:C"));
    }
}
