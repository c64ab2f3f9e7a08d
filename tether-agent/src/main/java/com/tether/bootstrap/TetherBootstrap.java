package com.tether.bootstrap;

import com.tether.config.DeviceRegistryConfig;
import com.tether.config.TetherConfig;
import com.tether.device.DeviceConnectionHandler;
import com.tether.device.DeviceDetector;
import com.tether.device.registry.DeviceRegistry;
import com.tether.device.registry.DeviceRegistryUpdater;
import com.tether.device.session.ProcessSessionLauncher;
import com.tether.device.session.SessionLauncher;
import com.tether.device.session.SessionManager;
import com.tether.events.EventBus;
import com.tether.metrics.SupervisorMetrics;
import com.tether.plugin.MonitorSettings;
import com.tether.plugin.PluginContext;
import com.tether.plugin.PluginDefinition;
import com.tether.plugin.PluginDefinitions;
import com.tether.plugin.PluginOrchestrator;
import com.tether.plugin.PluginRegistry;
import com.tether.plugin.builtin.BuiltInPluginFactory;
import com.tether.ports.PortAllocator;
import com.tether.triggers.DeviceEventTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Composition root: builds every component explicitly from {@link TetherConfig}, wires the event bus
 * subscriptions and loads the plugin definitions. Nothing is started until {@link AgentContext#start()}.
 */
public final class TetherBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TetherBootstrap.class);

    private TetherBootstrap() {
    }

    /** Bootstraps from environment variables with the script-based session launcher and no detector. */
    public static AgentContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(TetherConfig.fromEnvironment());
    }

    public static AgentContext initialize(TetherConfig config) {
        return initialize(config, null, null);
    }

    /**
     * @param launcher session launcher; null = {@link ProcessSessionLauncher} running the configured session script
     * @param detector device detector; null = none (devices are reported through {@link AgentContext#getConnectionHandler()})
     */
    public static AgentContext initialize(TetherConfig config, SessionLauncher launcher, DeviceDetector detector) {
        Path installFolder = Path.of(config.getInstallFolder()).toAbsolutePath();
        log.info("Bootstrap: installFolder={}, ports={}, monitorInterval={}s, restartBackoff={}s, autoStartSessions={}",
                installFolder, config.getPortRange(), config.getMonitorIntervalSeconds(),
                config.getRestartBackoffSeconds(), config.isAutoStartSessions());

        EventBus bus = new EventBus();
        SupervisorMetrics metrics = new SupervisorMetrics();
        PortAllocator ports = new PortAllocator(config.getPortRange().getMinPort(), config.getPortRange().getMaxPort());

        DeviceRegistryConfig registryConfig = config.getDeviceRegistry();
        DeviceRegistry deviceRegistry = new DeviceRegistry(new DeviceRegistryConfig(
                registryConfig.isEnabled(),
                installFolder.resolve(registryConfig.getFilePath()).toString(),
                registryConfig.isAutoSave(),
                registryConfig.getSaveIntervalSeconds()));
        new DeviceRegistryUpdater(deviceRegistry, metrics).register(bus);

        SessionLauncher sessionLauncher = launcher != null
                ? launcher
                : new ProcessSessionLauncher(installFolder.toString(), config.getSessionScript());
        SessionManager sessions = new SessionManager(ports, sessionLauncher, bus, metrics);
        DeviceConnectionHandler connectionHandler = new DeviceConnectionHandler(bus, sessions, config.isAutoStartSessions());

        PluginRegistry pluginRegistry = new PluginRegistry();
        loadDefinitions(pluginRegistry, installFolder.resolve(config.getPluginsFile()));
        MonitorSettings settings = new MonitorSettings(config.getMonitorIntervalSeconds(),
                config.getRestartBackoffSeconds(), config.getHealthCheckTimeoutSeconds());
        PluginOrchestrator orchestrator = new PluginOrchestrator(pluginRegistry, new BuiltInPluginFactory(), metrics, settings);

        PluginContext baseContext = PluginContext.builder()
                .installFolder(installFolder.toString())
                .healthCheckTimeoutSeconds(config.getHealthCheckTimeoutSeconds())
                .build();
        DeviceEventTrigger trigger = new DeviceEventTrigger(bus, pluginRegistry, orchestrator, baseContext);
        trigger.register();

        return AgentContext.builder()
                .config(config)
                .bus(bus)
                .metrics(metrics)
                .ports(ports)
                .deviceRegistry(deviceRegistry)
                .sessions(sessions)
                .connectionHandler(connectionHandler)
                .pluginRegistry(pluginRegistry)
                .orchestrator(orchestrator)
                .trigger(trigger)
                .detector(detector)
                .baseContext(baseContext)
                .build();
    }

    /**
     * Registers the definitions from the plugins file. A missing file means no plugins; an unreadable one is
     * logged and also yields none.
     */
    static int loadDefinitions(PluginRegistry registry, Path pluginsFile) {
        List<PluginDefinition> definitions;
        try {
            definitions = PluginDefinitions.readFile(pluginsFile);
        } catch (UncheckedIOException e) {
            log.error("Bootstrap: could not read plugin definitions from {}: {}", pluginsFile, e.getMessage(), e);
            return 0;
        }
        int count = 0;
        for (PluginDefinition definition : definitions) {
            try {
                registry.registerDefinition(definition);
                count++;
                log.info("Registered plugin definition {} (type={}, trigger={}, enabled={})", definition.getId(),
                        definition.getType().toValue(),
                        definition.getTriggerOn() != null ? definition.getTriggerOn().toValue() : "none",
                        definition.isEnabled());
            } catch (IllegalArgumentException e) {
                log.error("Skipping invalid plugin definition {}: {}", definition, e.getMessage());
            }
        }
        if (count == 0) {
            log.warn("No plugin definitions registered; check {}", pluginsFile);
        }
        return count;
    }
}
