package com.tether.plugin.builtin;

import com.tether.plugin.Plugin;
import com.tether.plugin.PluginContext;
import com.tether.plugin.PluginDefinition;
import com.tether.plugin.PluginState;
import com.tether.plugin.PluginStateListener;
import com.tether.plugin.PluginType;
import com.tether.plugin.template.TemplateExpander;
import com.tether.process.ChildProcesses;
import com.tether.process.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Shared lifecycle for workers backed by one child process. Subclasses decide how the launch and
 * health-check command lines are built.
 */
public abstract class AbstractProcessPlugin implements Plugin {

    private static final Logger log = LoggerFactory.getLogger(AbstractProcessPlugin.class);

    static final int DEFAULT_HEALTH_CHECK_TIMEOUT_SECONDS = 5;
    static final Duration STOP_WAIT = Duration.ofSeconds(5);
    static final long MIN_PROBE_TIMEOUT_MILLIS = 100;

    private final String id;
    private final PluginType type;
    private final PluginDefinition definition;
    protected final TemplateExpander expander;
    private final List<PluginStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile PluginState state = PluginState.DISABLED;
    private volatile Process process;
    private volatile PluginContext startContext;

    protected AbstractProcessPlugin(String id, PluginType type, PluginDefinition definition, TemplateExpander expander) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.expander = Objects.requireNonNull(expander, "expander");
    }

    /** Full command line for the worker, from the already expanded executable and arguments. */
    protected abstract List<String> buildCommand(String executable, List<String> arguments);

    /** Full command line for the health probe, from the already expanded command and arguments. */
    protected List<String> buildHealthCheckCommand(String command, List<String> arguments) {
        List<String> cmd = new ArrayList<>(arguments.size() + 1);
        cmd.add(command);
        cmd.addAll(arguments);
        return cmd;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public PluginType getType() {
        return type;
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
        return startContext;
    }

    /** Pid of the running child process, or -1. */
    public long getPid() {
        Process p = process;
        return p != null && p.isAlive() ? p.pid() : -1;
    }

    @Override
    public void addStateListener(PluginStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    protected void setState(PluginState newState) {
        state = newState;
        for (PluginStateListener l : listeners) {
            try {
                l.onStateChanged(this, newState);
            } catch (RuntimeException e) {
                log.warn("State listener failed for plugin {}", id, e);
            }
        }
    }

    @Override
    public synchronized boolean start(PluginContext context) {
        PluginContext ctx = context != null ? context : PluginContext.empty();
        startContext = ctx;
        if (definition.getExecutable() == null || definition.getExecutable().isBlank()) {
            log.warn("Plugin {} has no executable configured", id);
            setState(PluginState.ERROR);
            return false;
        }
        try {
            String executable = expander.expand(definition.getExecutable(), ctx);
            List<String> arguments = expander.expandList(definition.getArguments(), ctx);
            String workingDir = expander.expand(
                    definition.getWorkingDirectory() != null ? definition.getWorkingDirectory() : ctx.getInstallFolder(), ctx);

            ProcessBuilder pb = new ProcessBuilder(buildCommand(executable, arguments));
            if (workingDir != null && !workingDir.isBlank()) {
                pb.directory(new File(workingDir));
            }
            pb.environment().putAll(expander.expandMap(definition.getEnvironmentVariables(), ctx));

            Process p = pb.start();
            ChildProcesses.pipeOutput(p, id);
            process = p;
            setState(PluginState.RUNNING);
            log.info("Plugin {} started (pid={})", id, p.pid());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to start plugin {}", id, e);
            setState(PluginState.ERROR);
            return false;
        }
    }

    @Override
    public synchronized void stop() {
        Process p = process;
        if (p != null && p.isAlive()) {
            log.info("Stopping plugin {} (pid={})", id, p.pid());
            if (!ChildProcesses.destroyTree(p, STOP_WAIT)) {
                log.warn("Plugin {} process still alive after stop", id);
            }
        }
        process = null;
        setState(PluginState.STOPPED);
    }

    @Override
    public boolean checkHealth() {
        String command = definition.getHealthCheckCommand();
        if (command != null && !command.isBlank()) {
            PluginContext ctx = startContext != null ? startContext : PluginContext.empty();
            List<String> probe = buildHealthCheckCommand(
                    expander.expand(command, ctx), expander.expandList(definition.getHealthCheckArguments(), ctx));
            ProbeResult result = ChildProcesses.runWithTimeout(probe, null, null, probeTimeout(ctx));
            if (!result.isSuccess()) {
                log.debug("Health probe for plugin {} failed: {}", id, result);
            }
            return result.isSuccess();
        }
        Process p = process;
        return p != null && p.isAlive();
    }

    Duration probeTimeout(PluginContext ctx) {
        int seconds;
        if (definition.getHealthCheckTimeoutSeconds() != null) {
            seconds = definition.getHealthCheckTimeoutSeconds();
        } else if (ctx.getHealthCheckTimeoutSeconds() != null) {
            seconds = ctx.getHealthCheckTimeoutSeconds();
        } else {
            seconds = DEFAULT_HEALTH_CHECK_TIMEOUT_SECONDS;
        }
        return Duration.ofMillis(Math.max(MIN_PROBE_TIMEOUT_MILLIS, seconds * 1000L));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + id + ", " + state + "}";
    }
}
