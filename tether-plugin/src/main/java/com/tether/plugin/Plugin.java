package com.tether.plugin;

/**
 * A live worker bound to a {@link PluginDefinition}, wrapping one external child process.
 * Instance ids are the definition id, or {@code definitionId:deviceId} for per-device workers.
 */
public interface Plugin {

    String getId();

    PluginType getType();

    PluginState getState();

    /** Definition this instance was created from. */
    PluginDefinition getDefinition();

    /** Context passed to the most recent {@link #start(PluginContext)}, or null before the first start. */
    PluginContext getStartContext();

    /**
     * Launches the worker. Launch failures set {@link PluginState#ERROR} and return false; they are not thrown.
     *
     * @return true if the worker is running
     */
    boolean start(PluginContext context);

    /** Terminates the worker process tree and sets {@link PluginState#STOPPED}. Never throws. */
    void stop();

    /** Runs the configured health probe, or checks the child process is alive when none is configured. */
    boolean checkHealth();

    void addStateListener(PluginStateListener listener);
}
