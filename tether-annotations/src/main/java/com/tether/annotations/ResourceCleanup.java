package com.tether.annotations;

/**
 * Contract for resource cleanup when the agent or one of its components is shutting down.
 * Components that hold resources (child processes, threads, timers, open files) implement this
 * and release them in {@link #onExit()}. The agent invokes {@code onExit()} on every registered
 * component during shutdown, in reverse start order, before the JVM exits.
 */
public interface ResourceCleanup {

    /**
     * Called once when the agent is shutting down. Implementations release resources (stop child
     * processes, cancel timers, flush state to disk). Exceptions are logged and not rethrown so
     * other components still get a chance to clean up.
     */
    void onExit();
}
