package com.tether.plugin;

/** Notified on every state transition of a {@link Plugin}. */
@FunctionalInterface
public interface PluginStateListener {

    void onStateChanged(Plugin plugin, PluginState newState);
}
