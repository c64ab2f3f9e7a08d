package com.tether.plugin;

/**
 * Lifecycle state of a plugin instance. {@link #DISABLED} until the first start attempt; each
 * attempt ends in {@link #RUNNING}, {@link #STOPPED} or {@link #ERROR}.
 */
public enum PluginState {
    DISABLED,
    RUNNING,
    STOPPED,
    ERROR
}
