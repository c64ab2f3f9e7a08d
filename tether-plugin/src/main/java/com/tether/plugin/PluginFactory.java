package com.tether.plugin;

/** Creates the worker variant for a definition. */
@FunctionalInterface
public interface PluginFactory {

    Plugin create(String instanceId, PluginDefinition definition);
}
