package com.tether.plugin;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Definitions and live instances. Definitions keep their registration order (re-registering an id
 * replaces it in place) so bulk starts iterate them in a stable order. Instances are keyed by
 * instance id: the definition id, or {@code definitionId:deviceId} for per-device instances.
 */
public final class PluginRegistry {

    private final Object definitionsLock = new Object();
    private final List<PluginDefinition> definitions = new ArrayList<>();
    /** definition id → index in {@link #definitions} */
    private final Map<String, Integer> definitionIndex = new HashMap<>();

    private final Map<String, Plugin> instances = new ConcurrentHashMap<>();

    /**
     * Registers a definition. An existing definition with the same id is replaced at its original position.
     *
     * @throws IllegalArgumentException if the definition id is blank
     */
    public void registerDefinition(PluginDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        String id = definition.getId();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Plugin definition id must be non-blank");
        }
        synchronized (definitionsLock) {
            Integer index = definitionIndex.get(id);
            if (index != null) {
                definitions.set(index, definition);
            } else {
                definitionIndex.put(id, definitions.size());
                definitions.add(definition);
            }
        }
    }

    /** Definition for the given id, or null if not registered. */
    public PluginDefinition getDefinition(String id) {
        if (id == null) return null;
        synchronized (definitionsLock) {
            Integer index = definitionIndex.get(id);
            return index != null ? definitions.get(index) : null;
        }
    }

    /** Snapshot of all definitions in registration order. */
    public List<PluginDefinition> getDefinitions() {
        synchronized (definitionsLock) {
            return List.copyOf(definitions);
        }
    }

    public void registerInstance(Plugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        instances.put(plugin.getId(), plugin);
    }

    /**
     * Registers the instance unless one with the same id is already present.
     *
     * @return the instance already registered under that id, or null if {@code plugin} was registered
     */
    public Plugin registerInstanceIfAbsent(Plugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        return instances.putIfAbsent(plugin.getId(), plugin);
    }

    /** Removes and returns the instance, or null if none was registered. */
    public Plugin removeInstance(String instanceId) {
        return instanceId != null ? instances.remove(instanceId) : null;
    }

    /** Removes the instance only if it is still {@code expected}. */
    public boolean removeInstance(String instanceId, Plugin expected) {
        return instanceId != null && expected != null && instances.remove(instanceId, expected);
    }

    public Plugin getInstance(String instanceId) {
        return instanceId != null ? instances.get(instanceId) : null;
    }

    public List<Plugin> getInstances() {
        return new ArrayList<>(instances.values());
    }

    /** Instances whose id equals {@code definitionId} or starts with {@code definitionId + ":"}. */
    public List<Plugin> getInstancesByDefinitionId(String definitionId) {
        List<Plugin> result = new ArrayList<>();
        if (definitionId == null) return result;
        String prefix = definitionId + ":";
        for (Plugin p : instances.values()) {
            if (p.getId().equals(definitionId) || p.getId().startsWith(prefix)) {
                result.add(p);
            }
        }
        return result;
    }

    /** Drops all definitions and instances without stopping anything. */
    public void clear() {
        synchronized (definitionsLock) {
            definitions.clear();
            definitionIndex.clear();
        }
        instances.clear();
    }
}
