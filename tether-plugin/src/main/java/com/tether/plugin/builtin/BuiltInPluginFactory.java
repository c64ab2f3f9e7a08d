package com.tether.plugin.builtin;

import com.tether.plugin.Plugin;
import com.tether.plugin.PluginDefinition;
import com.tether.plugin.PluginFactory;
import com.tether.plugin.PluginType;
import com.tether.plugin.template.TemplateExpander;

import java.util.Objects;

/** Creates {@link ScriptPlugin} for {@code script} definitions and {@link ProcessPlugin} otherwise. */
public final class BuiltInPluginFactory implements PluginFactory {

    private final TemplateExpander expander;

    public BuiltInPluginFactory() {
        this(new TemplateExpander());
    }

    public BuiltInPluginFactory(TemplateExpander expander) {
        this.expander = Objects.requireNonNull(expander, "expander");
    }

    @Override
    public Plugin create(String instanceId, PluginDefinition definition) {
        if (definition.getType() == PluginType.SCRIPT) {
            return new ScriptPlugin(instanceId, definition, expander);
        }
        return new ProcessPlugin(instanceId, definition, expander);
    }
}
