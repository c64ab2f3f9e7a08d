package com.tether.plugin.builtin;

import com.tether.plugin.PluginDefinition;
import com.tether.plugin.PluginType;
import com.tether.plugin.template.TemplateExpander;

import java.util.ArrayList;
import java.util.List;

/** Runs the definition's executable directly with its arguments. */
public final class ProcessPlugin extends AbstractProcessPlugin {

    public ProcessPlugin(String id, PluginDefinition definition, TemplateExpander expander) {
        super(id, PluginType.PROCESS, definition, expander);
    }

    @Override
    protected List<String> buildCommand(String executable, List<String> arguments) {
        List<String> cmd = new ArrayList<>(arguments.size() + 1);
        cmd.add(executable);
        cmd.addAll(arguments);
        return cmd;
    }
}
