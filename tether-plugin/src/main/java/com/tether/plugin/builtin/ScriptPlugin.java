package com.tether.plugin.builtin;

import com.tether.plugin.PluginDefinition;
import com.tether.plugin.PluginType;
import com.tether.plugin.template.TemplateExpander;

import java.util.List;

/**
 * Runs the definition's script through an interpreter chosen by {@link ScriptRuntime}.
 * With {@code healthCheckRuntime: "bash"} the health probe runs as {@code bash -c "<command> <args>"}.
 */
public final class ScriptPlugin extends AbstractProcessPlugin {

    public ScriptPlugin(String id, PluginDefinition definition, TemplateExpander expander) {
        super(id, PluginType.SCRIPT, definition, expander);
    }

    @Override
    protected List<String> buildCommand(String executable, List<String> arguments) {
        return ScriptRuntime.command(ScriptRuntime.resolveHint(getDefinition(), executable), executable, arguments);
    }

    @Override
    protected List<String> buildHealthCheckCommand(String command, List<String> arguments) {
        String runtime = getDefinition().getHealthCheckRuntime();
        if (runtime != null && runtime.trim().equalsIgnoreCase("bash")) {
            String line = (command + " " + String.join(" ", arguments)).trim();
            return List.of("bash", "-c", line);
        }
        return super.buildHealthCheckCommand(command, arguments);
    }
}
