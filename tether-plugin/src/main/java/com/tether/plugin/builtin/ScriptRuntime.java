package com.tether.plugin.builtin;

import com.tether.plugin.PluginDefinition;
import com.tether.process.ChildProcesses;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the interpreter for a script worker. The hint comes from the definition's {@code runtime},
 * then an environment variable named {@code runtime}, then the script's extension
 * ({@code .sh} bash, {@code .py} python3, {@code .js} node, {@code .ps1} powershell). Without a hint
 * the platform's script host is used: PowerShell on Windows, {@code sh} elsewhere.
 */
final class ScriptRuntime {

    static final String RUNTIME_VARIABLE = "runtime";

    private ScriptRuntime() {
    }

    /** Interpreter hint for the definition and (expanded) script path; null when none applies. */
    static String resolveHint(PluginDefinition definition, String script) {
        if (definition.getRuntime() != null && !definition.getRuntime().isBlank()) {
            return definition.getRuntime().trim();
        }
        for (Map.Entry<String, String> e : definition.getEnvironmentVariables().entrySet()) {
            if (RUNTIME_VARIABLE.equalsIgnoreCase(e.getKey()) && e.getValue() != null && !e.getValue().isBlank()) {
                return e.getValue().trim();
            }
        }
        String lower = script != null ? script.toLowerCase(Locale.ROOT) : "";
        if (lower.endsWith(".sh")) return "bash";
        if (lower.endsWith(".py")) return "python3";
        if (lower.endsWith(".js")) return "node";
        if (lower.endsWith(".ps1")) return "powershell";
        return null;
    }

    /** Command line that runs {@code script} with {@code arguments} under {@code hint}. */
    static List<String> command(String hint, String script, List<String> arguments, boolean windows) {
        List<String> cmd = new ArrayList<>();
        String h = hint != null ? hint.toLowerCase(Locale.ROOT) : null;
        if (h == null) {
            h = windows ? "powershell" : "sh";
        }
        switch (h) {
            case "powershell":
            case "pwsh":
                cmd.add(windows && h.equals("powershell") ? "powershell.exe" : "pwsh");
                cmd.add("-NoProfile");
                cmd.add("-ExecutionPolicy");
                cmd.add("Bypass");
                cmd.add("-File");
                break;
            case "python":
            case "python3":
                cmd.add(windows ? "python" : "python3");
                break;
            default:
                cmd.add(hint != null ? hint.trim() : h);
                break;
        }
        cmd.add(script);
        cmd.addAll(arguments);
        return cmd;
    }

    static List<String> command(String hint, String script, List<String> arguments) {
        return command(hint, script, arguments, ChildProcesses.isWindows());
    }
}
