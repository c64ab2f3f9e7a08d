package com.tether.plugin.template;

import com.tether.plugin.PluginContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder substitution for launch and health-check parameters.
 * <ol>
 *   <li>{@code {name}}: context variable (case-insensitive), or the install folder for {@code installFolder}.</li>
 *   <li>{@code ${NAME}}: the install folder for {@code INSTALL_FOLDER}, else the process environment,
 *       else a context variable (case-insensitive).</li>
 * </ol>
 * Unresolved tokens are left as they are. The braces of a {@code ${...}} token are not a {@code {...}} token.
 */
public final class TemplateExpander {

    private static final Pattern BRACE_TOKEN = Pattern.compile("(?<!\\$)\\{([^}]+)\\}");
    private static final Pattern DOLLAR_TOKEN = Pattern.compile("\\$\\{([^}]+)\\}");

    private static final String INSTALL_FOLDER_VARIABLE = "installFolder";
    private static final String INSTALL_FOLDER_ENV = "INSTALL_FOLDER";

    private final Function<String, String> environment;

    /** Expander reading {@code ${NAME}} values from {@link System#getenv(String)}. */
    public TemplateExpander() {
        this(System::getenv);
    }

    /**
     * @param environment environment lookup; returns null for unset names
     */
    public TemplateExpander(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public String expand(String text, PluginContext context) {
        if (text == null || text.isEmpty()) return text;
        PluginContext ctx = context != null ? context : PluginContext.empty();

        String result = replace(BRACE_TOKEN, text, name -> {
            if (ctx.getVariables().containsKey(name)) {
                return stringValue(ctx.getVariable(name));
            }
            if (INSTALL_FOLDER_VARIABLE.equalsIgnoreCase(name)) {
                return ctx.getInstallFolder();
            }
            return null;
        });

        return replace(DOLLAR_TOKEN, result, name -> {
            if (INSTALL_FOLDER_ENV.equalsIgnoreCase(name)) {
                return ctx.getInstallFolder();
            }
            String env = environment.apply(name);
            if (env != null && !env.isEmpty()) {
                return env;
            }
            if (ctx.getVariables().containsKey(name)) {
                return stringValue(ctx.getVariable(name));
            }
            return null;
        });
    }

    public List<String> expandList(List<String> items, PluginContext context) {
        if (items == null) return null;
        List<String> out = new ArrayList<>(items.size());
        for (String item : items) {
            String v = expand(item, context);
            out.add(v != null ? v : "");
        }
        return out;
    }

    /** Expands keys and values. Insertion order is kept; a later key wins when two keys expand alike. */
    public Map<String, String> expandMap(Map<String, String> map, PluginContext context) {
        if (map == null) return null;
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : map.entrySet()) {
            String key = expand(e.getKey(), context);
            String value = expand(e.getValue(), context);
            out.put(key != null ? key : e.getKey(), value != null ? value : "");
        }
        return out;
    }

    private static String replace(Pattern pattern, String input, Function<String, String> resolver) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String resolved = resolver.apply(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(resolved != null ? resolved : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : "";
    }
}
