package com.tether.plugin.template;

import com.tether.plugin.PluginContext;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TemplateExpanderTest {

    private static final Map<String, String> ENV = Map.of("HOME", "/home/agent", "SERIAL", "from-env");

    private final TemplateExpander expander = new TemplateExpander(ENV::get);

    private static PluginContext ctx() {
        return PluginContext.builder()
                .installFolder("/opt/tether")
                .variable("deviceId", "emulator-5554")
                .variable("serial", "from-context")
                .variable("port", 4723)
                .build();
    }

    @Test
    void expand_braceTokensAreCaseInsensitive() {
        assertEquals("emulator-5554 emulator-5554", expander.expand("{deviceId} {DEVICEID}", ctx()));
    }

    @Test
    void expand_installFolderFallsBackToContext() {
        assertEquals("/opt/tether/bin", expander.expand("{installFolder}/bin", ctx()));
        assertEquals("/opt/tether/bin", expander.expand("${INSTALL_FOLDER}/bin", ctx()));
    }

    @Test
    void expand_nonStringVariablesUseToString() {
        assertEquals("--port 4723", expander.expand("--port {port}", ctx()));
    }

    @Test
    void expand_environmentWinsOverContextForDollarTokens() {
        assertEquals("from-env", expander.expand("${SERIAL}", ctx()));
        assertEquals("/home/agent/.tether", expander.expand("${HOME}/.tether", ctx()));
    }

    @Test
    void expand_dollarTokenFallsBackToContextVariable() {
        assertEquals("emulator-5554", expander.expand("${deviceId}", ctx()));
    }

    @Test
    void expand_unresolvedTokensLeftVerbatim() {
        assertEquals("{unknown} ${UNKNOWN_VAR}", expander.expand("{unknown} ${UNKNOWN_VAR}", ctx()));
    }

    @Test
    void expand_replacementWithDollarAndBackslashIsLiteral() {
        PluginContext c = PluginContext.builder().variable("path", "C:\\tools\\$bin").build();
        assertEquals("C:\\tools\\$bin", expander.expand("{path}", c));
    }

    @Test
    void expand_nullAndEmpty() {
        assertNull(expander.expand(null, ctx()));
        assertEquals("", expander.expand("", ctx()));
        assertEquals("plain", expander.expand("plain", null));
    }

    @Test
    void expandList_expandsEachElement() {
        assertEquals(List.of("-s", "emulator-5554", "/opt/tether"),
                expander.expandList(List.of("-s", "{deviceId}", "${INSTALL_FOLDER}"), ctx()));
    }

    @Test
    void expandMap_expandsKeysAndValues() {
        Map<String, String> in = new LinkedHashMap<>();
        in.put("SERIAL_{deviceId}", "{deviceId}");
        in.put("TOOLS", "{installFolder}/tools");

        Map<String, String> out = expander.expandMap(in, ctx());

        assertEquals(Map.of("SERIAL_emulator-5554", "emulator-5554", "TOOLS", "/opt/tether/tools"), out);
    }
}
