package com.tether.plugin.builtin;

import com.tether.plugin.PluginContext;
import com.tether.plugin.PluginDefinition;
import com.tether.plugin.PluginState;
import com.tether.plugin.template.TemplateExpander;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessPluginTest {

    @TempDir
    Path dir;

    private final TemplateExpander expander = new TemplateExpander(name -> null);
    private final List<ProcessPlugin> started = new ArrayList<>();

    @AfterEach
    void tearDown() {
        started.forEach(ProcessPlugin::stop);
    }

    private ProcessPlugin plugin(PluginDefinition definition) {
        ProcessPlugin p = new ProcessPlugin(definition.getId(), definition, expander);
        started.add(p);
        return p;
    }

    private PluginContext ctx() {
        return PluginContext.builder()
                .installFolder(dir.toString())
                .variable(PluginContext.DEVICE_ID_VARIABLE, "emulator-5554")
                .build();
    }

    static void awaitFile(Path file) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (System.nanoTime() < deadline) {
            if (Files.isRegularFile(file) && Files.isReadable(file)) {
                try {
                    if (Files.size(file) > 0) return;
                } catch (IOException ignored) {
                    // not written yet
                }
            }
            Thread.sleep(50);
        }
    }

    @Test
    void start_expandsTemplatesAndRuns() throws Exception {
        PluginDefinition d = PluginDefinition.builder("writer")
                .executable("sh")
                .arguments(List.of("-c", "echo \"$SERIAL {deviceId}\" > out.txt; sleep 30"))
                .workingDirectory("{installFolder}")
                .environmentVariables(Map.of("SERIAL", "{deviceId}"))
                .build();
        ProcessPlugin p = plugin(d);

        assertTrue(p.start(ctx()));
        assertEquals(PluginState.RUNNING, p.getState());
        assertTrue(p.getPid() > 0);

        Path out = dir.resolve("out.txt");
        awaitFile(out);
        assertEquals("emulator-5554 emulator-5554", Files.readString(out).trim());
        assertTrue(p.checkHealth());
    }

    @Test
    void stop_terminatesProcessAndReportsStopped() {
        ProcessPlugin p = plugin(PluginDefinition.builder("sleeper").executable("sleep").arguments(List.of("30")).build());
        List<PluginState> transitions = new ArrayList<>();
        p.addStateListener((plugin, state) -> transitions.add(state));

        assertTrue(p.start(ctx()));
        p.stop();

        assertEquals(PluginState.STOPPED, p.getState());
        assertEquals(-1, p.getPid());
        assertFalse(p.checkHealth());
        assertEquals(List.of(PluginState.RUNNING, PluginState.STOPPED), transitions);
    }

    @Test
    void start_missingExecutableSetsError() {
        ProcessPlugin p = plugin(PluginDefinition.builder("missing").executable("/nonexistent/tether-tool").build());

        assertFalse(p.start(ctx()));
        assertEquals(PluginState.ERROR, p.getState());
    }

    @Test
    void start_blankExecutableSetsError() {
        ProcessPlugin p = plugin(PluginDefinition.builder("blank").executable(" ").build());

        assertFalse(p.start(ctx()));
        assertEquals(PluginState.ERROR, p.getState());
    }

    @Test
    void checkHealth_usesProbeExitCode() {
        PluginDefinition healthy = PluginDefinition.builder("ok").executable("sleep").arguments(List.of("30"))
                .healthCheckCommand("test").healthCheckArguments(List.of("-d", "{installFolder}")).build();
        PluginDefinition unhealthy = PluginDefinition.builder("bad").executable("sleep").arguments(List.of("30"))
                .healthCheckCommand("sh").healthCheckArguments(List.of("-c", "exit 2")).build();
        ProcessPlugin ok = plugin(healthy);
        ProcessPlugin bad = plugin(unhealthy);
        ok.start(ctx());
        bad.start(ctx());

        assertTrue(ok.checkHealth());
        assertFalse(bad.checkHealth());
    }

    @Test
    void checkHealth_timeoutIsUnhealthy() {
        PluginDefinition d = PluginDefinition.builder("slow").executable("sleep").arguments(List.of("30"))
                .healthCheckCommand("sleep").healthCheckArguments(List.of("20"))
                .healthCheckTimeoutSeconds(1).build();
        ProcessPlugin p = plugin(d);
        p.start(ctx());

        long begin = System.nanoTime();
        assertFalse(p.checkHealth());
        assertTrue(Duration.ofNanos(System.nanoTime() - begin).compareTo(Duration.ofSeconds(10)) < 0);
    }

    @Test
    void probeTimeout_prefersDefinitionThenContext() {
        ProcessPlugin own = plugin(PluginDefinition.builder("a").executable("x").healthCheckTimeoutSeconds(3).build());
        ProcessPlugin inherited = plugin(PluginDefinition.builder("b").executable("x").build());
        PluginContext withTimeout = PluginContext.builder().healthCheckTimeoutSeconds(9).build();

        assertEquals(Duration.ofSeconds(3), own.probeTimeout(withTimeout));
        assertEquals(Duration.ofSeconds(9), inherited.probeTimeout(withTimeout));
        assertEquals(Duration.ofSeconds(5), inherited.probeTimeout(PluginContext.empty()));
    }
}
