package com.tether.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ChildProcessesTest {

    @Test
    void runWithTimeout_reportsExitCode() {
        ProbeResult ok = ChildProcesses.runWithTimeout(List.of("sh", "-c", "exit 0"), null, null, Duration.ofSeconds(5));
        ProbeResult failed = ChildProcesses.runWithTimeout(List.of("sh", "-c", "exit 3"), null, null, Duration.ofSeconds(5));

        assertTrue(ok.isSuccess());
        assertTrue(failed.completed());
        assertEquals(3, failed.exitCode());
        assertFalse(failed.isSuccess());
    }

    @Test
    void runWithTimeout_killsSlowCommand() {
        long start = System.nanoTime();
        ProbeResult result = ChildProcesses.runWithTimeout(List.of("sh", "-c", "sleep 30"), null, null, Duration.ofMillis(300));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertFalse(result.completed());
        assertTrue(elapsedMs < 10_000, "took " + elapsedMs + " ms");
    }

    @Test
    void runWithTimeout_passesEnvironment() {
        ProbeResult result = ChildProcesses.runWithTimeout(
                List.of("sh", "-c", "test \"$PROBE_FLAG\" = yes"), null, Map.of("PROBE_FLAG", "yes"), Duration.ofSeconds(5));

        assertTrue(result.isSuccess());
    }

    @Test
    void runWithTimeout_missingExecutableIsNotCompleted() {
        ProbeResult result = ChildProcesses.runWithTimeout(
                List.of("/nonexistent/tether-probe"), null, null, Duration.ofSeconds(1));

        assertFalse(result.completed());
    }

    @Test
    void destroyTree_killsRunningProcess() throws Exception {
        Process process = new ProcessBuilder("sh", "-c", "sleep 30").start();

        assertTrue(ChildProcesses.destroyTree(process, Duration.ofSeconds(5)));
        assertFalse(process.isAlive());
    }
}
