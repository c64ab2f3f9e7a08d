package com.tether.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Helpers shared by every component that owns an external child process: log piping, bounded
 * probe runs and process-tree termination.
 */
public final class ChildProcesses {

    private static final Logger log = LoggerFactory.getLogger(ChildProcesses.class);

    private ChildProcesses() {
    }

    public static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }

    /**
     * Starts daemon threads that copy the child's stdout (INFO) and stderr (WARN) to the log,
     * each line prefixed with {@code [label]}.
     */
    public static void pipeOutput(Process process, String label) {
        pipe(process.getInputStream(), label, false, "out");
        pipe(process.getErrorStream(), label, true, "err");
    }

    private static void pipe(InputStream stream, String label, boolean error, String suffix) {
        Thread reader = new Thread(() -> {
            try (BufferedReader r = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = r.readLine()) != null) {
                    if (line.isEmpty()) continue;
                    if (error) {
                        log.warn("[{}] {}", label, line);
                    } else {
                        log.info("[{}] {}", label, line);
                    }
                }
            } catch (IOException e) {
                log.debug("[{}] output stream closed: {}", label, e.getMessage());
            }
        }, "tether-" + suffix + "-" + label);
        reader.setDaemon(true);
        reader.start();
    }

    /**
     * Runs a command to completion, killing it (and its descendants) when it exceeds {@code timeout}.
     * Output is discarded.
     *
     * @param command    program and arguments
     * @param workingDir working directory; null = inherit
     * @param env        extra environment variables; null = none
     * @param timeout    upper bound for the run
     * @return the run outcome; never null
     */
    public static ProbeResult runWithTimeout(List<String> command, File workingDir, Map<String, String> env,
                                             Duration timeout) {
        ProcessBuilder pb = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        if (workingDir != null) {
            pb.directory(workingDir);
        }
        if (env != null) {
            pb.environment().putAll(env);
        }
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("Failed to launch {}: {}", command, e.getMessage());
            return ProbeResult.NOT_COMPLETED;
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Command {} timed out after {} ms, killing it", command, timeout.toMillis());
                destroyTree(process, Duration.ofSeconds(1));
                return ProbeResult.NOT_COMPLETED;
            }
            return new ProbeResult(true, process.exitValue());
        } catch (InterruptedException e) {
            destroyTree(process, Duration.ZERO);
            Thread.currentThread().interrupt();
            return ProbeResult.NOT_COMPLETED;
        }
    }

    /**
     * Forcibly kills the process and all of its descendants, then waits up to {@code wait} for it to exit.
     * Failures are logged, never thrown.
     *
     * @return true if the process is no longer alive
     */
    public static boolean destroyTree(Process process, Duration wait) {
        if (process == null) return true;
        try {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            if (!wait.isZero() && !process.waitFor(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Process {} did not exit within {} ms", process.pid(), wait.toMillis());
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for process {} to terminate", process.pid());
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.warn("Failed to terminate process {}", process.pid(), e);
        }
        return !process.isAlive();
    }

    /** Same as {@link #destroyTree(Process, Duration)} for a handle obtained by pid. */
    public static boolean destroyTree(ProcessHandle handle, Duration wait) {
        if (handle == null) return true;
        try {
            handle.descendants().forEach(ProcessHandle::destroyForcibly);
            handle.destroyForcibly();
            if (!wait.isZero()) {
                handle.onExit().get(wait.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Failed to terminate process {}: {}", handle.pid(), e.getMessage());
        }
        return !handle.isAlive();
    }
}
