package com.tether.device.session;

import com.tether.device.model.Device;
import com.tether.device.model.DeviceSession;
import com.tether.process.ChildProcesses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the configured start script as a direct child process per session. Arguments:
 * {@code <installFolder> <installFolder>/bin <appiumPort> <wdaLocalPort|0> <mjpegServerPort|0> <systemPort|0> <deviceId>}.
 */
public final class ProcessSessionLauncher implements SessionLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessSessionLauncher.class);
    private static final Duration STOP_WAIT = Duration.ofSeconds(5);

    private final Path installFolder;
    private final Path script;
    private final Map<String, Process> processes = new ConcurrentHashMap<>();

    /**
     * @param installFolder install folder passed to the script
     * @param script        start script; relative paths resolve against {@code installFolder}; null = not configured
     */
    public ProcessSessionLauncher(String installFolder, String script) {
        this.installFolder = Path.of(installFolder != null ? installFolder : "").toAbsolutePath();
        this.script = script == null || script.isBlank() ? null : this.installFolder.resolve(script);
    }

    @Override
    public Long launch(Device device, DeviceSession session) throws SessionLaunchException {
        if (script == null) {
            throw new SessionLaunchException("No session start script configured");
        }
        if (!Files.isRegularFile(script)) {
            throw new SessionLaunchException("Session start script not found: " + script);
        }
        List<String> command = new ArrayList<>();
        if (ChildProcesses.isWindows()) {
            command.addAll(List.of("powershell.exe", "-NoProfile", "-ExecutionPolicy", "Bypass", "-File"));
        } else {
            command.add("bash");
        }
        command.add(script.toString());
        command.add(installFolder.toString());
        command.add(installFolder.resolve("bin").toString());
        command.add(String.valueOf(session.getAppiumPort()));
        command.add(portArg(session.getWdaLocalPort()));
        command.add(portArg(session.getMjpegServerPort()));
        command.add(portArg(session.getSystemPort()));
        command.add(device.getId());

        Process process;
        try {
            process = new ProcessBuilder(command).directory(installFolder.toFile()).start();
        } catch (IOException e) {
            throw new SessionLaunchException("Failed to start session process for " + device.getId(), e);
        }
        ChildProcesses.pipeOutput(process, session.getSessionId());
        processes.put(session.getSessionId(), process);
        log.info("Started session process {} (pid={}) for device {}", session.getSessionId(), process.pid(), device.getId());
        return process.pid();
    }

    @Override
    public void terminate(String sessionId) {
        Process process = sessionId != null ? processes.remove(sessionId) : null;
        if (process == null) {
            log.debug("No session process for {}", sessionId);
            return;
        }
        if (!ChildProcesses.destroyTree(process, STOP_WAIT)) {
            log.warn("Session process {} still alive after stop", sessionId);
        }
    }

    private static String portArg(Integer port) {
        return port != null ? port.toString() : "0";
    }
}
