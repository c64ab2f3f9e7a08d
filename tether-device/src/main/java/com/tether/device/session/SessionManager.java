package com.tether.device.session;

import com.tether.annotations.ResourceCleanup;
import com.tether.device.event.SessionFailedEvent;
import com.tether.device.event.SessionStartedEvent;
import com.tether.device.event.SessionStoppedEvent;
import com.tether.device.model.Device;
import com.tether.device.model.DevicePlatform;
import com.tether.device.model.DeviceSession;
import com.tether.device.model.SessionStatus;
import com.tether.events.EventBus;
import com.tether.metrics.SupervisorMetrics;
import com.tether.ports.PortAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts and stops one server session per device. A start allocates the platform's consecutive
 * ports, launches the server through the {@link SessionLauncher} and publishes
 * {@link SessionStartedEvent}; failures release the ports and publish {@link SessionFailedEvent}.
 * Start and stop for the same device are serialized, so concurrent starts launch one server.
 */
public final class SessionManager implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    static final String SESSION_ID_PREFIX = "tether_";
    static final String REASON_PORTS_EXHAUSTED = "ports_exhausted";
    static final String REASON_LAUNCH_FAILED = "launch_failed";

    private final PortAllocator ports;
    private final SessionLauncher launcher;
    private final EventBus bus;
    private final SupervisorMetrics metrics;
    private final Clock clock;
    /** deviceId → active session with the device it was started for */
    private final Map<String, ActiveSession> active = new ConcurrentHashMap<>();
    /** deviceId → monitor serializing start and stop for that device */
    private final Map<String, Object> deviceLocks = new ConcurrentHashMap<>();

    private record ActiveSession(Device device, DeviceSession session) {
    }

    public SessionManager(PortAllocator ports, SessionLauncher launcher, EventBus bus, SupervisorMetrics metrics) {
        this(ports, launcher, bus, metrics, Clock.systemUTC());
    }

    public SessionManager(PortAllocator ports, SessionLauncher launcher, EventBus bus, SupervisorMetrics metrics,
                          Clock clock) {
        this.ports = Objects.requireNonNull(ports, "ports");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Session id for a device: {@code tether_} plus the id with ':', '-' and spaces replaced by '_'. */
    public static String sessionIdFor(String deviceId) {
        return SESSION_ID_PREFIX + deviceId.replace(':', '_').replace('-', '_').replace(' ', '_');
    }

    /**
     * Starts a session for the device. Returns the existing session when one is already active.
     *
     * @return the running session, or empty when no port run is free or the launch failed
     */
    public Optional<DeviceSession> startSession(Device device) {
        Objects.requireNonNull(device, "device");
        synchronized (lockFor(device.getId())) {
            return startLocked(device);
        }
    }

    private Optional<DeviceSession> startLocked(Device device) {
        ActiveSession existing = active.get(device.getId());
        if (existing != null) {
            log.info("Session {} already active for device {}", existing.session().getSessionId(), device.getId());
            return Optional.of(existing.session().copy());
        }
        DevicePlatform platform = device.getPlatform();
        String platformTag = platform.toValue();
        Optional<List<Integer>> allocated = ports.allocateConsecutive(platform.getPortsRequired());
        if (allocated.isEmpty()) {
            log.error("No {} consecutive free ports for device {}", platform.getPortsRequired(), device.getId());
            metrics.recordPortAllocationFailure();
            fail(device, REASON_PORTS_EXHAUSTED);
            return Optional.empty();
        }
        List<Integer> p = allocated.get();
        DeviceSession session = new DeviceSession();
        session.setSessionId(sessionIdFor(device.getId()));
        session.setAppiumPort(p.get(0));
        if (platform == DevicePlatform.IOS) {
            session.setWdaLocalPort(p.get(1));
            session.setMjpegServerPort(p.get(2));
            log.info("Allocated iOS ports for {}: server {}, wda {}, mjpeg {}", device.getId(), p.get(0), p.get(1), p.get(2));
        } else {
            session.setSystemPort(p.get(1));
            log.info("Allocated Android ports for {}: server {}, system {}", device.getId(), p.get(0), p.get(1));
        }
        session.setStartedAt(clock.instant());
        session.setStatus(SessionStatus.STARTING);

        try {
            session.setProcessId(launcher.launch(device, session));
        } catch (SessionLaunchException | RuntimeException e) {
            log.error("Failed to start session for device {}", device.getId(), e);
            ports.release(p);
            fail(device, REASON_LAUNCH_FAILED);
            return Optional.empty();
        }
        session.setStatus(SessionStatus.RUNNING);
        active.put(device.getId(), new ActiveSession(device.copy(), session));
        metrics.recordSessionStarted(platformTag);
        log.info("Session {} started for device {} on port {}", session.getSessionId(), device.getId(), session.getAppiumPort());

        Device withSession = device.copy();
        withSession.setSession(session.copy());
        bus.publish(new SessionStartedEvent(withSession, session.copy()));
        return Optional.of(session.copy());
    }

    /**
     * Stops the device's session, releases its ports and publishes {@link SessionStoppedEvent}.
     *
     * @return false if the device has no active session
     */
    public boolean stopSession(Device device) {
        Objects.requireNonNull(device, "device");
        synchronized (lockFor(device.getId())) {
            return stopLocked(device);
        }
    }

    private boolean stopLocked(Device device) {
        ActiveSession entry = active.remove(device.getId());
        if (entry == null) {
            log.debug("No active session for device {}", device.getId());
            return false;
        }
        DeviceSession session = entry.session();
        log.info("Stopping session {}", session.getSessionId());
        try {
            launcher.terminate(session.getSessionId());
        } catch (RuntimeException e) {
            log.error("Failed to terminate session {}", session.getSessionId(), e);
        }
        ports.release(session.getAllocatedPorts());
        session.setStatus(SessionStatus.STOPPED);
        metrics.recordSessionStopped(device.getPlatform().toValue());

        Device withoutSession = device.copy();
        withoutSession.setSession(null);
        bus.publish(new SessionStoppedEvent(withoutSession, session.copy()));
        return true;
    }

    /** Returns a copy of the device's active session, or null. */
    public DeviceSession getSession(String deviceId) {
        ActiveSession s = deviceId != null ? active.get(deviceId) : null;
        return s != null ? s.session().copy() : null;
    }

    public int getActiveSessionCount() {
        return active.size();
    }

    /** Stops every active session. */
    public void stopAll() {
        List<ActiveSession> sessions = new ArrayList<>(active.values());
        if (!sessions.isEmpty()) {
            log.info("Stopping {} active sessions", sessions.size());
        }
        for (ActiveSession s : sessions) {
            stopSession(s.device());
        }
    }

    @Override
    public void onExit() {
        stopAll();
    }

    private Object lockFor(String deviceId) {
        return deviceLocks.computeIfAbsent(deviceId, id -> new Object());
    }

    private void fail(Device device, String reason) {
        metrics.recordSessionFailed(device.getPlatform().toValue(), reason);
        bus.publish(new SessionFailedEvent(device.copy(), reason));
    }
}
