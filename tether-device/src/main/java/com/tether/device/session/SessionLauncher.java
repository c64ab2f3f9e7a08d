package com.tether.device.session;

import com.tether.device.model.Device;
import com.tether.device.model.DeviceSession;

/**
 * Starts and stops the server process backing a device session.
 */
public interface SessionLauncher {

    /**
     * Launches the server for {@code session} (ports already allocated).
     *
     * @return pid of the launched process, or null when the launcher cannot tell
     * @throws SessionLaunchException if the server could not be started
     */
    Long launch(Device device, DeviceSession session) throws SessionLaunchException;

    /** Terminates the server started for {@code sessionId}. Unknown ids are ignored. */
    void terminate(String sessionId);
}
