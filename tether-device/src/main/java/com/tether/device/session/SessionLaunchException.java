package com.tether.device.session;

/** Thrown by a {@link SessionLauncher} when the server process could not be started. */
public class SessionLaunchException extends Exception {

    public SessionLaunchException(String message) {
        super(message);
    }

    public SessionLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
