package com.tether.device;

/**
 * Source of physical device connect/disconnect notifications (adb/usbmuxd polling and the like).
 * Implementations call the supplied {@link DeviceConnectionHandler}; the supervisor does not poll devices itself.
 */
public interface DeviceDetector {

    /** Begins reporting devices to {@code handler}. */
    void start(DeviceConnectionHandler handler);

    /** Stops reporting. Called once on shutdown. */
    void stop();
}
