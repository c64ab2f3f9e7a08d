package com.tether.device.event;

import com.tether.device.model.Device;
import com.tether.device.model.DeviceSession;

/** A server session was stopped and its ports released. */
public record SessionStoppedEvent(Device device, DeviceSession session) {
}
