package com.tether.device.event;

import com.tether.device.model.Device;
import com.tether.device.model.DeviceSession;

/** A server session was launched for the device. */
public record SessionStartedEvent(Device device, DeviceSession session) {
}
