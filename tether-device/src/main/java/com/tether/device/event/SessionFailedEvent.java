package com.tether.device.event;

import com.tether.device.model.Device;

/** A server session could not be started. */
public record SessionFailedEvent(Device device, String reason) {
}
