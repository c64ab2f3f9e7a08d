package com.tether.device.event;

import com.tether.device.model.Device;

/** Published by the device detector when a device becomes available. */
public record DeviceConnectedEvent(Device device) {
}
