package com.tether.device.event;

import com.tether.device.model.Device;

/** Published by the device detector when a device goes away. */
public record DeviceDisconnectedEvent(Device device) {
}
