package com.tether.device.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tether.device.model.Device;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** On-disk shape of the device registry file. */
public final class DeviceRegistryData {

    private final Instant lastUpdated;
    private final List<Device> devices;

    @JsonCreator
    public DeviceRegistryData(
            @JsonProperty("lastUpdated") Instant lastUpdated,
            @JsonProperty("devices") List<Device> devices) {
        this.lastUpdated = lastUpdated;
        this.devices = devices != null ? List.copyOf(devices) : List.of();
    }

    @JsonProperty("lastUpdated")
    public Instant getLastUpdated() {
        return lastUpdated;
    }

    @JsonProperty("devices")
    public List<Device> getDevices() {
        return devices;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeviceRegistryData that = (DeviceRegistryData) o;
        return Objects.equals(lastUpdated, that.lastUpdated) && Objects.equals(devices, that.devices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastUpdated, devices);
    }
}
