package com.tether.device.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

/**
 * A connected (or previously connected) test device. The id is the Android serial or iOS UDID.
 * Instances are mutable; the registry stores and hands out copies (see {@link #copy()}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "platform", "type", "name", "state", "connectedAt", "disconnectedAt", "appiumSession", "lastSeen"})
public final class Device {

    private String id = "";
    private DevicePlatform platform = DevicePlatform.ANDROID;
    private DeviceType type = DeviceType.PHYSICAL;
    private String name = "Unknown";
    private DeviceState state = DeviceState.CONNECTED;
    private Instant connectedAt;
    private Instant disconnectedAt;
    private DeviceSession session;
    private Instant lastSeen;

    public Device() {
    }

    public Device(String id, DevicePlatform platform, DeviceType type, String name) {
        setId(id);
        setPlatform(platform);
        setType(type);
        setName(name);
    }

    /** Deep copy; the embedded session is copied as well. */
    public Device copy() {
        Device c = new Device();
        c.id = id;
        c.platform = platform;
        c.type = type;
        c.name = name;
        c.state = state;
        c.connectedAt = connectedAt;
        c.disconnectedAt = disconnectedAt;
        c.session = session != null ? session.copy() : null;
        c.lastSeen = lastSeen;
        return c;
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id != null ? id : "";
    }

    @JsonProperty("platform")
    public DevicePlatform getPlatform() {
        return platform;
    }

    public void setPlatform(DevicePlatform platform) {
        this.platform = platform != null ? platform : DevicePlatform.ANDROID;
    }

    @JsonProperty("type")
    public DeviceType getType() {
        return type;
    }

    public void setType(DeviceType type) {
        this.type = type != null ? type : DeviceType.PHYSICAL;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null && !name.isBlank() ? name : "Unknown";
    }

    @JsonProperty("state")
    public DeviceState getState() {
        return state;
    }

    public void setState(DeviceState state) {
        this.state = state != null ? state : DeviceState.DISCONNECTED;
    }

    @JsonProperty("connectedAt")
    public Instant getConnectedAt() {
        return connectedAt;
    }

    public void setConnectedAt(Instant connectedAt) {
        this.connectedAt = connectedAt;
    }

    @JsonProperty("disconnectedAt")
    public Instant getDisconnectedAt() {
        return disconnectedAt;
    }

    public void setDisconnectedAt(Instant disconnectedAt) {
        this.disconnectedAt = disconnectedAt;
    }

    /** Running server session, or null. Serialized as {@code appiumSession}. */
    @JsonProperty("appiumSession")
    public DeviceSession getSession() {
        return session;
    }

    @JsonProperty("appiumSession")
    public void setSession(DeviceSession session) {
        this.session = session;
    }

    @JsonProperty("lastSeen")
    public Instant getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(Instant lastSeen) {
        this.lastSeen = lastSeen;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Device that = (Device) o;
        return Objects.equals(id, that.id)
                && platform == that.platform
                && type == that.type
                && Objects.equals(name, that.name)
                && state == that.state
                && Objects.equals(connectedAt, that.connectedAt)
                && Objects.equals(disconnectedAt, that.disconnectedAt)
                && Objects.equals(session, that.session)
                && Objects.equals(lastSeen, that.lastSeen);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, platform, type, name, state, connectedAt, disconnectedAt, session, lastSeen);
    }

    @Override
    public String toString() {
        return "Device{" + id + ", " + platform + ", " + name + ", " + state + "}";
    }
}
