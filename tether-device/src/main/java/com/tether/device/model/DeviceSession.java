package com.tether.device.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Server session embedded in a {@link Device}. Ports are role-tagged: {@code appiumPort} is always
 * set; {@code systemPort} only for Android; {@code wdaLocalPort} and {@code mjpegServerPort} only for iOS.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"sessionId", "appiumPort", "wdaLocalPort", "mjpegServerPort", "systemPort", "startedAt", "processId", "status"})
public final class DeviceSession {

    private String sessionId = "";
    private int appiumPort;
    private Integer wdaLocalPort;
    private Integer mjpegServerPort;
    private Integer systemPort;
    private Instant startedAt;
    private Long processId;
    private SessionStatus status = SessionStatus.STARTING;

    public DeviceSession() {
    }

    public DeviceSession copy() {
        DeviceSession c = new DeviceSession();
        c.sessionId = sessionId;
        c.appiumPort = appiumPort;
        c.wdaLocalPort = wdaLocalPort;
        c.mjpegServerPort = mjpegServerPort;
        c.systemPort = systemPort;
        c.startedAt = startedAt;
        c.processId = processId;
        c.status = status;
        return c;
    }

    /** All ports held by this session, primary first. */
    @JsonIgnore
    public List<Integer> getAllocatedPorts() {
        List<Integer> ports = new ArrayList<>(3);
        ports.add(appiumPort);
        if (systemPort != null) ports.add(systemPort);
        if (wdaLocalPort != null) ports.add(wdaLocalPort);
        if (mjpegServerPort != null) ports.add(mjpegServerPort);
        return ports;
    }

    @JsonProperty("sessionId")
    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId != null ? sessionId : "";
    }

    @JsonProperty("appiumPort")
    public int getAppiumPort() {
        return appiumPort;
    }

    public void setAppiumPort(int appiumPort) {
        this.appiumPort = appiumPort;
    }

    @JsonProperty("wdaLocalPort")
    public Integer getWdaLocalPort() {
        return wdaLocalPort;
    }

    public void setWdaLocalPort(Integer wdaLocalPort) {
        this.wdaLocalPort = wdaLocalPort;
    }

    @JsonProperty("mjpegServerPort")
    public Integer getMjpegServerPort() {
        return mjpegServerPort;
    }

    public void setMjpegServerPort(Integer mjpegServerPort) {
        this.mjpegServerPort = mjpegServerPort;
    }

    @JsonProperty("systemPort")
    public Integer getSystemPort() {
        return systemPort;
    }

    public void setSystemPort(Integer systemPort) {
        this.systemPort = systemPort;
    }

    @JsonProperty("startedAt")
    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    /** Pid of the backing server process, or null when unknown. */
    @JsonProperty("processId")
    public Long getProcessId() {
        return processId;
    }

    public void setProcessId(Long processId) {
        this.processId = processId;
    }

    @JsonProperty("status")
    public SessionStatus getStatus() {
        return status;
    }

    public void setStatus(SessionStatus status) {
        this.status = status != null ? status : SessionStatus.STARTING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeviceSession that = (DeviceSession) o;
        return appiumPort == that.appiumPort
                && Objects.equals(sessionId, that.sessionId)
                && Objects.equals(wdaLocalPort, that.wdaLocalPort)
                && Objects.equals(mjpegServerPort, that.mjpegServerPort)
                && Objects.equals(systemPort, that.systemPort)
                && Objects.equals(startedAt, that.startedAt)
                && Objects.equals(processId, that.processId)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, appiumPort, wdaLocalPort, mjpegServerPort, systemPort, startedAt, processId, status);
    }

    @Override
    public String toString() {
        return "DeviceSession{" + sessionId + ", ports=" + getAllocatedPorts() + ", status=" + status + "}";
    }
}
