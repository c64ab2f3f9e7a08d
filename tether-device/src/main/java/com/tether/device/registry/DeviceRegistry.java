package com.tether.device.registry;

import com.tether.annotations.ResourceCleanup;
import com.tether.config.DeviceRegistryConfig;
import com.tether.device.model.Device;
import com.tether.device.model.DeviceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-memory device store keyed by device id, optionally persisted to a JSON file.
 * <p>
 * All mutations and saves are serialized by one lock; every read returns copies. When the config
 * is enabled the existing file is loaded on construction (a corrupt file yields an empty registry).
 * {@link #startAutoSave()} schedules periodic saves; {@link #onExit()} stops them and saves once more.
 */
public final class DeviceRegistry implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(DeviceRegistry.class);

    private final DeviceRegistryConfig config;
    private final DeviceRegistryStore store;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, Device> devices = new LinkedHashMap<>();
    private Instant lastUpdated;
    private ScheduledExecutorService autoSave;

    public DeviceRegistry(DeviceRegistryConfig config) {
        this(config, Clock.systemUTC());
    }

    public DeviceRegistry(DeviceRegistryConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.store = new DeviceRegistryStore(Path.of(config.getFilePath()));
        this.lastUpdated = clock.instant();
        if (config.isEnabled()) {
            loadFromDisk();
        }
    }

    private void loadFromDisk() {
        DeviceRegistryData data = store.load();
        if (data == null) return;
        synchronized (lock) {
            for (Device d : data.getDevices()) {
                if (d != null && !d.getId().isEmpty()) {
                    devices.put(d.getId(), d.copy());
                }
            }
            if (data.getLastUpdated() != null) {
                lastUpdated = data.getLastUpdated();
            }
        }
        log.info("Loaded {} devices from registry {}", data.getDevices().size(), store.getFile());
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    /**
     * Inserts or replaces the device by id. The stored copy gets {@code lastSeen} set to now.
     *
     * @return the stored copy
     */
    public Device upsert(Device device) {
        Objects.requireNonNull(device, "device");
        if (device.getId().isBlank()) {
            throw new IllegalArgumentException("Device id must be non-blank");
        }
        Device stored = device.copy();
        Instant now = clock.instant();
        stored.setLastSeen(now);
        synchronized (lock) {
            devices.put(stored.getId(), stored);
            lastUpdated = now;
        }
        log.info("Device {} ({}) updated in registry", stored.getId(), stored.getPlatform());
        return stored.copy();
    }

    /** Returns a copy of the device, or null if not registered. */
    public Device get(String deviceId) {
        if (deviceId == null) return null;
        synchronized (lock) {
            Device d = devices.get(deviceId);
            return d != null ? d.copy() : null;
        }
    }

    public List<Device> getAll() {
        synchronized (lock) {
            List<Device> out = new ArrayList<>(devices.size());
            devices.values().forEach(d -> out.add(d.copy()));
            return out;
        }
    }

    public List<Device> getConnected() {
        synchronized (lock) {
            List<Device> out = new ArrayList<>();
            for (Device d : devices.values()) {
                if (d.getState() == DeviceState.CONNECTED) {
                    out.add(d.copy());
                }
            }
            return out;
        }
    }

    /**
     * Sets the device state to Disconnected and stamps {@code disconnectedAt}. The device stays registered.
     *
     * @return false if the device is unknown
     */
    public boolean markDisconnected(String deviceId) {
        Instant now = clock.instant();
        synchronized (lock) {
            Device d = deviceId != null ? devices.get(deviceId) : null;
            if (d == null) {
                return false;
            }
            d.setState(DeviceState.DISCONNECTED);
            d.setDisconnectedAt(now);
            lastUpdated = now;
        }
        log.info("Device {} marked as disconnected", deviceId);
        return true;
    }

    /** Prunes the device from the registry. Returns false if it was not registered. */
    public boolean remove(String deviceId) {
        synchronized (lock) {
            if (deviceId == null || devices.remove(deviceId) == null) {
                return false;
            }
            lastUpdated = clock.instant();
        }
        log.info("Device {} removed from registry", deviceId);
        return true;
    }

    public Instant getLastUpdated() {
        synchronized (lock) {
            return lastUpdated;
        }
    }

    /**
     * Writes the full device list to the registry file. No-op when persistence is disabled.
     *
     * @return true if the file was written
     */
    public boolean save() {
        if (!config.isEnabled()) return false;
        synchronized (lock) {
            List<Device> snapshot = new ArrayList<>(devices.values());
            try {
                store.write(new DeviceRegistryData(lastUpdated, snapshot));
                log.debug("Device registry saved to {}", store.getFile());
                return true;
            } catch (IOException | RuntimeException e) {
                log.error("Failed to save device registry to {}", store.getFile(), e);
                return false;
            }
        }
    }

    /** Schedules {@link #save()} every configured interval. No-op when disabled, autosave is off, or already started. */
    public synchronized void startAutoSave() {
        if (!config.isEnabled() || !config.isAutoSave() || autoSave != null) return;
        autoSave = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tether-registry-autosave");
            t.setDaemon(true);
            return t;
        });
        long interval = config.getSaveIntervalSeconds();
        autoSave.scheduleAtFixedRate(this::save, interval, interval, TimeUnit.SECONDS);
        log.info("Device registry autosave every {}s to {}", interval, store.getFile());
    }

    @Override
    public void onExit() {
        synchronized (this) {
            if (autoSave != null) {
                autoSave.shutdownNow();
                autoSave = null;
            }
        }
        save();
    }
}
