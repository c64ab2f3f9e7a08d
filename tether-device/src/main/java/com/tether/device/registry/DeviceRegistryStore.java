package com.tether.device.registry;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Reads and writes {@link DeviceRegistryData} as JSON. Writes go to a sibling temp file that is
 * then renamed over the target, so the file on disk is always either the old or the new content.
 * Timestamps are ISO-8601 strings.
 */
public final class DeviceRegistryStore {

    private static final Logger log = LoggerFactory.getLogger(DeviceRegistryStore.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;

    public DeviceRegistryStore(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
    }

    public Path getFile() {
        return file;
    }

    /**
     * Loads the registry file.
     *
     * @return parsed data, or null when the file does not exist or cannot be parsed (the latter is logged)
     */
    public DeviceRegistryData load() {
        if (!Files.isRegularFile(file)) {
            log.info("No existing device registry at {}", file);
            return null;
        }
        try {
            DeviceRegistryData data = MAPPER.readValue(file.toFile(), DeviceRegistryData.class);
            if (data == null) {
                log.warn("Device registry {} is empty; starting with no devices", file);
            }
            return data;
        } catch (IOException e) {
            log.error("Device registry {} is unreadable or corrupt; starting with no devices", file, e);
            return null;
        }
    }

    /**
     * Writes {@code data} via temp file and rename.
     *
     * @throws IOException when the temp file cannot be written or moved into place
     */
    public void write(DeviceRegistryData data) throws IOException {
        Path dir = file.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            MAPPER.writeValue(tmp.toFile(), data);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
