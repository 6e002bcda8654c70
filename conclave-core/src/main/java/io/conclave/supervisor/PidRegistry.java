package io.conclave.supervisor;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON file mapping role id to PID. Its presence is the only record that agents are running.
 */
public final class PidRegistry {
    private static final TypeReference<LinkedHashMap<String, Long>> REGISTRY_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper;

    public PidRegistry(Path file) {
        this(file, new ObjectMapper());
    }

    public PidRegistry(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return Files.exists(file);
    }

    /**
     * Reads the registry.
     *
     * @return role id to PID in file order; empty if the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public Map<String, Long> read() throws IOException {
        if (!exists()) {
            return new LinkedHashMap<>();
        }
        LinkedHashMap<String, Long> pids = mapper.readValue(file.toFile(), REGISTRY_TYPE);
        return pids != null ? pids : new LinkedHashMap<>();
    }

    /**
     * Replaces the registry contents, creating parent directories as needed.
     *
     * @param pids role id to PID
     * @throws IOException if the file cannot be written
     */
    public void write(Map<String, Long> pids) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValue(file.toFile(), pids);
    }

    /**
     * @return {@code true} if a file was deleted
     * @throws IOException if the file exists but cannot be deleted
     */
    public boolean delete() throws IOException {
        return Files.deleteIfExists(file);
    }
}
