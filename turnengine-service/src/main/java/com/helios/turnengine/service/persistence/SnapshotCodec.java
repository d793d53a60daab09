package com.helios.turnengine.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.helios.turnengine.api.model.EngineSnapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON encoding of {@link EngineSnapshot}.
 *
 * <p>Unknown properties are ignored on read so saves written by a newer
 * build with extra fields still load. Structural checks on the decoded
 * scheduler state happen when the session is restored.
 */
public final class SnapshotCodec {

    private final ObjectMapper objectMapper;

    public SnapshotCodec() {
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(EngineSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to encode snapshot: " + e.getOriginalMessage(), e);
        }
    }

    public EngineSnapshot decode(String json) {
        try {
            return objectMapper.readValue(json, EngineSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Invalid snapshot JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Writes to a sibling temp file and moves it over {@code path}. The temp
     * file is removed if either step fails.
     */
    public void write(EngineSnapshot snapshot, Path path) {
        String json = encode(snapshot);
        Path temp;
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        } catch (IOException e) {
            throw new SnapshotException("Failed to write snapshot to " + path, e);
        }
        try {
            Files.writeString(temp, json);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            discard(temp, e);
            if (e instanceof IOException) {
                throw new SnapshotException("Failed to write snapshot to " + path, e);
            }
            throw (RuntimeException) e;
        }
    }

    private static void discard(Path temp, Exception cause) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException suppressed) {
            cause.addSuppressed(suppressed);
        }
    }

    public EngineSnapshot read(Path path) {
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new SnapshotException("Failed to read snapshot from " + path, e);
        }
        return decode(json);
    }
}
