package com.repoatlas.core.gate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.model.GateRecord;
import com.repoatlas.core.model.GateState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;

/**
 * Reads and writes the per-root {@link GateRecord} ({@code gate_state.json}).
 * <p>
 * Writes go to a temp file in the same directory and are moved over the target
 * atomically, so an interrupted run leaves the previous record intact.
 */
@Component
public class GateRecordStore {

    private static final Logger log = LoggerFactory.getLogger(GateRecordStore.class);

    static final String FILE_NAME = "gate_state.json";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final String stateDir;

    public GateRecordStore(AtlasProperties properties) {
        this.stateDir = properties.getGate().getStateDir();
    }

    public Path statePath(Path root) {
        return root.resolve(stateDir).resolve(FILE_NAME);
    }

    /**
     * Loads the record, or a fresh one when none exists. Corrupt state is logged at
     * ERROR and replaced by a fresh record rather than failing the run.
     */
    public GateRecord load(Path root) {
        Path path = statePath(root);
        if (!Files.exists(path)) {
            return GateRecord.fresh();
        }
        try {
            GateRecord record = objectMapper.readValue(path.toFile(), GateRecord.class);
            return record != null ? record : GateRecord.fresh();
        } catch (JsonProcessingException e) {
            log.error("Gate state {} is corrupt, starting from a fresh record: {}", path, e.getOriginalMessage());
            return GateRecord.fresh();
        } catch (IOException e) {
            log.error("Gate state {} is unreadable, starting from a fresh record: {}", path, e.getMessage());
            return GateRecord.fresh();
        }
    }

    public void save(Path root, GateRecord record) {
        Path target = statePath(root);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "gate_state", ".tmp");
            objectMapper.writeValue(temp.toFile(), record);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved gate state {}: {}", target, record);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new GateStateException("Failed to write gate state " + target, e);
        }
    }

    /** Clears the failure streak; the only way out of {@code halted}. */
    public GateRecord reset(Path root, Instant at) {
        GateRecord record = new GateRecord(0, GateState.IDLE, at);
        save(root, record);
        log.info("Gate state reset for {}", root);
        return record;
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temp state file {}: {}", temp, e.getMessage());
        }
    }

    /** Raised when the gate record cannot be persisted. */
    public static class GateStateException extends RuntimeException {
        public GateStateException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
