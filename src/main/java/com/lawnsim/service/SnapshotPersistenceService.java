package com.lawnsim.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lawnsim.config.SimulationProperties;
import com.lawnsim.model.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the last lawn snapshot on disk as JSON.
 */
@Service
public class SnapshotPersistenceService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotPersistenceService.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final File dataFile;
    private final File tempFile;

    @Autowired
    public SnapshotPersistenceService(SimulationProperties properties) {
        this(properties.getSnapshotFile());
    }

    SnapshotPersistenceService(String dataFile) {
        this.dataFile = new File(dataFile);
        this.tempFile = new File(dataFile + ".tmp");
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public boolean save(String scenario, GameState state) {
        try {
            SaveData data = new SaveData();
            data.scenario = scenario;
            data.savedAt = System.currentTimeMillis();
            data.state = state;

            // Atomic write: temp file first, then swap it in
            mapper.writeValue(tempFile, data);
            Files.move(tempFile.toPath(), dataFile.toPath(), StandardCopyOption.REPLACE_EXISTING);

            log.info("[Persistence] Snapshot saved at frame {} ({} plants, {} zombies)",
                    state.frame, state.plants.size(), state.zombies.size());
            return true;
        } catch (IOException e) {
            log.error("[Persistence] Failed to save snapshot: {}", e.getMessage());
            return false;
        }
    }

    public Optional<SaveData> load() {
        if (!dataFile.exists() || dataFile.length() == 0) {
            return Optional.empty();
        }
        try {
            SaveData data = mapper.readValue(dataFile, SaveData.class);
            if (data.state == null) {
                throw new IOException("snapshot file has no state");
            }
            return Optional.of(data);
        } catch (IOException e) {
            File backup = new File(dataFile.getPath() + ".bak_" + System.currentTimeMillis());
            log.warn("[Persistence] Corrupted snapshot ({}), moving it to {}", e.getMessage(), backup.getName());
            if (!dataFile.renameTo(backup)) {
                log.error("[Persistence] Could not move corrupted snapshot aside");
            }
            return Optional.empty();
        }
    }

    public File getDataFile() {
        return dataFile;
    }

    public static class SaveData {
        public String scenario;
        public long savedAt;
        public GameState state;
    }
}
