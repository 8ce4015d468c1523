package com.lawnsim.engine;

import com.lawnsim.model.type.ZombieType;

import java.util.ArrayList;
import java.util.List;

/**
 * One wave: who comes, in which row, how long before the first one and how far apart.
 */
public class WaveConfig {
    public int waveNumber;
    public List<SpawnRequest> zombies = new ArrayList<>();
    public int spawnDelay = 0;
    public int spawnInterval = 50;

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    public WaveConfig() {}

    public WaveConfig(int waveNumber, List<SpawnRequest> zombies, int spawnDelay, int spawnInterval) {
        this.waveNumber = waveNumber;
        this.zombies = new ArrayList<>(zombies);
        this.spawnDelay = spawnDelay;
        this.spawnInterval = spawnInterval;
    }

    /** Spreads the given types over the rows round-robin. */
    public static WaveConfig simple(int waveNumber, List<ZombieType> types, int rowCount) {
        List<SpawnRequest> zombies = new ArrayList<>();
        for (int i = 0; i < types.size(); i++) {
            zombies.add(new SpawnRequest(types.get(i), i % rowCount));
        }
        return new WaveConfig(waveNumber, zombies, 0, 50);
    }

    public int size() {
        return zombies.size();
    }

    public WaveConfig copy() {
        List<SpawnRequest> copies = new ArrayList<>(zombies.size());
        for (SpawnRequest r : zombies) {
            copies.add(new SpawnRequest(r.type, r.row));
        }
        return new WaveConfig(waveNumber, copies, spawnDelay, spawnInterval);
    }
}
