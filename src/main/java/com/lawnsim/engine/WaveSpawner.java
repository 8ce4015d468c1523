package com.lawnsim.engine;

import com.lawnsim.model.SpawnerProgress;
import com.lawnsim.model.SpawnerProgress.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Countdown-driven wave feeder. Advanced once per simulation tick; emits at most
 * one zombie per call and never catches up on elapsed intervals.
 */
public class WaveSpawner {
    private static final Logger log = LoggerFactory.getLogger(WaveSpawner.class);

    public static final int DEFAULT_INITIAL_DELAY = 500;

    // Copied on construction and never mutated, so copies of the spawner may share it
    private final List<WaveConfig> waves;
    private final int initialDelay;

    private Phase state = Phase.WAITING;
    private int currentWaveIndex = 0;
    private int delayCountdown;
    private int spawnCountdown = 0;
    private int currentZombieIndex = 0;
    private int waveSpawnCountdown = 0;

    public WaveSpawner(List<WaveConfig> waves) {
        this(waves, DEFAULT_INITIAL_DELAY);
    }

    public WaveSpawner(List<WaveConfig> waves, int initialDelay) {
        List<WaveConfig> copies = new ArrayList<>();
        for (WaveConfig w : waves) {
            copies.add(w.copy());
        }
        this.waves = Collections.unmodifiableList(copies);
        this.initialDelay = initialDelay;
        this.delayCountdown = initialDelay;
    }

    private WaveSpawner(WaveSpawner other) {
        this.waves = other.waves;
        this.initialDelay = other.initialDelay;
        this.state = other.state;
        this.currentWaveIndex = other.currentWaveIndex;
        this.delayCountdown = other.delayCountdown;
        this.spawnCountdown = other.spawnCountdown;
        this.currentZombieIndex = other.currentZombieIndex;
        this.waveSpawnCountdown = other.waveSpawnCountdown;
    }

    public WaveSpawner copy() {
        return new WaveSpawner(this);
    }

    /**
     * Advances every countdown by one centisecond.
     *
     * @param frame current simulation frame, used for logging only
     * @return the zombie to spawn this tick, if any (never more than one)
     */
    public List<SpawnRequest> update(long frame) {
        switch (state) {
            case WAITING:
                delayCountdown--;
                if (delayCountdown <= 0) {
                    state = Phase.SPAWNING;
                    startCurrentWave(frame);
                }
                return Collections.emptyList();
            case SPAWNING:
                return updateSpawning(frame);
            default:
                return Collections.emptyList();
        }
    }

    private void startCurrentWave(long frame) {
        if (currentWaveIndex >= waves.size()) {
            state = Phase.FINISHED;
            return;
        }
        WaveConfig wave = waves.get(currentWaveIndex);
        currentZombieIndex = 0;
        waveSpawnCountdown = wave.spawnDelay;
        log.debug("[WaveSpawner] Wave {}/{} starts at frame {} ({} zombies)",
                currentWaveIndex + 1, waves.size(), frame, wave.size());
    }

    private List<SpawnRequest> updateSpawning(long frame) {
        if (currentWaveIndex >= waves.size()) {
            state = Phase.FINISHED;
            return Collections.emptyList();
        }
        WaveConfig wave = waves.get(currentWaveIndex);

        if (waveSpawnCountdown > 0) {
            waveSpawnCountdown--;
            return Collections.emptyList();
        }
        if (spawnCountdown > 0) {
            spawnCountdown--;
            return Collections.emptyList();
        }

        List<SpawnRequest> spawns = new ArrayList<>(1);
        if (currentZombieIndex < wave.size()) {
            SpawnRequest next = wave.zombies.get(currentZombieIndex);
            spawns.add(new SpawnRequest(next.type, next.row));
            currentZombieIndex++;
            spawnCountdown = wave.spawnInterval;
        }

        // Wave exhausted: the next one starts in this same call
        if (currentZombieIndex >= wave.size()) {
            currentWaveIndex++;
            if (currentWaveIndex >= waves.size()) {
                state = Phase.FINISHED;
                log.debug("[WaveSpawner] All {} waves emitted by frame {}", waves.size(), frame);
            } else {
                startCurrentWave(frame);
            }
        }
        return spawns;
    }

    /**
     * Jumps to a wave (1-based) as if it were starting fresh. Past the last wave the spawner finishes.
     */
    public void skipToWave(int waveNumber) {
        int target = Math.max(0, waveNumber - 1);
        if (target >= waves.size()) {
            currentWaveIndex = waves.size();
            state = Phase.FINISHED;
            return;
        }
        currentWaveIndex = target;
        state = Phase.SPAWNING;
        delayCountdown = 0;
        spawnCountdown = 0;
        startCurrentWave(0);
    }

    public void reset() {
        currentWaveIndex = 0;
        state = Phase.WAITING;
        delayCountdown = initialDelay;
        spawnCountdown = 0;
        currentZombieIndex = 0;
        waveSpawnCountdown = 0;
    }

    public SpawnerProgress saveProgress() {
        SpawnerProgress p = new SpawnerProgress();
        p.phase = state;
        p.waveIndex = currentWaveIndex;
        p.zombieIndex = currentZombieIndex;
        p.delayCountdown = delayCountdown;
        p.spawnCountdown = spawnCountdown;
        p.waveSpawnCountdown = waveSpawnCountdown;
        return p;
    }

    /**
     * Puts the spawner back exactly where {@link #saveProgress()} found it.
     *
     * @throws IllegalArgumentException if the progress does not fit this spawner's waves
     */
    public void restoreProgress(SpawnerProgress progress) {
        checkProgress(progress);
        state = progress.phase;
        currentWaveIndex = progress.waveIndex;
        currentZombieIndex = progress.zombieIndex;
        delayCountdown = progress.delayCountdown;
        spawnCountdown = progress.spawnCountdown;
        waveSpawnCountdown = progress.waveSpawnCountdown;
    }

    void checkProgress(SpawnerProgress progress) {
        if (progress == null || progress.phase == null) {
            throw new IllegalArgumentException("spawner progress needs a phase");
        }
        if (progress.waveIndex < 0 || progress.waveIndex > waves.size()) {
            throw new IllegalArgumentException("wave index " + progress.waveIndex + " outside 0.." + waves.size());
        }
        int waveSize = progress.waveIndex < waves.size() ? waves.get(progress.waveIndex).size() : 0;
        if (progress.zombieIndex < 0 || progress.zombieIndex > waveSize) {
            throw new IllegalArgumentException("zombie index " + progress.zombieIndex + " outside 0.." + waveSize);
        }
        if (progress.delayCountdown < 0 || progress.spawnCountdown < 0 || progress.waveSpawnCountdown < 0) {
            throw new IllegalArgumentException("negative countdown in " + progress);
        }
    }

    public boolean isFinished() {
        return state == Phase.FINISHED;
    }

    public Phase getState() {
        return state;
    }

    public int getRemainingWaves() {
        return Math.max(0, waves.size() - currentWaveIndex);
    }

    public int getRemainingZombiesInWave() {
        if (currentWaveIndex >= waves.size()) {
            return 0;
        }
        return Math.max(0, waves.get(currentWaveIndex).size() - currentZombieIndex);
    }

    public int getTotalRemainingZombies() {
        int total = getRemainingZombiesInWave();
        for (int i = currentWaveIndex + 1; i < waves.size(); i++) {
            total += waves.get(i).size();
        }
        return total;
    }

    public int getTotalZombies() {
        int total = 0;
        for (WaveConfig w : waves) {
            total += w.size();
        }
        return total;
    }

    /** 1-based, capped at the last wave. */
    public int getCurrentWave() {
        return Math.min(currentWaveIndex + 1, waves.size());
    }

    public int getTotalWaves() {
        return waves.size();
    }
}
