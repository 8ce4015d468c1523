package com.lawnsim.model;

/**
 * Where a wave spawner stands: its phase, the wave and zombie it will emit next, and its countdowns.
 * Carried in snapshots so a restored lawn keeps feeding zombies exactly where it left off.
 */
public class SpawnerProgress {

    public enum Phase { WAITING, SPAWNING, FINISHED }

    public Phase phase = Phase.WAITING;
    public int waveIndex;
    public int zombieIndex;
    public int delayCountdown;
    public int spawnCountdown;
    public int waveSpawnCountdown;

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    public SpawnerProgress() {}

    public SpawnerProgress copy() {
        SpawnerProgress p = new SpawnerProgress();
        p.phase = phase;
        p.waveIndex = waveIndex;
        p.zombieIndex = zombieIndex;
        p.delayCountdown = delayCountdown;
        p.spawnCountdown = spawnCountdown;
        p.waveSpawnCountdown = waveSpawnCountdown;
        return p;
    }

    @Override
    public String toString() {
        return phase + " wave#" + waveIndex + " zombie#" + zombieIndex;
    }
}
