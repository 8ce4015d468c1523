package com.lawnsim.engine;

import com.lawnsim.model.type.ZombieType;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in wave sets.
 */
public final class WavePresets {

    public static final int WAVES_PER_FLAG = 10;

    private WavePresets() {}

    public static boolean isHugeWave(int waveNumber) {
        return waveNumber > 0 && waveNumber % WAVES_PER_FLAG == 0;
    }

    /**
     * Escalating mix: plain zombies first, then cones, buckets and finally footballs.
     * Every tenth wave is a huge wave with twice the usual count.
     */
    public static List<WaveConfig> standard(int totalWaves, int rowCount) {
        List<WaveConfig> waves = new ArrayList<>();
        for (int waveNum = 1; waveNum <= totalWaves; waveNum++) {
            int count = 2 + waveNum / 2;
            if (isHugeWave(waveNum)) {
                count *= 2;
            }
            List<SpawnRequest> zombies = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                zombies.add(new SpawnRequest(standardType(waveNum, i), i % rowCount));
            }
            waves.add(new WaveConfig(waveNum, zombies, 100 + waveNum * 20, 30 + waveNum * 5));
        }
        return waves;
    }

    private static ZombieType standardType(int waveNum, int i) {
        if (waveNum <= 2) {
            return ZombieType.ZOMBIE;
        }
        if (waveNum <= 5) {
            return i % 3 == 0 ? ZombieType.CONEHEAD : ZombieType.ZOMBIE;
        }
        if (waveNum <= 8) {
            if (i % 4 == 0) return ZombieType.BUCKETHEAD;
            if (i % 3 == 0) return ZombieType.CONEHEAD;
            return ZombieType.ZOMBIE;
        }
        if (i % 5 == 0) return ZombieType.FOOTBALL;
        if (i % 4 == 0) return ZombieType.BUCKETHEAD;
        if (i % 3 == 0) return ZombieType.CONEHEAD;
        return ZombieType.ZOMBIE;
    }

    /** Three waves ending in a gargantuar and a buckethead per row. */
    public static List<WaveConfig> gargantuar(int rowCount) {
        List<WaveConfig> waves = new ArrayList<>();

        List<SpawnRequest> first = new ArrayList<>();
        for (int r = 0; r < rowCount; r++) {
            first.add(new SpawnRequest(ZombieType.ZOMBIE, r));
        }
        waves.add(new WaveConfig(1, first, 100, 50));

        List<SpawnRequest> second = new ArrayList<>();
        for (int r = 0; r < rowCount; r++) {
            second.add(new SpawnRequest(ZombieType.CONEHEAD, r));
            second.add(new SpawnRequest(ZombieType.ZOMBIE, r));
        }
        waves.add(new WaveConfig(2, second, 200, 40));

        List<SpawnRequest> third = new ArrayList<>();
        for (int r = 0; r < rowCount; r++) {
            third.add(new SpawnRequest(ZombieType.GARGANTUAR, r));
            third.add(new SpawnRequest(ZombieType.BUCKETHEAD, r));
        }
        waves.add(new WaveConfig(3, third, 300, 100));

        return waves;
    }
}
