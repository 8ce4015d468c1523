package com.lawnsim.engine;

import com.lawnsim.model.SpawnerProgress;
import com.lawnsim.model.SpawnerProgress.Phase;
import com.lawnsim.model.type.ZombieType;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class WaveSpawnerTest {

    private static List<WaveConfig> twoZombieWave() {
        return Collections.singletonList(new WaveConfig(1, Arrays.asList(
                new SpawnRequest(ZombieType.ZOMBIE, 0),
                new SpawnRequest(ZombieType.CONEHEAD, 1)), 0, 3));
    }

    /** Runs the spawner to completion and returns every request in emission order. */
    private static List<SpawnRequest> drain(WaveSpawner spawner) {
        List<SpawnRequest> all = new ArrayList<>();
        long frame = 0;
        while (!spawner.isFinished()) {
            List<SpawnRequest> batch = spawner.update(++frame);
            assertTrue("more than one spawn on frame " + frame, batch.size() <= 1);
            all.addAll(batch);
            assertTrue("spawner never finished", frame < 1_000_000);
        }
        return all;
    }

    // ========================================================================
    // Timing
    // ========================================================================

    @Test
    public void testInitialDelayThenSpacedSpawns() {
        WaveSpawner spawner = new WaveSpawner(twoZombieWave(), 2);

        assertTrue(spawner.update(1).isEmpty());
        assertEquals(Phase.WAITING, spawner.getState());
        assertTrue(spawner.update(2).isEmpty());
        assertEquals(Phase.SPAWNING, spawner.getState());

        assertEquals(Collections.singletonList(new SpawnRequest(ZombieType.ZOMBIE, 0)), spawner.update(3));
        assertEquals(1, spawner.getRemainingZombiesInWave());
        for (long f = 4; f <= 6; f++) {
            assertTrue("frame " + f, spawner.update(f).isEmpty());
        }
        assertEquals(Collections.singletonList(new SpawnRequest(ZombieType.CONEHEAD, 1)), spawner.update(7));
        assertTrue(spawner.isFinished());
        assertEquals(0, spawner.getTotalRemainingZombies());
    }

    @Test
    public void testEmptyWaveListFinishesAfterDelay() {
        WaveSpawner spawner = new WaveSpawner(new ArrayList<>(), 1);
        assertTrue(spawner.update(1).isEmpty());
        assertTrue(spawner.isFinished());
    }

    // ========================================================================
    // Totals
    // ========================================================================

    @Test
    public void testStandardPresetEmitsEveryZombieOnce() {
        WaveSpawner spawner = new WaveSpawner(WavePresets.standard(10, 5));
        assertEquals(52, spawner.getTotalZombies());

        List<SpawnRequest> emitted = drain(spawner);
        assertEquals(52, emitted.size());
        for (SpawnRequest request : emitted) {
            assertTrue(request.row >= 0 && request.row < 5);
        }
    }

    @Test
    public void testHugeWaves() {
        assertTrue(WavePresets.isHugeWave(10));
        assertTrue(WavePresets.isHugeWave(20));
        assertFalse(WavePresets.isHugeWave(9));
        assertFalse(WavePresets.isHugeWave(0));
        assertEquals(14, WavePresets.standard(10, 5).get(9).size());
    }

    @Test
    public void testGargantuarPresetLastWave() {
        List<WaveConfig> waves = WavePresets.gargantuar(6);
        assertEquals(3, waves.size());
        assertEquals(12, waves.get(2).size());
        assertEquals(ZombieType.GARGANTUAR, waves.get(2).zombies.get(0).type);
        assertEquals(5, waves.get(2).zombies.get(10).row);
    }

    // ========================================================================
    // Skipping, resetting and copying
    // ========================================================================

    @Test
    public void testSkipToWaveStartsThatWaveFresh() {
        WaveSpawner spawner = new WaveSpawner(WavePresets.gargantuar(5));
        spawner.skipToWave(2);

        assertEquals(Phase.SPAWNING, spawner.getState());
        assertEquals(2, spawner.getCurrentWave());
        assertEquals(10, spawner.getRemainingZombiesInWave());

        // Wave 2 has a 200 cs lead-in
        for (long f = 1; f <= 200; f++) {
            assertTrue(spawner.update(f).isEmpty());
        }
        assertEquals(Collections.singletonList(new SpawnRequest(ZombieType.CONEHEAD, 0)), spawner.update(201));
    }

    @Test
    public void testSkipPastEndFinishes() {
        WaveSpawner spawner = new WaveSpawner(WavePresets.gargantuar(5));
        spawner.skipToWave(99);

        assertTrue(spawner.isFinished());
        assertEquals(0, spawner.getRemainingWaves());
        assertEquals(3, spawner.getCurrentWave());
        assertTrue(spawner.update(1).isEmpty());
    }

    @Test
    public void testResetRestoresInitialState() {
        WaveSpawner spawner = new WaveSpawner(twoZombieWave(), 2);
        drain(spawner);
        spawner.reset();

        assertEquals(Phase.WAITING, spawner.getState());
        assertEquals(2, spawner.getTotalRemainingZombies());
        assertEquals(2, drain(spawner).size());
    }

    @Test
    public void testCopyAdvancesIndependently() {
        WaveSpawner spawner = new WaveSpawner(twoZombieWave(), 2);
        spawner.update(1);
        WaveSpawner clone = spawner.copy();

        drain(clone);

        assertTrue(clone.isFinished());
        assertEquals(Phase.WAITING, spawner.getState());
        assertEquals(2, spawner.getTotalRemainingZombies());
    }

    // ========================================================================
    // Saved progress
    // ========================================================================

    @Test
    public void testRestoredProgressContinuesMidWave() {
        WaveSpawner original = new WaveSpawner(twoZombieWave(), 2);
        for (long f = 1; f <= 4; f++) {
            original.update(f);
        }
        WaveSpawner resumed = new WaveSpawner(twoZombieWave(), 2);
        resumed.restoreProgress(original.saveProgress());

        assertEquals(1, resumed.getRemainingZombiesInWave());
        for (long f = 5; f <= 7; f++) {
            assertEquals("frame " + f, original.update(f), resumed.update(f));
        }
        assertTrue(resumed.isFinished());
    }

    @Test
    public void testRestoredProgressKeepsInitialDelay() {
        WaveSpawner original = new WaveSpawner(twoZombieWave(), 5);
        original.update(1);
        original.update(2);
        WaveSpawner resumed = new WaveSpawner(twoZombieWave(), 5);
        resumed.restoreProgress(original.saveProgress());

        assertTrue(resumed.update(3).isEmpty());
        assertTrue(resumed.update(4).isEmpty());
        assertEquals(Phase.WAITING, resumed.getState());
        assertTrue(resumed.update(5).isEmpty());
        assertEquals(Phase.SPAWNING, resumed.getState());
        assertEquals(Collections.singletonList(new SpawnRequest(ZombieType.ZOMBIE, 0)), resumed.update(6));
    }

    @Test
    public void testRestoredFinishedProgressEmitsNothing() {
        WaveSpawner original = new WaveSpawner(twoZombieWave(), 2);
        drain(original);
        WaveSpawner resumed = new WaveSpawner(twoZombieWave(), 2);
        resumed.restoreProgress(original.saveProgress());

        assertTrue(resumed.isFinished());
        assertEquals(0, resumed.getTotalRemainingZombies());
        assertTrue(resumed.update(1).isEmpty());
    }

    @Test
    public void testRestoreRejectsProgressBeyondWaves() {
        WaveSpawner spawner = new WaveSpawner(twoZombieWave(), 2);
        SpawnerProgress bogus = spawner.saveProgress();
        bogus.waveIndex = 3;
        try {
            spawner.restoreProgress(bogus);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            assertEquals(Phase.WAITING, spawner.getState());
            assertEquals(2, spawner.getTotalRemainingZombies());
        }

        SpawnerProgress tooFar = spawner.saveProgress();
        tooFar.zombieIndex = 3;
        try {
            spawner.restoreProgress(tooFar);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            assertEquals(2, spawner.getRemainingZombiesInWave());
        }
    }
}
