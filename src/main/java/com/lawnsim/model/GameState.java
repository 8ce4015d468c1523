package com.lawnsim.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain snapshot of a lawn. Produced by the simulator or by any external state source;
 * holds its own copies, so nothing the snapshot owner does reaches a running simulation.
 */
public class GameState {
    public long frame;
    public int sun;
    public int wave;
    public boolean gameOver;
    public boolean win;
    // Null when the lawn has no spawner or the source does not know it
    public SpawnerProgress spawner;

    // Id counters; 0 means "after the highest id present"
    public int nextPlantId;
    public int nextZombieId;
    public int nextProjectileId;
    public int nextStrikeId;

    public List<Plant> plants = new ArrayList<>();
    public List<Zombie> zombies = new ArrayList<>();
    public List<Projectile> projectiles = new ArrayList<>();
    public List<AreaStrike> strikes = new ArrayList<>();
    public List<SeedCard> cards = new ArrayList<>();

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    public GameState() {}

    public List<Zombie> aliveZombies() {
        List<Zombie> result = new ArrayList<>();
        for (Zombie z : zombies) {
            if (z.alive) result.add(z);
        }
        return result;
    }

    public List<Plant> alivePlants() {
        List<Plant> result = new ArrayList<>();
        for (Plant p : plants) {
            if (p.alive) result.add(p);
        }
        return result;
    }
}
