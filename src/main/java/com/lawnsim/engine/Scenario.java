package com.lawnsim.engine;

import com.lawnsim.model.type.Scene;

import java.util.ArrayList;
import java.util.List;

/**
 * A named level: which waves come and, optionally, the scene and starting sun it is played with.
 */
public class Scenario {
    public String name;
    public String description = "";
    // Null keeps the configured scene
    public Scene scene;
    // Negative keeps the configured starting sun
    public int initialSun = -1;
    public int initialDelay = WaveSpawner.DEFAULT_INITIAL_DELAY;
    public List<WaveConfig> waves = new ArrayList<>();

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    public Scenario() {}

    public Scenario(String name, String description, List<WaveConfig> waves) {
        this.name = name;
        this.description = description;
        this.waves = new ArrayList<>(waves);
    }

    public SimulationConfig applyTo(SimulationConfig base) {
        SimulationConfig.Builder builder = base.toBuilder();
        if (scene != null && scene != base.getScene()) {
            builder.scene(scene).rows(0);
        }
        if (initialSun >= 0) {
            builder.initialSun(initialSun);
        }
        return builder.build();
    }

    /** Fresh simulator with this scenario's waves attached. */
    public Simulator newSimulator(SimulationConfig base) {
        Simulator simulator = new Simulator(applyTo(base));
        simulator.attachSpawner(new WaveSpawner(waves, initialDelay));
        return simulator;
    }
}
