package com.lawnsim.service;

import com.lawnsim.config.SimulationProperties;
import com.lawnsim.engine.Action;
import com.lawnsim.engine.ActionResult;
import com.lawnsim.engine.GameStateSource;
import com.lawnsim.engine.Scenario;
import com.lawnsim.engine.SimulationConfig;
import com.lawnsim.engine.Simulator;
import com.lawnsim.model.GameState;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Owns the live lawn and drives it in real time: one tick per scheduler beat while running.
 * The simulator itself is single-threaded, so every access from the scheduler or from
 * request threads goes through {@link #lock}.
 */
@Service
public class SimulationService {
    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final SimulationConfig baseConfig;
    private final SimulationProperties properties;
    private final ScenarioRegistry scenarios;
    private final SnapshotPersistenceService persistence;
    private final RolloutService rollouts;

    private final Object lock = new Object();
    private Simulator simulator;
    private String scenarioName;
    private volatile boolean running = false;

    public SimulationService(SimulationConfig baseConfig,
                             SimulationProperties properties,
                             ScenarioRegistry scenarios,
                             SnapshotPersistenceService persistence,
                             RolloutService rollouts) {
        this.baseConfig = baseConfig;
        this.properties = properties;
        this.scenarios = scenarios;
        this.persistence = persistence;
        this.rollouts = rollouts;
    }

    @PostConstruct
    public void init() {
        Optional<SnapshotPersistenceService.SaveData> saved = persistence.load();
        if (saved.isPresent() && saved.get().scenario != null && scenarios.contains(saved.get().scenario)) {
            SnapshotPersistenceService.SaveData data = saved.get();
            startScenario(data.scenario);
            synchronized (lock) {
                // Older saves carry only the wave number; those resume from the start of that wave
                if (data.state.spawner == null && data.state.wave > 0) {
                    simulator.getSpawner().skipToWave(data.state.wave);
                }
                simulator.restore(data.state);
            }
            log.info("[SimulationService] Resumed '{}' at frame {}", data.scenario, data.state.frame);
        } else {
            startScenario(properties.getDefaultScenario());
        }
        running = properties.isAutostart();
    }

    @PreDestroy
    public void cleanup() {
        running = false;
        if (properties.isAutosave()) {
            saveNow();
        }
    }

    @Scheduled(fixedDelayString = "${lawnsim.autosave-interval-ms:30000}")
    public void autoSave() {
        if (properties.isAutosave() && running) {
            saveNow();
        }
    }

    @Scheduled(fixedRateString = "${lawnsim.tick-interval-ms:10}")
    public void gameLoop() {
        if (!running) {
            return;
        }
        synchronized (lock) {
            simulator.tick();
            if (simulator.isGameOver()) {
                running = false;
                log.info("[SimulationService] '{}' ended on frame {}: {}",
                        scenarioName, simulator.getFrame(), simulator.isWin() ? "cleared" : "lost");
            }
        }
    }

    public GameState startScenario(String name) {
        Scenario scenario = scenarios.get(name);
        synchronized (lock) {
            simulator = scenario.newSimulator(baseConfig);
            scenarioName = name;
            log.info("[SimulationService] Scenario '{}' loaded ({} waves, {} rows)", name,
                    scenario.waves.size(), simulator.getConfig().getRows());
            return simulator.snapshot();
        }
    }

    public void resume() {
        running = true;
    }

    public void pause() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public String getScenarioName() {
        return scenarioName;
    }

    /** Advances the live lawn by hand, outside the real-time cadence. */
    public int advance(int frames) {
        synchronized (lock) {
            return simulator.tickN(frames);
        }
    }

    public ActionResult apply(Action action) {
        synchronized (lock) {
            ActionResult result = simulator.apply(action);
            if (!result.isSuccess()) {
                log.debug("[SimulationService] {} rejected: {}", action, result);
            }
            return result;
        }
    }

    public GameState snapshot() {
        synchronized (lock) {
            return simulator.snapshot();
        }
    }

    /** Overwrites the live lawn with whatever an external source currently reports. */
    public void syncFrom(GameStateSource source) {
        GameState state = source.snapshot();
        synchronized (lock) {
            simulator.restore(state);
        }
        log.debug("[SimulationService] Synced to external state at frame {}", state.frame);
    }

    public RolloutService.RolloutResult plan(List<Action> candidates, int horizon) {
        Simulator base;
        synchronized (lock) {
            base = simulator.copy();
        }
        return rollouts.evaluate(base, candidates, horizon);
    }

    public boolean saveNow() {
        GameState state;
        String name;
        synchronized (lock) {
            state = simulator.snapshot();
            name = scenarioName;
        }
        return persistence.save(name, state);
    }
}
