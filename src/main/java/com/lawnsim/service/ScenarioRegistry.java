package com.lawnsim.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lawnsim.engine.Scenario;
import com.lawnsim.engine.SimulationConfig;
import com.lawnsim.engine.WavePresets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Named scenarios: the built-in wave presets plus every JSON file under {@code classpath:scenarios/}.
 */
@Service
public class ScenarioRegistry {
    private static final Logger log = LoggerFactory.getLogger(ScenarioRegistry.class);

    static final String BUNDLED_PATTERN = "classpath*:scenarios/*.json";

    private final Map<String, Scenario> scenarios = new TreeMap<>();
    private final ObjectMapper mapper;

    public ScenarioRegistry(SimulationConfig config, ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        registerDefaults(config.getRows());
        loadBundled();
    }

    private void registerDefaults(int rows) {
        register(new Scenario("standard", "Ten escalating waves, huge wave last",
                WavePresets.standard(10, rows)));
        register(new Scenario("gargantuar", "Warm-up waves followed by a gargantuar in every row",
                WavePresets.gargantuar(rows)));
    }

    private void loadBundled() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(BUNDLED_PATTERN);
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    register(mapper.readValue(in, Scenario.class));
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("[Scenarios] Skipping {}: {}", resource.getFilename(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("[Scenarios] Could not scan bundled scenarios: {}", e.getMessage());
        }
        log.info("[Scenarios] {} scenarios registered: {}", scenarios.size(), scenarios.keySet());
    }

    public void register(Scenario scenario) {
        if (scenario.name == null || scenario.name.isBlank()) {
            throw new IllegalArgumentException("scenario needs a name");
        }
        scenarios.put(scenario.name, scenario);
    }

    public Scenario get(String name) {
        Scenario scenario = scenarios.get(name);
        if (scenario == null) {
            throw new IllegalArgumentException("unknown scenario '" + name + "', known: " + scenarios.keySet());
        }
        return scenario;
    }

    public boolean contains(String name) {
        return scenarios.containsKey(name);
    }

    public Set<String> names() {
        return scenarios.keySet();
    }
}
