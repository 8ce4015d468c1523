package com.lawnsim.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lawnsim.engine.Scenario;
import com.lawnsim.engine.SimulationConfig;
import com.lawnsim.engine.Simulator;
import com.lawnsim.model.type.Scene;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;

import static org.junit.Assert.*;

public class ScenarioRegistryTest {

    private ScenarioRegistry registry;

    @Before
    public void setUp() {
        registry = new ScenarioRegistry(SimulationConfig.defaults(), new ObjectMapper());
    }

    @Test
    public void testBuiltInScenarios() {
        assertTrue(registry.contains("standard"));
        assertTrue(registry.contains("gargantuar"));
        assertEquals(10, registry.get("standard").waves.size());
        assertEquals(3, registry.get("gargantuar").waves.size());
    }

    @Test
    public void testBundledScenariosAreLoaded() {
        assertTrue(registry.names().contains("roof-gargantuar"));
        assertTrue(registry.names().contains("pool-rush"));
    }

    @Test
    public void testRoofScenarioOverridesSceneAndSun() {
        Simulator sim = registry.get("roof-gargantuar").newSimulator(SimulationConfig.defaults());

        assertEquals(Scene.ROOF, sim.getConfig().getScene());
        assertEquals(5, sim.getConfig().getRows());
        assertEquals(2000, sim.getSun());
        assertEquals(2, sim.getSpawner().getTotalWaves());
    }

    @Test
    public void testPoolScenarioHasSixRows() {
        Simulator sim = registry.get("pool-rush").newSimulator(SimulationConfig.defaults());

        assertEquals(6, sim.getConfig().getRows());
        // Keeps the configured starting sun
        assertEquals(50, sim.getSun());
        assertEquals(8, sim.getSpawner().getTotalZombies());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownScenario() {
        registry.get("moonbase");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRegisterNeedsName() {
        registry.register(new Scenario(" ", "", new ArrayList<>()));
    }

    @Test
    public void testRegisterReplacesByName() {
        registry.register(new Scenario("standard", "empty", new ArrayList<>()));
        assertEquals("empty", registry.get("standard").description);
        assertTrue(registry.get("standard").waves.isEmpty());
    }
}
