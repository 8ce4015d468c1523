package com.lawnsim.controller;

import com.lawnsim.engine.Action;
import com.lawnsim.engine.ActionResult;
import com.lawnsim.model.GameState;
import com.lawnsim.model.type.PlantType;
import com.lawnsim.service.RolloutService;
import com.lawnsim.service.SimulationService;
import org.junit.Before;
import org.junit.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class SimulationControllerTest {

    private SimulationService simulation;
    private SimulationController controller;
    private GameState state;

    @Before
    public void setUp() {
        simulation = mock(SimulationService.class);
        controller = new SimulationController(simulation);
        state = new GameState();
        state.frame = 12;
        when(simulation.snapshot()).thenReturn(state);
    }

    @Test
    public void testSnapshot() {
        assertSame(state, controller.getSnapshot());
    }

    @Test
    public void testApplyActionReportsResult() {
        Action action = Action.place(PlantType.PEASHOOTER, 0, 0);
        when(simulation.apply(action)).thenReturn(ActionResult.INSUFFICIENT_RESOURCE);

        Map<String, Object> body = controller.applyAction(action);

        assertEquals(ActionResult.INSUFFICIENT_RESOURCE, body.get("result"));
        assertEquals(false, body.get("success"));
        assertEquals(12L, body.get("frame"));
    }

    @Test
    public void testTickReportsFramesRun() {
        when(simulation.advance(5)).thenReturn(3);
        state.gameOver = true;

        Map<String, Object> body = controller.tick(5);

        assertEquals(3, body.get("ran"));
        assertEquals(true, body.get("gameOver"));
        assertEquals(false, body.get("win"));
    }

    @Test
    public void testStartScenarioOptionallyRuns() {
        when(simulation.startScenario("standard")).thenReturn(state);

        assertSame(state, controller.startScenario("standard", false));
        verify(simulation, never()).resume();

        controller.startScenario("standard", true);
        verify(simulation).resume();
    }

    @Test
    public void testPlanDelegates() {
        List<Action> candidates = Arrays.asList(Action.waitAction());
        RolloutService.RolloutResult result = new RolloutService.RolloutResult();
        when(simulation.plan(candidates, 300)).thenReturn(result);

        assertSame(result, controller.plan(candidates, 300));
    }

    @Test
    public void testBadRequestCarriesMessage() {
        when(simulation.startScenario(any())).thenThrow(new IllegalArgumentException("unknown scenario 'x'"));
        try {
            controller.startScenario("x", false);
            fail("expected the service error to propagate");
        } catch (IllegalArgumentException e) {
            ResponseEntity<Map<String, String>> response = controller.badRequest(e);
            assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
            assertEquals("unknown scenario 'x'", response.getBody().get("error"));
        }
    }
}
