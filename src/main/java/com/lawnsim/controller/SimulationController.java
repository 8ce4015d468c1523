package com.lawnsim.controller;

import com.lawnsim.engine.Action;
import com.lawnsim.engine.ActionResult;
import com.lawnsim.model.GameState;
import com.lawnsim.service.RolloutService;
import com.lawnsim.service.SimulationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sim")
public class SimulationController {
    private final SimulationService simulation;

    public SimulationController(SimulationService simulation) { this.simulation = simulation; }

    @GetMapping("/snapshot")
    public GameState getSnapshot() {
        return simulation.snapshot();
    }

    @PostMapping("/actions")
    public Map<String, Object> applyAction(@RequestBody Action action) {
        ActionResult result = simulation.apply(action);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("result", result);
        body.put("success", result.isSuccess());
        body.put("frame", simulation.snapshot().frame);
        return body;
    }

    @PostMapping("/tick")
    public Map<String, Object> tick(@RequestParam(defaultValue = "1") int frames) {
        int ran = simulation.advance(frames);
        GameState state = simulation.snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ran", ran);
        body.put("frame", state.frame);
        body.put("gameOver", state.gameOver);
        body.put("win", state.win);
        return body;
    }

    @PostMapping("/scenario/{name}")
    public GameState startScenario(@PathVariable String name, @RequestParam(defaultValue = "false") boolean run) {
        GameState state = simulation.startScenario(name);
        if (run) {
            simulation.resume();
        }
        return state;
    }

    @PostMapping("/plan")
    public RolloutService.RolloutResult plan(@RequestBody List<Action> candidates,
                                             @RequestParam(defaultValue = "500") int horizon) {
        return simulation.plan(candidates, horizon);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
