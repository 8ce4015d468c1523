package com.lawnsim.service;

import com.lawnsim.config.SimulationProperties;
import com.lawnsim.engine.Action;
import com.lawnsim.engine.ActionResult;
import com.lawnsim.engine.Simulator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Scores candidate actions by playing each one out on its own copy of the lawn.
 * Copies are made on the calling thread; each worker then owns its copy outright.
 */
@Service
public class RolloutService {
    private static final Logger log = LoggerFactory.getLogger(RolloutService.class);

    private static final double SUN_WEIGHT = 0.01;

    private final ExecutorService workers;

    @Autowired
    public RolloutService(SimulationProperties properties) {
        this(Math.max(1, properties.getRolloutThreads()));
    }

    RolloutService(int threads) {
        this.workers = Executors.newFixedThreadPool(threads);
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    public RolloutResult evaluate(Simulator base, List<Action> candidates, int horizon) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("at least one candidate action is required");
        }
        if (horizon < 0) {
            throw new IllegalArgumentException("horizon must not be negative: " + horizon);
        }

        List<Callable<Branch>> tasks = new ArrayList<>(candidates.size());
        for (Action action : candidates) {
            Simulator branch = base.copy();
            tasks.add(() -> playOut(branch, action, horizon));
        }

        List<Branch> branches = new ArrayList<>(candidates.size());
        try {
            for (Future<Branch> future : workers.invokeAll(tasks)) {
                branches.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("rollout interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("rollout failed", e.getCause());
        }

        RolloutResult result = new RolloutResult();
        for (int i = 0; i < branches.size(); i++) {
            Branch b = branches.get(i);
            result.scores.add(b.score);
            result.outcomes.add(b.outcome);
            // Strictly greater: the earlier candidate keeps a tie
            if (result.bestIndex < 0 || b.score > result.bestScore) {
                result.bestIndex = i;
                result.bestScore = b.score;
            }
        }
        result.best = candidates.get(result.bestIndex);
        log.debug("[Rollout] {} candidates over {} cs, best {} scoring {}",
                candidates.size(), horizon, result.best, result.bestScore);
        return result;
    }

    private static Branch playOut(Simulator branch, Action action, int horizon) {
        ActionResult outcome = branch.apply(action);
        if (!outcome.isSuccess()) {
            return new Branch(outcome, Double.NEGATIVE_INFINITY);
        }
        branch.tickN(horizon);
        return new Branch(outcome, score(branch));
    }

    /** Higher is better. A lost lawn is the worst possible outcome. */
    public static double score(Simulator simulator) {
        if (simulator.isGameOver() && !simulator.isWin()) {
            return Double.NEGATIVE_INFINITY;
        }
        return -simulator.totalZombieHealth() + SUN_WEIGHT * simulator.getSun();
    }

    private static class Branch {
        final ActionResult outcome;
        final double score;

        Branch(ActionResult outcome, double score) {
            this.outcome = outcome;
            this.score = score;
        }
    }

    public static class RolloutResult {
        public Action best;
        public int bestIndex = -1;
        public double bestScore = Double.NEGATIVE_INFINITY;
        public List<Double> scores = new ArrayList<>();
        public List<ActionResult> outcomes = new ArrayList<>();
    }
}
