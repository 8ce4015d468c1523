package com.lawnsim.util;

import com.lawnsim.model.Zombie;
import com.lawnsim.model.type.PlantType;
import com.lawnsim.model.type.Scene;
import com.lawnsim.model.type.ZombieType;
import com.lawnsim.util.TimingUtil.InterceptPlan;
import com.lawnsim.util.TimingUtil.SplashTarget;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.Assert.*;

public class TimingUtilTest {

    private static final double DELTA = 1e-6;

    // ========================================================================
    // Waiting and intercepts
    // ========================================================================

    @Test
    public void testWaitTime() {
        // 340 px to column 4 at 0.23 px/cs, minus the cob's flight
        assertEquals(340 / 0.23 - 373, TimingUtil.waitTime(700, 0.23, 360, 373), DELTA);
        assertEquals(0.0, TimingUtil.waitTime(370, 0.23, 360, 373), DELTA);
        assertEquals(0.0, TimingUtil.waitTime(700, 0, 360, 373), DELTA);
    }

    @Test
    public void testCobInterceptLandsOnTargetColumn() {
        InterceptPlan plan = TimingUtil.cobIntercept(700, 0.23, 4, TimingUtil.COB_FLY_TIME);
        assertEquals(340 / 0.23 - 373, plan.fireDelay, DELTA);
        assertEquals(340 / 0.23, plan.impactTime, DELTA);
        assertEquals(360.0, plan.impactX, DELTA);
    }

    @Test
    public void testInstantInterceptUsesFuse() {
        InterceptPlan plan = TimingUtil.instantIntercept(700, 0.23, 4, PlantType.CHERRY_BOMB);
        assertEquals(340 / 0.23 - 100, plan.fireDelay, DELTA);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInstantInterceptRejectsNonInstant() {
        TimingUtil.instantIntercept(700, 0.23, 4, PlantType.WALLNUT);
    }

    @Test
    public void testSafeTimeAndReach() {
        assertEquals(1000.0, TimingUtil.safeTime(430, 0.23), DELTA);
        assertEquals(0.0, TimingUtil.timeToReach(100, 200, 0.23), DELTA);
        assertTrue(Double.isInfinite(TimingUtil.timeToReach(500, 200, 0)));
    }

    @Test
    public void testCobFlyTimeByScene() {
        assertEquals(373, TimingUtil.cobFlyTime(Scene.DAY, 3));
        assertEquals(373, TimingUtil.cobFlyTime(Scene.POOL, 0));
        assertEquals(373, TimingUtil.cobFlyTime(Scene.ROOF, 8));
    }

    @Test
    public void testRoofCobFlyTimeFollowsLandingColumn() {
        assertEquals(359, TimingUtil.cobFlyTime(Scene.ROOF, 0));
        assertEquals(359, TimingUtil.cobFlyTime(Scene.ROOF, 1));
        assertEquals(362, TimingUtil.cobFlyTime(Scene.ROOF, 2));
        assertEquals(364, TimingUtil.cobFlyTime(Scene.ROOF_NIGHT, 3));
        assertEquals(367, TimingUtil.cobFlyTime(Scene.ROOF, 4));
        assertEquals(372, TimingUtil.cobFlyTime(Scene.ROOF, 6));
        assertEquals(373, TimingUtil.cobFlyTime(Scene.ROOF, 7));
        assertEquals(373, TimingUtil.cobFlyTime(Scene.ROOF, 8));
        assertEquals(373, TimingUtil.cobFlyTime(Scene.ROOF, -1));
    }

    // ========================================================================
    // Splash target selection
    // ========================================================================

    @Test
    public void testBestSplashTargetPrefersFirstOnTie() {
        Zombie a = new Zombie(ZombieType.ZOMBIE, 2, 500);
        Zombie b = new Zombie(ZombieType.ZOMBIE, 2, 550);
        Zombie c = new Zombie(ZombieType.ZOMBIE, 3, 600);
        Zombie d = new Zombie(ZombieType.ZOMBIE, 0, 700);

        Optional<SplashTarget> best = TimingUtil.bestSplashTarget(Arrays.asList(a, b, c, d), 0, 115);

        assertTrue(best.isPresent());
        assertEquals(3, best.get().hits);
        assertEquals(500.0, best.get().x, DELTA);
        assertEquals(2, best.get().row);
    }

    @Test
    public void testBestSplashTargetPredictsMovement() {
        Zombie lone = new Zombie(ZombieType.ZOMBIE, 1, 500);
        SplashTarget best = TimingUtil.bestSplashTarget(Arrays.asList(lone), 100, 115).get();
        assertEquals(477.0, best.x, DELTA);
        assertEquals(1, best.hits);
    }

    @Test
    public void testBestSplashTargetIgnoresDeadAndHandlesEmpty() {
        assertFalse(TimingUtil.bestSplashTarget(new ArrayList<>(), 0, 115).isPresent());

        Zombie dead = new Zombie(ZombieType.ZOMBIE, 1, 500);
        dead.alive = false;
        assertFalse(TimingUtil.bestSplashTarget(Arrays.asList(dead), 0, 115).isPresent());
    }
}
