package com.lawnsim.util;

import com.lawnsim.model.Zombie;
import com.lawnsim.model.type.ZombieType;
import com.lawnsim.util.GargantuarUtil.ThreatSummary;
import org.junit.Test;

import static org.junit.Assert.*;

public class GargantuarUtilTest {

    @Test
    public void testImpThresholds() {
        assertTrue(GargantuarUtil.willThrowImp(ZombieType.GARGANTUAR, 1500, 0));
        assertFalse(GargantuarUtil.willThrowImp(ZombieType.GARGANTUAR, 1501, 0));
        assertFalse(GargantuarUtil.willThrowImp(ZombieType.GARGANTUAR, 100, 1));

        assertTrue(GargantuarUtil.willThrowImp(ZombieType.GIGA_GARGANTUAR, 3000, 0));
        assertTrue(GargantuarUtil.willThrowImp(ZombieType.GIGA_GARGANTUAR, 1500, 1));
        assertFalse(GargantuarUtil.willThrowImp(ZombieType.GIGA_GARGANTUAR, 1501, 1));
        assertFalse(GargantuarUtil.willThrowImp(ZombieType.GIGA_GARGANTUAR, 100, 2));

        assertFalse(GargantuarUtil.willThrowImp(ZombieType.BUCKETHEAD, 1, 0));
    }

    @Test
    public void testDamageToTriggerImp() {
        assertEquals(1500, GargantuarUtil.damageToTriggerImp(ZombieType.GARGANTUAR, 3000, 0));
        assertEquals(0, GargantuarUtil.damageToTriggerImp(ZombieType.GARGANTUAR, 1000, 0));
        assertEquals(0, GargantuarUtil.damageToTriggerImp(ZombieType.GARGANTUAR, 3000, 1));
        assertEquals(1500, GargantuarUtil.damageToTriggerImp(ZombieType.GIGA_GARGANTUAR, 3000, 1));
    }

    @Test
    public void testCanThrowNow() {
        Zombie garg = new Zombie(ZombieType.GARGANTUAR, 1, 700);
        assertFalse(GargantuarUtil.canThrowNow(garg));

        garg.bodyHealth = 1500;
        assertTrue(GargantuarUtil.canThrowNow(garg));

        garg.eating = true;
        assertFalse(GargantuarUtil.canThrowNow(garg));
        garg.eating = false;

        garg.x = 400;
        assertFalse(GargantuarUtil.canThrowNow(garg));
    }

    @Test
    public void testImpLandingClampsToLawnEdge() {
        assertEquals(400.0, GargantuarUtil.impLandingX(700), 1e-9);
        assertEquals(Geometry.LAWN_LEFT_X, GargantuarUtil.impLandingX(200), 1e-9);
    }

    @Test
    public void testHammerTiming() {
        assertTrue(GargantuarUtil.isHammerComing(0.7));
        assertFalse(GargantuarUtil.isHammerComing(0.6));
        assertEquals(14.4, GargantuarUtil.timeToHammer(0.5, 0.01), 1e-9);
        assertEquals(0.0, GargantuarUtil.timeToHammer(0.9, 0.01), 1e-9);
        assertTrue(Double.isInfinite(GargantuarUtil.timeToHammer(0.1, 0)));
    }

    @Test
    public void testRemainingHpAfterCobs() {
        assertEquals(1200, GargantuarUtil.remainingHpAfterCobs(ZombieType.GARGANTUAR, 3000, 2));
        assertEquals(0, GargantuarUtil.remainingHpAfterCobs(ZombieType.GARGANTUAR, 3000, 5));
    }

    @Test
    public void testAnalyzeThreat() {
        Zombie garg = new Zombie(ZombieType.GARGANTUAR, 1, 700);
        ThreatSummary summary = GargantuarUtil.analyzeThreat(garg, 200);

        assertEquals(ZombieType.GARGANTUAR, summary.type);
        assertEquals(100.0, summary.hpPercentage, 1e-9);
        assertEquals(4, summary.cobsNeeded);
        assertEquals(500 / GargantuarUtil.GIGA_AVERAGE_SPEED, summary.arrivalTime, 1e-6);
        assertFalse(summary.impPending);
        assertFalse(summary.high);

        Zombie giga = new Zombie(ZombieType.GIGA_GARGANTUAR, 1, 700);
        assertTrue(GargantuarUtil.analyzeThreat(giga, 200).high);
    }
}
