package com.lawnsim.util;

import com.lawnsim.model.Zombie;
import com.lawnsim.model.type.PlantType;
import com.lawnsim.model.type.ZombieType;
import com.lawnsim.util.DamageUtil.InstantWeapon;
import com.lawnsim.util.DamageUtil.StrikeReport;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class DamageUtilTest {

    private static final double DELTA = 1e-9;

    private static Zombie zombieWith(int shield, int armor, int body) {
        Zombie z = new Zombie(ZombieType.ZOMBIE, 0, 500);
        z.shieldHealth = shield;
        z.armorHealth = armor;
        z.bodyHealth = body;
        return z;
    }

    // ========================================================================
    // Layer ordering
    // ========================================================================

    @Test
    public void testShieldAbsorbsBeforeBody() {
        Zombie z = new Zombie(ZombieType.SCREENDOOR, 0, 500);
        assertFalse(DamageUtil.applyDamage(z, 1000));
        assertEquals(100, z.shieldHealth);
        assertEquals(200, z.bodyHealth);

        assertTrue(DamageUtil.applyDamage(z, 300));
        assertEquals(0, z.shieldHealth);
        assertEquals(0, z.bodyHealth);
        assertFalse(z.alive);
    }

    @Test
    public void testConeTakesPeaDamageFirst() {
        Zombie z = new Zombie(ZombieType.CONEHEAD, 0, 500);
        DamageUtil.applyDamage(z, 20);
        assertEquals(350, z.armorHealth);
        assertEquals(200, z.bodyHealth);
    }

    @Test
    public void testLayerOrderingAcrossGrid() {
        int[] shields = {0, 50, 370};
        int[] armors = {0, 100, 1100};
        int[] bodies = {1, 200, 3000};
        int[] damages = {0, 1, 49, 370, 1500, 5000};

        for (int s : shields) {
            for (int a : armors) {
                for (int b : bodies) {
                    for (int d : damages) {
                        Zombie z = zombieWith(s, a, b);
                        boolean killed = DamageUtil.applyDamage(z, d);
                        String ctx = "S=" + s + " A=" + a + " B=" + b + " D=" + d;

                        assertEquals(ctx, Math.max(0, s + a + b - d), z.totalHealth());
                        assertTrue(ctx, z.shieldHealth >= 0 && z.armorHealth >= 0 && z.bodyHealth >= 0);
                        if (d < s) {
                            assertEquals(ctx, a, z.armorHealth);
                            assertEquals(ctx, b, z.bodyHealth);
                        }
                        if (d < s + a) {
                            assertEquals(ctx, b, z.bodyHealth);
                        }
                        assertEquals(ctx, d >= s + a + b, killed);
                        assertEquals(ctx, !killed, z.alive);
                    }
                }
            }
        }
    }

    @Test
    public void testDeadZombieTakesNoFurtherDamage() {
        Zombie z = new Zombie(ZombieType.ZOMBIE, 0, 500);
        assertTrue(DamageUtil.applyDamage(z, 500));
        assertFalse(DamageUtil.applyDamage(z, 500));
        assertEquals(0, z.bodyHealth);
    }

    // ========================================================================
    // Instant kills
    // ========================================================================

    @Test
    public void testGiantsTakeHalfFromEveryInstantWeapon() {
        for (InstantWeapon weapon : InstantWeapon.values()) {
            int normal = DamageUtil.instantDamage(ZombieType.ZOMBIE, weapon);
            assertEquals(weapon.name(), normal, weapon.getBaseDamage());
            assertEquals(weapon.name(), normal / 2, DamageUtil.instantDamage(ZombieType.GARGANTUAR, weapon));
            assertEquals(weapon.name(), normal / 2, DamageUtil.instantDamage(ZombieType.GIGA_GARGANTUAR, weapon));
        }
        assertEquals(900, DamageUtil.instantDamage(ZombieType.GARGANTUAR, InstantWeapon.COB));
    }

    @Test
    public void testInstantKillClearsBucket() {
        Zombie bucket = new Zombie(ZombieType.BUCKETHEAD, 0, 500);
        assertTrue(DamageUtil.applyDamage(bucket, DamageUtil.instantDamage(bucket.type, InstantWeapon.CHERRY_BOMB)));
    }

    // ========================================================================
    // Analytics
    // ========================================================================

    @Test
    public void testHitsToKill() {
        assertEquals(10, DamageUtil.hitsToKill(200, 20));
        assertEquals(11, DamageUtil.hitsToKill(201, 20));
        assertEquals(DamageUtil.UNKILLABLE, DamageUtil.hitsToKill(100, 0));
    }

    @Test
    public void testCobsNeeded() {
        assertEquals(1, DamageUtil.cobsNeededToKill(ZombieType.ZOMBIE, 200));
        assertEquals(4, DamageUtil.cobsNeededToKill(ZombieType.GARGANTUAR, 3000));
        assertEquals(7, DamageUtil.cobsNeededToKill(ZombieType.GIGA_GARGANTUAR, 6000));
    }

    @Test
    public void testOverkillAndEfficiency() {
        assertEquals(500, DamageUtil.overkill(1800, 1300));
        assertEquals(0, DamageUtil.overkill(900, 3000));
        assertEquals(0.5, DamageUtil.efficiency(1800, 900), DELTA);
        assertEquals(1.0, DamageUtil.efficiency(900, 3000), DELTA);
        assertEquals(0.0, DamageUtil.efficiency(0, 3000), DELTA);
    }

    @Test
    public void testPlantDps() {
        double pea = 20.0 / 141;
        assertEquals(pea, DamageUtil.plantDps(PlantType.PEASHOOTER), DELTA);
        assertEquals(pea * 2, DamageUtil.plantDps(PlantType.REPEATER), DELTA);
        assertEquals(pea * 4, DamageUtil.plantDps(PlantType.GATLINGPEA), DELTA);
        assertEquals(0.0, DamageUtil.plantDps(PlantType.WALLNUT), DELTA);

        assertEquals(1410.0, DamageUtil.timeToKill(200, pea), 1e-6);
        assertTrue(Double.isInfinite(DamageUtil.timeToKill(200, 0)));
    }

    @Test
    public void testEvaluateStrikeLeavesTargetsUntouched() {
        Zombie plain = new Zombie(ZombieType.ZOMBIE, 2, 500);
        Zombie bucket = new Zombie(ZombieType.BUCKETHEAD, 2, 520);
        Zombie garg = new Zombie(ZombieType.GARGANTUAR, 2, 540);

        StrikeReport report = DamageUtil.evaluateStrike(Arrays.asList(plain, bucket, garg), InstantWeapon.COB);

        assertEquals(4500, report.totalHp);
        assertEquals(4500, report.totalDamage);
        assertEquals(2400, report.usefulDamage);
        assertEquals(2100, report.wastedDamage);
        assertEquals(2, report.kills);
        assertEquals(2400.0 / 4500, report.getEfficiency(), DELTA);

        assertEquals(3000, garg.bodyHealth);
        assertTrue(plain.alive);
    }
}
