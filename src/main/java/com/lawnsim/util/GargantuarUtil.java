package com.lawnsim.util;

import com.lawnsim.model.Zombie;
import com.lawnsim.model.type.ZombieType;

/**
 * Hammer and imp-throw rules for the giant archetypes.
 */
public final class GargantuarUtil {

    public static final double HAMMER_CIRCULATION_RATE = 0.644;
    public static final int HAMMER_TIME = 105;
    public static final int IMP_THROW_TIME = 105;

    public static final double FIRST_IMP_THRESHOLD = 0.5;
    public static final double SECOND_IMP_THRESHOLD = 0.25;
    // Giants only throw while they still have room in front of them
    public static final double IMP_THROW_MIN_X = 400;
    public static final double IMP_THROW_DISTANCE = 300;

    // Walking speed averaged over the smash pauses
    public static final double GIGA_AVERAGE_SPEED = 484.0 / 3158.0 * 1.25;

    private GargantuarUtil() {}

    public static boolean isHammerComing(double animationProgress) {
        return animationProgress > HAMMER_CIRCULATION_RATE;
    }

    public static double timeToHammer(double animationProgress, double animationSpeed) {
        if (animationProgress >= HAMMER_CIRCULATION_RATE) {
            return 0.0;
        }
        if (animationSpeed <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return (HAMMER_CIRCULATION_RATE - animationProgress) / animationSpeed;
    }

    public static int impThreshold(ZombieType type, int impsThrown) {
        double ratio = impsThrown == 0 ? FIRST_IMP_THRESHOLD : SECOND_IMP_THRESHOLD;
        return (int) (type.getBodyHealth() * ratio);
    }

    /** Whether the next imp is due at this body health. */
    public static boolean willThrowImp(ZombieType type, int bodyHealth, int impsThrown) {
        if (impsThrown >= type.getImpCount()) {
            return false;
        }
        return bodyHealth <= impThreshold(type, impsThrown);
    }

    public static boolean canThrowNow(Zombie zombie) {
        return zombie.alive
                && !zombie.eating
                && zombie.throwCountdown == 0
                && zombie.x > IMP_THROW_MIN_X
                && willThrowImp(zombie.type, zombie.bodyHealth, zombie.impsThrown);
    }

    public static int damageToTriggerImp(ZombieType type, int bodyHealth, int impsThrown) {
        if (impsThrown >= type.getImpCount()) {
            return 0;
        }
        return Math.max(0, bodyHealth - impThreshold(type, impsThrown));
    }

    public static double impLandingX(double throwerX) {
        return Math.max(throwerX - IMP_THROW_DISTANCE, Geometry.LAWN_LEFT_X);
    }

    public static int remainingHpAfterCobs(ZombieType type, int hp, int cobs) {
        return Math.max(0, hp - cobs * DamageUtil.instantDamage(type, DamageUtil.InstantWeapon.COB));
    }

    public static ThreatSummary analyzeThreat(Zombie zombie, double defendX) {
        ThreatSummary summary = new ThreatSummary();
        summary.type = zombie.type;
        summary.hpPercentage = 100.0 * zombie.bodyHealth / zombie.type.getBodyHealth();
        summary.cobsNeeded = DamageUtil.cobsNeededToKill(zombie.type, zombie.totalHealth());
        summary.arrivalTime = TimingUtil.timeToReach(zombie.x, defendX, GIGA_AVERAGE_SPEED);
        summary.impPending = willThrowImp(zombie.type, zombie.bodyHealth, zombie.impsThrown);
        summary.high = zombie.type == ZombieType.GIGA_GARGANTUAR || zombie.x < IMP_THROW_MIN_X;
        return summary;
    }

    public static class ThreatSummary {
        public ZombieType type;
        public double hpPercentage;
        public int cobsNeeded;
        public double arrivalTime;
        public boolean impPending;
        public boolean high;
    }
}
