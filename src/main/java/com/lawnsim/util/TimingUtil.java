package com.lawnsim.util;

import com.lawnsim.model.Zombie;
import com.lawnsim.model.type.PlantType;
import com.lawnsim.model.type.Scene;

import java.util.List;
import java.util.Optional;

/**
 * Lead-time solving for cob shots and instant plants, plus splash target selection.
 * All times are centiseconds.
 */
public final class TimingUtil {

    public static final int COB_FLY_TIME = 373;
    public static final int COB_RECOVER_TIME = 3475;
    // Indexed by the firing cannon's column on the roof
    public static final int[] ROOF_COB_FLY_TIMES = {359, 362, 364, 367, 369, 372, 373};

    public static final double SAFE_X = 200;

    private TimingUtil() {}

    public static double predictPosition(double x, double speed, double time) {
        return x - speed * time;
    }

    public static double timeToReach(double x, double targetX, double speed) {
        if (x <= targetX) {
            return 0.0;
        }
        if (speed <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return (x - targetX) / speed;
    }

    public static double safeTime(double x, double speed) {
        return timeToReach(x, SAFE_X, speed);
    }

    /**
     * Flight time of a cob landing in {@code landingCol}. On the roof the table entry i covers
     * column i + 1; column 0 shares the first entry and anything past column 7 flies the flat 373.
     */
    public static int cobFlyTime(Scene scene, int landingCol) {
        if (!scene.isRoof() || landingCol < 0 || landingCol > ROOF_COB_FLY_TIMES.length) {
            return COB_FLY_TIME;
        }
        if (landingCol == 0) {
            return ROOF_COB_FLY_TIMES[0];
        }
        return ROOF_COB_FLY_TIMES[landingCol - 1];
    }

    /**
     * Wait before firing so that after {@code leadTime} the target stands on {@code targetX}.
     * A target that is not moving gets no wait.
     */
    public static double waitTime(double zombieX, double speed, double targetX, double leadTime) {
        if (speed <= 0) {
            return 0.0;
        }
        return Math.max(0.0, (zombieX - targetX) / speed - leadTime);
    }

    public static InterceptPlan cobIntercept(double zombieX, double speed, int targetCol, int flyTime) {
        return intercept(zombieX, speed, Geometry.colToX(targetCol), flyTime);
    }

    public static InterceptPlan instantIntercept(double zombieX, double speed, int targetCol, PlantType plant) {
        if (!plant.isInstant()) {
            throw new IllegalArgumentException(plant + " is not an instant plant");
        }
        return intercept(zombieX, speed, Geometry.colToX(targetCol), plant.getInterval());
    }

    private static InterceptPlan intercept(double zombieX, double speed, double targetX, int leadTime) {
        double wait = waitTime(zombieX, speed, targetX, leadTime);
        double impact = wait + leadTime;
        return new InterceptPlan(wait, impact, predictPosition(zombieX, speed, impact));
    }

    /**
     * Picks the impact point that catches the most zombies, judged on their predicted
     * positions after {@code impactTime}. Every predicted zombie position is a candidate;
     * on a tie the earliest candidate in list order wins.
     */
    public static Optional<SplashTarget> bestSplashTarget(List<Zombie> zombies, double impactTime, double radius) {
        int n = zombies.size();
        double[] xs = new double[n];
        int[] rows = new int[n];
        int count = 0;
        for (Zombie z : zombies) {
            if (!z.alive) continue;
            xs[count] = StatusEffectUtil.predictX(z, impactTime);
            rows[count] = z.row;
            count++;
        }

        SplashTarget best = null;
        for (int i = 0; i < count; i++) {
            int hits = 0;
            for (int j = 0; j < count; j++) {
                if (CollisionUtil.isInSplash(xs[i], rows[i], xs[j], rows[j], radius)) {
                    hits++;
                }
            }
            if (best == null || hits > best.hits) {
                best = new SplashTarget(xs[i], rows[i], hits);
            }
        }
        return Optional.ofNullable(best);
    }

    public static class InterceptPlan {
        public final double fireDelay;
        public final double impactTime;
        public final double impactX;

        public InterceptPlan(double fireDelay, double impactTime, double impactX) {
            this.fireDelay = fireDelay;
            this.impactTime = impactTime;
            this.impactX = impactX;
        }
    }

    public static class SplashTarget {
        public final double x;
        public final int row;
        public final int hits;

        public SplashTarget(double x, int row, int hits) {
            this.x = x;
            this.row = row;
            this.hits = hits;
        }
    }
}
