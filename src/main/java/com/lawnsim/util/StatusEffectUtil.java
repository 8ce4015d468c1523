package com.lawnsim.util;

import com.lawnsim.model.Zombie;
import com.lawnsim.model.type.ZombieType;

import java.util.ArrayList;
import java.util.List;

/**
 * Freeze, slow and butter bookkeeping plus travel-time integration across effect phases.
 * Freeze and butter both stop a zombie; slow halves its speed. An immobilizing effect
 * wins over a concurrently running slow.
 */
public final class StatusEffectUtil {

    public static final int SLOW_DURATION = 1000;
    public static final int BUTTER_DURATION = 400;

    // Ice-shroom chain: fuse, then freeze, then slow
    public static final int ICE_ACTIVATION_DELAY = 298;
    public static final int ICE_FREEZE_DURATION = 400;
    public static final int ICE_SLOW_DURATION = 1000;

    public static final int REFREEZE_THRESHOLD = 100;

    private StatusEffectUtil() {}

    public enum EffectType { NONE, FROZEN, BUTTERED, SLOWED }

    public static class Phase {
        public final EffectType type;
        public final int start;
        public final int end;

        public Phase(EffectType type, int start, int end) {
            this.type = type;
            this.start = start;
            this.end = end;
        }

        public int duration() {
            return end - start;
        }
    }

    public static EffectType currentEffect(Zombie zombie) {
        if (zombie.freezeCountdown > 0) return EffectType.FROZEN;
        if (zombie.butterCountdown > 0) return EffectType.BUTTERED;
        if (zombie.slowCountdown > 0) return EffectType.SLOWED;
        return EffectType.NONE;
    }

    // --- Applying effects (never shortens a running effect) ---

    public static void applySlow(Zombie zombie) {
        zombie.slowCountdown = Math.max(zombie.slowCountdown, SLOW_DURATION);
    }

    public static void applyButter(Zombie zombie) {
        zombie.butterCountdown = Math.max(zombie.butterCountdown, BUTTER_DURATION);
    }

    /** Freeze phase followed by the slow phase; the slow countdown includes the freeze. */
    public static void applyIceChain(Zombie zombie) {
        zombie.freezeCountdown = Math.max(zombie.freezeCountdown, ICE_FREEZE_DURATION);
        zombie.slowCountdown = Math.max(zombie.slowCountdown, ICE_FREEZE_DURATION + ICE_SLOW_DURATION);
    }

    public static boolean canRefreeze(Zombie zombie) {
        return zombie.freezeCountdown < REFREEZE_THRESHOLD;
    }

    public static void decay(Zombie zombie) {
        if (zombie.freezeCountdown > 0) zombie.freezeCountdown--;
        if (zombie.butterCountdown > 0) zombie.butterCountdown--;
        if (zombie.slowCountdown > 0) zombie.slowCountdown--;
    }

    // --- Timelines ---

    /**
     * Phases from now until every effect has worn off. The immobile phase lasts
     * max(freeze, butter); slow covers whatever part of its countdown outlasts that.
     */
    public static List<Phase> timeline(int freezeRemaining, int slowRemaining, int butterRemaining) {
        List<Phase> phases = new ArrayList<>();
        int immobile = Math.max(Math.max(freezeRemaining, butterRemaining), 0);
        if (immobile > 0) {
            EffectType type = freezeRemaining >= butterRemaining ? EffectType.FROZEN : EffectType.BUTTERED;
            phases.add(new Phase(type, 0, immobile));
        }
        if (slowRemaining > immobile) {
            phases.add(new Phase(EffectType.SLOWED, immobile, slowRemaining));
        }
        return phases;
    }

    /** Ice-shroom timeline measured from the moment it is planted. */
    public static List<Phase> iceChain() {
        List<Phase> phases = new ArrayList<>();
        int freezeStart = ICE_ACTIVATION_DELAY;
        int slowStart = freezeStart + ICE_FREEZE_DURATION;
        phases.add(new Phase(EffectType.NONE, 0, freezeStart));
        phases.add(new Phase(EffectType.FROZEN, freezeStart, slowStart));
        phases.add(new Phase(EffectType.SLOWED, slowStart, slowStart + ICE_SLOW_DURATION));
        return phases;
    }

    // --- Integration ---

    /**
     * Centiseconds needed to walk {@code distance} pixels, integrated phase by phase.
     * Returns positive infinity when the distance can never be covered.
     */
    public static double travelTime(double distance, double baseSpeed,
                                    int freezeRemaining, int slowRemaining, int butterRemaining) {
        if (distance <= 0) {
            return 0.0;
        }
        int immobile = Math.max(Math.max(freezeRemaining, butterRemaining), 0);
        double elapsed = immobile;
        double remaining = distance;

        int slowPhase = Math.max(0, slowRemaining - immobile);
        double slowSpeed = baseSpeed * ZombieType.SLOW_MULTIPLIER;
        if (slowPhase > 0) {
            if (slowSpeed > 0) {
                double covered = slowSpeed * slowPhase;
                if (covered >= remaining) {
                    return elapsed + remaining / slowSpeed;
                }
                remaining -= covered;
            }
            elapsed += slowPhase;
        }

        if (baseSpeed <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return elapsed + remaining / baseSpeed;
    }

    public static double travelTime(Zombie zombie, double distance) {
        return travelTime(distance, zombie.type.getSpeed(),
                zombie.freezeCountdown, zombie.slowCountdown, zombie.butterCountdown);
    }

    /** Pixels walked in {@code time} centiseconds. The inverse of {@link #travelTime}. */
    public static double distanceCovered(double time, double baseSpeed,
                                         int freezeRemaining, int slowRemaining, int butterRemaining) {
        if (time <= 0 || baseSpeed <= 0) {
            return 0.0;
        }
        int immobile = Math.max(Math.max(freezeRemaining, butterRemaining), 0);
        if (time <= immobile) {
            return 0.0;
        }
        double left = time - immobile;
        int slowPhase = Math.max(0, slowRemaining - immobile);
        double slowTime = Math.min(left, slowPhase);
        double covered = slowTime * baseSpeed * ZombieType.SLOW_MULTIPLIER;
        left -= slowTime;
        return covered + left * baseSpeed;
    }

    public static double predictX(Zombie zombie, double time) {
        return zombie.x - distanceCovered(time, zombie.type.getSpeed(),
                zombie.freezeCountdown, zombie.slowCountdown, zombie.butterCountdown);
    }
}
