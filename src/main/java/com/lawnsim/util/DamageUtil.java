package com.lawnsim.util;

import com.lawnsim.model.Zombie;
import com.lawnsim.model.type.PlantType;
import com.lawnsim.model.type.ZombieType;

import java.util.List;

/**
 * Damage resolution and side-effect free damage analytics.
 */
public final class DamageUtil {

    public static final int INSTANT_KILL_DAMAGE = 1800;
    public static final int UNKILLABLE = 999;

    private DamageUtil() {}

    /** Instant-kill sources. All share the same base damage. */
    public enum InstantWeapon {
        CHERRY_BOMB, JALAPENO, DOOMSHROOM, COB, SQUASH;

        public int getBaseDamage() {
            return INSTANT_KILL_DAMAGE;
        }
    }

    // --- Resolution ---

    /**
     * Shield soaks first, then armor, then body. No layer goes below zero.
     * Marks the zombie dead once the body is depleted.
     *
     * @return true if this call killed the zombie
     */
    public static boolean applyDamage(Zombie zombie, int amount) {
        if (amount <= 0 || !zombie.alive) {
            return false;
        }
        int remaining = amount;

        int toShield = Math.min(remaining, zombie.shieldHealth);
        zombie.shieldHealth -= toShield;
        remaining -= toShield;

        int toArmor = Math.min(remaining, zombie.armorHealth);
        zombie.armorHealth -= toArmor;
        remaining -= toArmor;

        int toBody = Math.min(remaining, zombie.bodyHealth);
        zombie.bodyHealth -= toBody;

        if (zombie.bodyHealth <= 0) {
            zombie.alive = false;
            return true;
        }
        return false;
    }

    public static int instantDamage(ZombieType type, int base) {
        return type.isGiant() ? base / 2 : base;
    }

    public static int instantDamage(ZombieType type, InstantWeapon weapon) {
        return instantDamage(type, weapon.getBaseDamage());
    }

    // --- Analytics ---

    public static double dps(int damage, int interval) {
        return interval > 0 ? (double) damage / interval : 0.0;
    }

    /** Sustained single-row damage per centisecond for a plant against one target. */
    public static double plantDps(PlantType type) {
        if (!type.isAttacker()) {
            return 0.0;
        }
        double single = dps(type.getProjectile().getDamage(), type.getInterval());
        switch (type) {
            case REPEATER: return single * 2;
            case GATLINGPEA: return single * 4;
            default: return single;
        }
    }

    public static double timeToKill(int hp, double dps) {
        if (dps <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return hp / dps;
    }

    public static int overkill(int damage, int hp) {
        return Math.max(0, damage - hp);
    }

    public static double efficiency(int damage, int hp) {
        if (damage <= 0) {
            return 0.0;
        }
        return (double) Math.min(damage, hp) / damage;
    }

    public static int hitsToKill(int hp, int damagePerHit) {
        if (damagePerHit <= 0) {
            return UNKILLABLE;
        }
        return (hp + damagePerHit - 1) / damagePerHit;
    }

    public static int cobsNeededToKill(ZombieType type, int hp) {
        return hitsToKill(hp, instantDamage(type, InstantWeapon.COB));
    }

    /**
     * What an instant-kill strike would do to the given zombies, without touching them.
     */
    public static StrikeReport evaluateStrike(List<Zombie> targets, InstantWeapon weapon) {
        StrikeReport report = new StrikeReport();
        for (Zombie z : targets) {
            if (!z.alive) continue;
            int hp = z.totalHealth();
            int dealt = instantDamage(z.type, weapon);
            report.totalHp += hp;
            report.totalDamage += dealt;
            report.usefulDamage += Math.min(dealt, hp);
            report.wastedDamage += overkill(dealt, hp);
            if (dealt >= hp) {
                report.kills++;
            }
        }
        return report;
    }

    public static class StrikeReport {
        public int totalHp;
        public int totalDamage;
        public int usefulDamage;
        public int wastedDamage;
        public int kills;

        public double getEfficiency() {
            return totalDamage > 0 ? (double) usefulDamage / totalDamage : 0.0;
        }
    }
}
