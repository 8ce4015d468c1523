package com.lawnsim.util;

import com.lawnsim.model.Plant;
import com.lawnsim.model.Zombie;
import com.lawnsim.model.type.DefenseRange;
import com.lawnsim.model.type.PlantType;
import com.lawnsim.model.type.ZombieType;

/**
 * Hit tests. The coarse tier works on row bands and x distances and is what the
 * simulator runs every tick. The precise tier uses per-archetype hurt boxes and hit points.
 */
public class CollisionUtil {

    public static final double PEA_HIT_HALF_WIDTH = 20;

    public static final double CHERRY_RADIUS = 90;
    // Extra margin for the zombie's body width
    public static final double CHERRY_EFFECTIVE_RADIUS = CHERRY_RADIUS + 20;
    public static final double COB_RADIUS = 115;
    public static final double DOOM_RADIUS = 150;

    public static final double SQUASH_REACH_LEFT = -20;
    public static final double SQUASH_REACH_RIGHT = 120;
    public static final double SQUASH_CRUSH_HALF_WIDTH = 60;

    // ==========================================
    // COARSE TIER
    // ==========================================

    public static boolean isDirectHit(double projectileX, int projectileRow, double zombieX, int zombieRow) {
        return projectileRow == zombieRow && Math.abs(projectileX - zombieX) <= PEA_HIT_HALF_WIDTH;
    }

    /** Row-banded splash: adjacent rows count, anything two or more rows away never does. */
    public static boolean isInSplash(double centerX, int centerRow, double zombieX, int zombieRow, double radius) {
        return Math.abs(zombieRow - centerRow) <= 1 && Math.abs(zombieX - centerX) <= radius;
    }

    public static boolean isCherryHit(double zombieX, int zombieRow, int cherryRow, int cherryCol) {
        return isInSplash(Geometry.colToCenterX(cherryCol), cherryRow, zombieX, zombieRow, CHERRY_EFFECTIVE_RADIUS);
    }

    public static boolean isCobHit(double zombieX, int zombieRow, double targetX, int targetRow) {
        return isInSplash(targetX, targetRow, zombieX, zombieRow, COB_RADIUS);
    }

    public static boolean isDoomHit(double zombieX, int zombieRow, int doomRow, int doomCol) {
        return isInSplash(Geometry.colToCenterX(doomCol), doomRow, zombieX, zombieRow, DOOM_RADIUS);
    }

    public static boolean isJalapenoHit(int zombieRow, int jalapenoRow) {
        return zombieRow == jalapenoRow;
    }

    public static boolean isInSquashReach(double plantX, double zombieX) {
        return zombieX >= plantX + SQUASH_REACH_LEFT && zombieX <= plantX + SQUASH_REACH_RIGHT;
    }

    public static boolean isSquashHit(double zombieX, int zombieRow, double lockedX, int squashRow) {
        return zombieRow == squashRow && Math.abs(zombieX - lockedX) <= SQUASH_CRUSH_HALF_WIDTH;
    }

    /**
     * Whether the zombie's melee reach touches the plant's hit-defense interval.
     * Giants use the same test with their wider hammer reach.
     */
    public static boolean canReach(Zombie zombie, Plant plant) {
        if (zombie.row != plant.row) {
            return false;
        }
        ZombieType.Hitbox box = zombie.type.getHitbox();
        return plant.type.getHitRange().overlaps(plant.pixelX(), zombie.x + box.reachLeft, zombie.x + box.reachRight);
    }

    public static boolean isInHammerRange(double gargantuarX, double plantX, PlantType plantType) {
        ZombieType.Hitbox giant = ZombieType.Hitbox.GIANT;
        return plantType.getHitRange().overlaps(plantX, gargantuarX + giant.reachLeft, gargantuarX + giant.reachRight);
    }

    /** Radial blast against a plant, using the plant's explosion-defense interval. */
    public static boolean isPlantInBlast(Plant plant, double blastX, int blastRow, double radius) {
        if (Math.abs(plant.row - blastRow) > 1) {
            return false;
        }
        DefenseRange range = plant.type.getExplodeRange();
        double left = range.absoluteLeft(plant.pixelX());
        double right = range.absoluteRight(plant.pixelX());
        double nearest = Math.max(left, Math.min(blastX, right));
        return Math.abs(nearest - blastX) <= radius;
    }

    // ==========================================
    // PRECISE TIER
    // ==========================================

    public static class ZombieBox {
        public final double x;
        public final double y;
        public final int row;
        public final ZombieType.Hitbox hitbox;

        public ZombieBox(double x, double y, int row, ZombieType.Hitbox hitbox) {
            this.x = x;
            this.y = y;
            this.row = row;
            this.hitbox = hitbox;
        }

        public static ZombieBox of(Zombie zombie) {
            return new ZombieBox(zombie.x, Geometry.rowToCenterY(zombie.row), zombie.row, zombie.type.getHitbox());
        }

        public double left() { return x - hitbox.hurtWidth / 2.0; }
        public double right() { return x + hitbox.hurtWidth / 2.0; }
        public double top() { return y - hitbox.hurtHeight / 2.0; }
        public double bottom() { return y + hitbox.hurtHeight / 2.0; }
    }

    public static class PlantBox {
        public final double x;
        public final double y;
        public final int row;
        public final int width;
        public final int height;

        public PlantBox(double x, double y, int row, int width, int height) {
            this.x = x;
            this.y = y;
            this.row = row;
            this.width = width;
            this.height = height;
        }

        public static PlantBox of(Plant plant) {
            return new PlantBox(Geometry.colToCenterX(plant.col), Geometry.rowToCenterY(plant.row), plant.row,
                    Geometry.GRID_WIDTH, Geometry.GRID_HEIGHT);
        }
    }

    /** Closest point of the hurt box to the blast center, compared against the radius. */
    public static boolean isHitByExplosion(ZombieBox zombie, double blastX, double blastY, double radius) {
        double closestX = Math.max(zombie.left(), Math.min(blastX, zombie.right()));
        double closestY = Math.max(zombie.top(), Math.min(blastY, zombie.bottom()));
        return Geometry.distance(closestX, closestY, blastX, blastY) <= radius;
    }

    public static boolean isBulletHit(double bulletX, int bulletRow, ZombieBox zombie) {
        if (bulletRow != zombie.row) {
            return false;
        }
        double hitX = zombie.x + zombie.hitbox.bulletX;
        return Math.abs(bulletX - hitX) <= zombie.hitbox.hurtWidth / 2.0;
    }

    public static boolean isAttackingPlant(ZombieBox zombie, PlantBox plant) {
        if (zombie.row != plant.row) {
            return false;
        }
        double attackX = zombie.x + zombie.hitbox.attackX;
        double attackY = zombie.y + zombie.hitbox.attackY;
        return attackX >= plant.x - plant.width / 2.0 && attackX <= plant.x + plant.width / 2.0
                && attackY >= plant.y - plant.height / 2.0 && attackY <= plant.y + plant.height / 2.0;
    }

    public static boolean isCobHitPrecise(ZombieBox zombie, double targetX, int targetRow) {
        return isHitByExplosion(zombie, targetX, Geometry.rowToCenterY(targetRow), COB_RADIUS);
    }

    public static boolean isCherryHitPrecise(ZombieBox zombie, int cherryRow, int cherryCol) {
        return isHitByExplosion(zombie, Geometry.colToCenterX(cherryCol), Geometry.rowToCenterY(cherryRow),
                CHERRY_EFFECTIVE_RADIUS);
    }
}
