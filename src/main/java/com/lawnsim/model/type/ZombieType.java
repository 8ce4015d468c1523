package com.lawnsim.model.type;

/**
 * Zombies the simulator knows how to run.
 * Health comes in three layers (shield, armor, body) and speeds are in pixels per centisecond.
 */
public enum ZombieType {
    ZOMBIE(200, 0, 0, 0.23, false, Hitbox.NORMAL),
    FLAG(200, 0, 0, 0.36, false, Hitbox.NORMAL),
    CONEHEAD(200, 370, 0, 0.23, false, Hitbox.NORMAL),
    BUCKETHEAD(200, 1100, 0, 0.23, false, Hitbox.NORMAL),
    NEWSPAPER(200, 0, 150, 0.23, false, Hitbox.SHIELDED),
    SCREENDOOR(200, 0, 1100, 0.23, false, Hitbox.SHIELDED),
    FOOTBALL(200, 1400, 0, 0.68, false, Hitbox.FOOTBALL),
    LADDER(500, 0, 500, 0.46, false, Hitbox.SHIELDED),
    GARGANTUAR(3000, 0, 0, 0.15, true, Hitbox.GIANT),
    IMP(300, 0, 0, 0.6, false, Hitbox.IMP),
    GIGA_GARGANTUAR(6000, 0, 0, 0.15, true, Hitbox.GIANT);

    public static final double SLOW_MULTIPLIER = 0.5;

    private final int bodyHealth;
    private final int armorHealth;
    private final int shieldHealth;
    private final double speed;
    private final boolean giant;
    private final Hitbox hitbox;

    ZombieType(int bodyHealth, int armorHealth, int shieldHealth, double speed, boolean giant, Hitbox hitbox) {
        this.bodyHealth = bodyHealth;
        this.armorHealth = armorHealth;
        this.shieldHealth = shieldHealth;
        this.speed = speed;
        this.giant = giant;
        this.hitbox = hitbox;
    }

    public int getBodyHealth() { return bodyHealth; }
    public int getArmorHealth() { return armorHealth; }
    public int getShieldHealth() { return shieldHealth; }
    public int getTotalHealth() { return bodyHealth + armorHealth + shieldHealth; }
    public double getSpeed() { return speed; }
    public Hitbox getHitbox() { return hitbox; }

    /** Giants take half damage from every instant-kill source. */
    public boolean isGiant() { return giant; }

    /** How many imps this zombie can throw over its life. */
    public int getImpCount() {
        switch (this) {
            case GARGANTUAR: return 1;
            case GIGA_GARGANTUAR: return 2;
            default: return 0;
        }
    }

    /**
     * Per-archetype body geometry. The hurt box is centered on the zombie's (x, y);
     * the bullet point is where projectiles are judged to land, the attack point is where
     * the zombie's own attack lands. Reach is the melee interval relative to x.
     */
    public enum Hitbox {
        NORMAL(42, 115, -10, -30, -20, 0, 0, 10),
        SHIELDED(52, 115, -16, -30, -26, 0, 0, 10),
        FOOTBALL(57, 115, -10, -30, -24, 0, 0, 10),
        IMP(30, 70, -6, -15, -12, 10, 0, 10),
        GIANT(125, 154, -20, -40, -60, 0, -30, 59);

        public final int hurtWidth;
        public final int hurtHeight;
        public final int bulletX;
        public final int bulletY;
        public final int attackX;
        public final int attackY;
        public final int reachLeft;
        public final int reachRight;

        Hitbox(int hurtWidth, int hurtHeight, int bulletX, int bulletY, int attackX, int attackY,
               int reachLeft, int reachRight) {
            this.hurtWidth = hurtWidth;
            this.hurtHeight = hurtHeight;
            this.bulletX = bulletX;
            this.bulletY = bulletY;
            this.attackX = attackX;
            this.attackY = attackY;
            this.reachLeft = reachLeft;
            this.reachRight = reachRight;
        }
    }
}
