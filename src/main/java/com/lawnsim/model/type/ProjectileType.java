package com.lawnsim.model.type;

/**
 * Every projectile a plant can put on the lawn.
 * Lobbed projectiles travel in a straight line here; their arc has no effect on which zombie they hit.
 */
public enum ProjectileType {
    PEA(20, 3.7, 0, false, false),
    SNOW_PEA(20, 3.7, 0, true, false),
    PUFF(20, 3.7, 0, false, false),
    CABBAGE(40, 3.0, 0, false, false),
    KERNEL(20, 3.0, 0, false, false),
    BUTTER(40, 3.0, 0, false, true),
    MELON(80, 3.0, 80, false, false),
    WINTER_MELON(80, 3.0, 80, true, false);

    private final int damage;
    private final double speed;
    private final double splashRadius;
    private final boolean slowing;
    private final boolean buttering;

    ProjectileType(int damage, double speed, double splashRadius, boolean slowing, boolean buttering) {
        this.damage = damage;
        this.speed = speed;
        this.splashRadius = splashRadius;
        this.slowing = slowing;
        this.buttering = buttering;
    }

    public int getDamage() { return damage; }
    public double getSpeed() { return speed; }
    public double getSplashRadius() { return splashRadius; }
    public boolean isSplash() { return splashRadius > 0; }
    public boolean isSlowing() { return slowing; }
    public boolean isButtering() { return buttering; }
}
