package com.lawnsim.model.type;

import static com.lawnsim.model.type.PlantRole.*;

/**
 * Plants the simulator knows how to run. Costs are in sun, times in centiseconds.
 */
public enum PlantType {
    PEASHOOTER(100, 300, 750, SHOOTER, 141, ProjectileType.PEA),
    SUNFLOWER(50, 300, 750, SUN_PRODUCER, 2400, null),
    CHERRY_BOMB(150, 300, 5000, INSTANT, 100, null),
    WALLNUT(50, 4000, 3000, WALL, 0, null),
    SNOW_PEA(175, 300, 750, SHOOTER, 141, ProjectileType.SNOW_PEA),
    REPEATER(200, 300, 750, SHOOTER, 141, ProjectileType.PEA),
    PUFFSHROOM(0, 300, 750, SHOOTER, 141, ProjectileType.PUFF),
    ICESHROOM(75, 300, 5000, INSTANT, 298, null),
    DOOMSHROOM(125, 300, 5000, INSTANT, 100, null),
    SQUASH(50, 300, 3000, INSTANT, 100, null),
    THREEPEATER(325, 300, 750, SHOOTER, 141, ProjectileType.PEA),
    JALAPENO(125, 300, 5000, INSTANT, 100, null),
    TALLNUT(125, 8000, 3000, WALL, 0, null,
            new DefenseRange(30, 60), new DefenseRange(-50, 30)),
    SPLITPEA(125, 300, 750, SHOOTER, 141, ProjectileType.PEA),
    PUMPKIN(125, 4000, 3000, OVERLAY, 0, null,
            new DefenseRange(20, 80), new DefenseRange(-60, 40)),
    CABBAGEPULT(100, 300, 750, SHOOTER, 300, ProjectileType.CABBAGE),
    KERNELPULT(100, 300, 750, SHOOTER, 300, ProjectileType.KERNEL),
    MELONPULT(300, 300, 750, SHOOTER, 300, ProjectileType.MELON),
    GATLINGPEA(250, 300, 5000, SHOOTER, 141, ProjectileType.PEA),
    TWIN_SUNFLOWER(150, 300, 5000, SUN_PRODUCER, 2400, null),
    WINTER_MELON(200, 300, 5000, SHOOTER, 300, ProjectileType.WINTER_MELON),
    COB_CANNON(500, 300, 5000, AREA_WEAPON, 3475, null,
            new DefenseRange(20, 120), new DefenseRange(-60, 80));

    /** Puff-shrooms only fire at zombies this far ahead of their own x. */
    public static final double PUFF_RANGE = 260;

    private final int cost;
    private final int health;
    private final int rechargeTime;
    private final PlantRole role;
    private final int interval;
    private final ProjectileType projectile;
    private final DefenseRange hitRange;
    private final DefenseRange explodeRange;

    PlantType(int cost, int health, int rechargeTime, PlantRole role, int interval, ProjectileType projectile) {
        this(cost, health, rechargeTime, role, interval, projectile, DefenseRange.DEFAULT_HIT, DefenseRange.DEFAULT_EXPLODE);
    }

    PlantType(int cost, int health, int rechargeTime, PlantRole role, int interval, ProjectileType projectile,
              DefenseRange hitRange, DefenseRange explodeRange) {
        this.cost = cost;
        this.health = health;
        this.rechargeTime = rechargeTime;
        this.role = role;
        this.interval = interval;
        this.projectile = projectile;
        this.hitRange = hitRange;
        this.explodeRange = explodeRange;
    }

    public int getCost() { return cost; }
    public int getHealth() { return health; }
    public int getRechargeTime() { return rechargeTime; }
    public PlantRole getRole() { return role; }
    public ProjectileType getProjectile() { return projectile; }

    /** Melee reach interval: where bites and giant smashes land on this plant. */
    public DefenseRange getHitRange() { return hitRange; }

    /** Blast interval: where a radial explosion reaches this plant. */
    public DefenseRange getExplodeRange() { return explodeRange; }

    /**
     * For shooters the reload time, for sun producers the production period,
     * for instants the activation delay and for the cob cannon its recharge.
     */
    public int getInterval() { return interval; }

    public boolean isAttacker() { return role == SHOOTER; }
    public boolean isInstant() { return role == INSTANT; }
    public boolean isOverlay() { return role == OVERLAY; }

    public int getSunYield() {
        switch (this) {
            case SUNFLOWER: return 25;
            case TWIN_SUNFLOWER: return 50;
            default: return 0;
        }
    }
}
