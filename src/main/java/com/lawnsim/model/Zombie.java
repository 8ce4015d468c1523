package com.lawnsim.model;

import com.lawnsim.model.type.ZombieType;

public class Zombie extends LawnObject {
    public ZombieType type;
    public double x;

    // --- HEALTH LAYERS (absorbed in this order) ---
    public int shieldHealth;
    public int armorHealth;
    public int bodyHealth;

    // --- STATUS COUNTDOWNS (cs) ---
    public int slowCountdown = 0;
    public int freezeCountdown = 0;
    public int butterCountdown = 0;

    // --- MELEE ---
    // For giants "eating" is the smash wind-up and the countdown is time until the hammer lands
    public boolean eating = false;
    public int eatCountdown = 0;
    public int targetPlantId = -1;

    // --- IMP THROW ---
    public int impsThrown = 0;
    public int throwCountdown = 0;

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    public Zombie() {
        super();
    }

    public Zombie(ZombieType type, int row, double x) {
        super(row);
        this.type = type;
        this.x = x;
        this.shieldHealth = type.getShieldHealth();
        this.armorHealth = type.getArmorHealth();
        this.bodyHealth = type.getBodyHealth();
    }

    public int totalHealth() {
        return shieldHealth + armorHealth + bodyHealth;
    }

    public boolean giant() {
        return type.isGiant();
    }

    public boolean immobilized() {
        return freezeCountdown > 0 || butterCountdown > 0 || throwCountdown > 0;
    }

    /** Current walking speed with status effects applied, ignoring whether the zombie is eating. */
    public double effectiveSpeed() {
        if (immobilized()) {
            return 0;
        }
        if (slowCountdown > 0) {
            return type.getSpeed() * ZombieType.SLOW_MULTIPLIER;
        }
        return type.getSpeed();
    }

    public void stopEating() {
        eating = false;
        eatCountdown = 0;
        targetPlantId = -1;
    }

    public Zombie copy() {
        Zombie z = new Zombie();
        copyBaseInto(z);
        z.type = type;
        z.x = x;
        z.shieldHealth = shieldHealth;
        z.armorHealth = armorHealth;
        z.bodyHealth = bodyHealth;
        z.slowCountdown = slowCountdown;
        z.freezeCountdown = freezeCountdown;
        z.butterCountdown = butterCountdown;
        z.eating = eating;
        z.eatCountdown = eatCountdown;
        z.targetPlantId = targetPlantId;
        z.impsThrown = impsThrown;
        z.throwCountdown = throwCountdown;
        return z;
    }

    @Override
    public String toString() {
        return type + "#" + id + "@" + row + "," + String.format("%.2f", x) + " hp=" + totalHealth();
    }
}
