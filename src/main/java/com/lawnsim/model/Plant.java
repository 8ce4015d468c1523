package com.lawnsim.model;

import com.lawnsim.model.type.PlantType;
import com.lawnsim.util.Geometry;

public class Plant extends LawnObject {
    public PlantType type;
    public int col;
    public int health;
    public int attackCountdown;

    // Kernel-pults alternate kernels and butter by shot count
    public int shotCount = 0;

    // Squash target once a zombie comes into reach
    public boolean locked = false;
    public double lockedX = 0;

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    public Plant() {
        super();
    }

    public Plant(PlantType type, int row, int col) {
        super(row);
        this.type = type;
        this.col = col;
        this.health = type.getHealth();
        switch (type.getRole()) {
            case SHOOTER:
            case SUN_PRODUCER:
            case INSTANT:
                this.attackCountdown = type.getInterval();
                break;
            default:
                // Walls never attack, cob cannons are ready the moment they are planted
                this.attackCountdown = 0;
        }
        // A squash waits for a target before its fuse starts
        if (type == PlantType.SQUASH) {
            this.attackCountdown = 0;
        }
    }

    public double pixelX() {
        return Geometry.colToX(col);
    }

    public Plant copy() {
        Plant p = new Plant();
        copyBaseInto(p);
        p.type = type;
        p.col = col;
        p.health = health;
        p.attackCountdown = attackCountdown;
        p.shotCount = shotCount;
        p.locked = locked;
        p.lockedX = lockedX;
        return p;
    }

    @Override
    public String toString() {
        return type + "#" + id + "@" + row + "," + col + " hp=" + health;
    }
}
