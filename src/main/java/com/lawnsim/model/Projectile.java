package com.lawnsim.model;

import com.lawnsim.model.type.ProjectileType;

public class Projectile extends LawnObject {
    public ProjectileType type;
    public double x;
    public double y;
    public int damage;
    public int sourcePlantId = -1;
    // Signed: split peas send one shot backwards
    public double velocity;

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    public Projectile() {
        super();
    }

    public Projectile(ProjectileType type, int row, double x, double y, int sourcePlantId, boolean backward) {
        super(row);
        this.type = type;
        this.x = x;
        this.y = y;
        this.damage = type.getDamage();
        this.sourcePlantId = sourcePlantId;
        this.velocity = backward ? -type.getSpeed() : type.getSpeed();
    }

    public Projectile copy() {
        Projectile p = new Projectile();
        copyBaseInto(p);
        p.type = type;
        p.x = x;
        p.y = y;
        p.damage = damage;
        p.sourcePlantId = sourcePlantId;
        p.velocity = velocity;
        return p;
    }
}
