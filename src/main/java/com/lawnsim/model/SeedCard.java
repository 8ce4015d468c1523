package com.lawnsim.model;

import com.lawnsim.model.type.PlantType;

public class SeedCard {
    public PlantType type;
    public int rechargeCountdown;

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    public SeedCard() {}

    public SeedCard(PlantType type) {
        this.type = type;
    }

    public boolean ready() {
        return rechargeCountdown <= 0;
    }

    public SeedCard copy() {
        SeedCard c = new SeedCard(type);
        c.rechargeCountdown = rechargeCountdown;
        return c;
    }
}
