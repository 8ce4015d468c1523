package com.lawnsim.model.type;

public enum Scene {
    DAY, NIGHT, POOL, FOG, ROOF, ROOF_NIGHT;

    // Pool and fog lawns carry the two water lanes
    public int getRowCount() {
        return (this == POOL || this == FOG) ? 6 : 5;
    }

    public boolean isRoof() {
        return this == ROOF || this == ROOF_NIGHT;
    }
}
