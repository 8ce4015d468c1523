package com.lawnsim.model.type;

public enum PlantRole {
    SHOOTER,
    SUN_PRODUCER,
    WALL,
    OVERLAY,
    INSTANT,
    AREA_WEAPON
}
