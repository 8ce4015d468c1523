package com.lawnsim.engine;

import com.lawnsim.model.type.ZombieType;

public class SpawnRequest {
    public ZombieType type;
    public int row;

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    public SpawnRequest() {}

    public SpawnRequest(ZombieType type, int row) {
        this.type = type;
        this.row = row;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpawnRequest)) return false;
        SpawnRequest other = (SpawnRequest) o;
        return type == other.type && row == other.row;
    }

    @Override
    public int hashCode() {
        return 31 * (type == null ? 0 : type.hashCode()) + row;
    }

    @Override
    public String toString() {
        return type + "@" + row;
    }
}
