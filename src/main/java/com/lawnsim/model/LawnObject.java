package com.lawnsim.model;

/**
 * Anything that occupies the lawn and is tracked by id inside an {@link Arena}.
 */
public abstract class LawnObject {
    public int id = -1;
    public int row;
    public boolean alive = true;

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    protected LawnObject() {}

    protected LawnObject(int row) {
        this.row = row;
    }

    protected void copyBaseInto(LawnObject target) {
        target.id = id;
        target.row = row;
        target.alive = alive;
    }
}
