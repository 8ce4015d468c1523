package com.lawnsim.engine;

import com.lawnsim.model.type.PlantType;

/**
 * A decision handed to an {@link ActionSink}. Only the fields its type needs are meaningful.
 */
public class Action {
    public enum Type { WAIT, PLACE, REMOVE, FIRE_AREA_WEAPON }

    public Type type = Type.WAIT;
    public PlantType plantType;
    public int row;
    public int col;
    public double targetX;

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    public Action() {}

    public static Action waitAction() {
        return new Action();
    }

    public static Action place(PlantType plantType, int row, int col) {
        Action a = new Action();
        a.type = Type.PLACE;
        a.plantType = plantType;
        a.row = row;
        a.col = col;
        return a;
    }

    public static Action remove(int row, int col) {
        Action a = new Action();
        a.type = Type.REMOVE;
        a.row = row;
        a.col = col;
        return a;
    }

    public static Action fireAreaWeapon(double targetX, int targetRow) {
        Action a = new Action();
        a.type = Type.FIRE_AREA_WEAPON;
        a.targetX = targetX;
        a.row = targetRow;
        return a;
    }

    @Override
    public String toString() {
        switch (type) {
            case PLACE: return "Place(" + plantType + ", " + row + ", " + col + ")";
            case REMOVE: return "Remove(" + row + ", " + col + ")";
            case FIRE_AREA_WEAPON: return "FireAreaWeapon(" + targetX + ", " + row + ")";
            default: return "Wait";
        }
    }
}
