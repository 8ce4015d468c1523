package com.lawnsim.model;

/**
 * A cob shell in flight. It detonates at (x, row) when the countdown runs out.
 */
public class AreaStrike extends LawnObject {
    public double x;
    public int countdown;
    public int sourcePlantId = -1;

    // --- REQUIRED FOR JSON DESERIALIZATION ---
    public AreaStrike() {
        super();
    }

    public AreaStrike(int row, double x, int countdown, int sourcePlantId) {
        super(row);
        this.x = x;
        this.countdown = countdown;
        this.sourcePlantId = sourcePlantId;
    }

    public AreaStrike copy() {
        AreaStrike s = new AreaStrike();
        copyBaseInto(s);
        s.x = x;
        s.countdown = countdown;
        s.sourcePlantId = sourcePlantId;
        return s;
    }
}
