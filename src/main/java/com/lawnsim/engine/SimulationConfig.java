package com.lawnsim.engine;

import com.lawnsim.model.type.Scene;
import com.lawnsim.util.Geometry;

/**
 * Everything a {@link Simulator} needs to know about the level it runs.
 * Immutable; build one with {@link #builder()}.
 */
public final class SimulationConfig {
    private final Scene scene;
    private final int rows;
    private final int cols;
    private final int initialSun;
    private final double zombieSpawnX;
    private final int biteDamage;
    private final int biteInterval;
    private final boolean sunProduction;
    private final boolean enforceCardRecharge;
    private final boolean checkInvariants;

    private SimulationConfig(Builder b) {
        this.scene = b.scene;
        this.rows = b.rows > 0 ? b.rows : b.scene.getRowCount();
        this.cols = b.cols;
        this.initialSun = b.initialSun;
        this.zombieSpawnX = b.zombieSpawnX;
        this.biteDamage = b.biteDamage;
        this.biteInterval = b.biteInterval;
        this.sunProduction = b.sunProduction;
        this.enforceCardRecharge = b.enforceCardRecharge;
        this.checkInvariants = b.checkInvariants;

        if (rows < 1 || rows > Geometry.MAX_ROWS) {
            throw new IllegalArgumentException("rows must be 1.." + Geometry.MAX_ROWS + ", got " + rows);
        }
        if (cols < 1 || cols > Geometry.MAX_COLS) {
            throw new IllegalArgumentException("cols must be 1.." + Geometry.MAX_COLS + ", got " + cols);
        }
        if (biteInterval < 1) {
            throw new IllegalArgumentException("biteInterval must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SimulationConfig defaults() {
        return builder().build();
    }

    public Scene getScene() { return scene; }
    public int getRows() { return rows; }
    public int getCols() { return cols; }
    public int getInitialSun() { return initialSun; }
    public double getZombieSpawnX() { return zombieSpawnX; }
    public int getBiteDamage() { return biteDamage; }
    public int getBiteInterval() { return biteInterval; }
    public boolean isSunProduction() { return sunProduction; }
    public boolean isEnforceCardRecharge() { return enforceCardRecharge; }
    public boolean isCheckInvariants() { return checkInvariants; }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.scene = scene;
        b.rows = rows;
        b.cols = cols;
        b.initialSun = initialSun;
        b.zombieSpawnX = zombieSpawnX;
        b.biteDamage = biteDamage;
        b.biteInterval = biteInterval;
        b.sunProduction = sunProduction;
        b.enforceCardRecharge = enforceCardRecharge;
        b.checkInvariants = checkInvariants;
        return b;
    }

    public static class Builder {
        private Scene scene = Scene.DAY;
        private int rows = 0;
        private int cols = Geometry.MAX_COLS;
        private int initialSun = 50;
        private double zombieSpawnX = Geometry.ZOMBIE_SPAWN_X;
        private int biteDamage = 100;
        private int biteInterval = 70;
        private boolean sunProduction = true;
        private boolean enforceCardRecharge = false;
        private boolean checkInvariants = false;

        public Builder scene(Scene scene) { this.scene = scene; return this; }
        // 0 means "whatever the scene has"
        public Builder rows(int rows) { this.rows = rows; return this; }
        public Builder cols(int cols) { this.cols = cols; return this; }
        public Builder initialSun(int initialSun) { this.initialSun = initialSun; return this; }
        public Builder zombieSpawnX(double zombieSpawnX) { this.zombieSpawnX = zombieSpawnX; return this; }
        public Builder biteDamage(int biteDamage) { this.biteDamage = biteDamage; return this; }
        public Builder biteInterval(int biteInterval) { this.biteInterval = biteInterval; return this; }
        public Builder sunProduction(boolean sunProduction) { this.sunProduction = sunProduction; return this; }
        public Builder enforceCardRecharge(boolean enforce) { this.enforceCardRecharge = enforce; return this; }
        public Builder checkInvariants(boolean check) { this.checkInvariants = check; return this; }

        public SimulationConfig build() {
            return new SimulationConfig(this);
        }
    }
}
