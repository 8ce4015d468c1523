package com.lawnsim.config;

import com.lawnsim.engine.SimulationConfig;
import com.lawnsim.model.type.Scene;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Everything under {@code lawnsim.*} in application.properties.
 */
@ConfigurationProperties(prefix = "lawnsim")
public class SimulationProperties {
    // --- Level ---
    private Scene scene = Scene.DAY;
    private int rows = 0;
    private int cols = 9;
    private int initialSun = 50;
    private int biteDamage = 100;
    private int biteInterval = 70;
    private boolean sunProduction = true;
    private boolean enforceCardRecharge = false;
    private boolean checkInvariants = false;

    // --- Live loop ---
    private String defaultScenario = "standard";
    private boolean autostart = false;
    private boolean autosave = true;
    private String snapshotFile = "lawn_snapshot.json";
    private int rolloutThreads = 4;

    public SimulationConfig toSimulationConfig() {
        return SimulationConfig.builder()
                .scene(scene)
                .rows(rows)
                .cols(cols)
                .initialSun(initialSun)
                .biteDamage(biteDamage)
                .biteInterval(biteInterval)
                .sunProduction(sunProduction)
                .enforceCardRecharge(enforceCardRecharge)
                .checkInvariants(checkInvariants)
                .build();
    }

    public Scene getScene() { return scene; }
    public void setScene(Scene scene) { this.scene = scene; }
    public int getRows() { return rows; }
    public void setRows(int rows) { this.rows = rows; }
    public int getCols() { return cols; }
    public void setCols(int cols) { this.cols = cols; }
    public int getInitialSun() { return initialSun; }
    public void setInitialSun(int initialSun) { this.initialSun = initialSun; }
    public int getBiteDamage() { return biteDamage; }
    public void setBiteDamage(int biteDamage) { this.biteDamage = biteDamage; }
    public int getBiteInterval() { return biteInterval; }
    public void setBiteInterval(int biteInterval) { this.biteInterval = biteInterval; }
    public boolean isSunProduction() { return sunProduction; }
    public void setSunProduction(boolean sunProduction) { this.sunProduction = sunProduction; }
    public boolean isEnforceCardRecharge() { return enforceCardRecharge; }
    public void setEnforceCardRecharge(boolean enforceCardRecharge) { this.enforceCardRecharge = enforceCardRecharge; }
    public boolean isCheckInvariants() { return checkInvariants; }
    public void setCheckInvariants(boolean checkInvariants) { this.checkInvariants = checkInvariants; }

    public String getDefaultScenario() { return defaultScenario; }
    public void setDefaultScenario(String defaultScenario) { this.defaultScenario = defaultScenario; }
    public boolean isAutostart() { return autostart; }
    public void setAutostart(boolean autostart) { this.autostart = autostart; }
    public boolean isAutosave() { return autosave; }
    public void setAutosave(boolean autosave) { this.autosave = autosave; }
    public String getSnapshotFile() { return snapshotFile; }
    public void setSnapshotFile(String snapshotFile) { this.snapshotFile = snapshotFile; }
    public int getRolloutThreads() { return rolloutThreads; }
    public void setRolloutThreads(int rolloutThreads) { this.rolloutThreads = rolloutThreads; }
}
