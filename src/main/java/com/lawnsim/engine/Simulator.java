package com.lawnsim.engine;

import com.lawnsim.model.Arena;
import com.lawnsim.model.AreaStrike;
import com.lawnsim.model.GameState;
import com.lawnsim.model.GridIndex;
import com.lawnsim.model.Plant;
import com.lawnsim.model.Projectile;
import com.lawnsim.model.SeedCard;
import com.lawnsim.model.Zombie;
import com.lawnsim.model.type.PlantType;
import com.lawnsim.model.type.ProjectileType;
import com.lawnsim.model.type.ZombieType;
import com.lawnsim.util.CollisionUtil;
import com.lawnsim.util.DamageUtil;
import com.lawnsim.util.DamageUtil.InstantWeapon;
import com.lawnsim.util.GargantuarUtil;
import com.lawnsim.util.Geometry;
import com.lawnsim.util.StatusEffectUtil;
import com.lawnsim.util.TimingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Frame-accurate lawn simulation. One {@link #tick()} is one centisecond and runs, in order:
 * projectiles (move, then collide), zombies (status decay, then eat or walk), plants
 * (countdowns and firing), cleanup, and the terminal check.
 *
 * <p>Instances are single-threaded and share nothing with each other; {@link #copy()}
 * gives a fully independent branch for planning.
 */
public class Simulator implements GameStateSource, ActionSink {
    private static final Logger log = LoggerFactory.getLogger(Simulator.class);

    private static final double PROJECTILE_DESPAWN_MARGIN = 50;
    private static final double SHOT_OFFSET = 40;
    private static final double BACKWARD_SHOT_OFFSET = -10;
    private static final int BUTTER_EVERY = 4;

    private final SimulationConfig config;

    private Arena<Plant> plants = new Arena<>(Plant::copy);
    private Arena<Zombie> zombies = new Arena<>(Zombie::copy);
    private Arena<Projectile> projectiles = new Arena<>(Projectile::copy);
    private Arena<AreaStrike> strikes = new Arena<>(AreaStrike::copy);
    private GridIndex grid;
    private Map<PlantType, SeedCard> cards = new EnumMap<>(PlantType.class);
    private WaveSpawner spawner;

    private long frame = 0;
    private int sun;
    private boolean gameOver = false;
    private boolean win = false;

    // Imps thrown during the zombie phase join the arena once the phase is over
    private final List<Zombie> pendingZombies = new ArrayList<>();

    public Simulator(SimulationConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config is required");
        }
        this.config = config;
        this.sun = config.getInitialSun();
        this.grid = new GridIndex(config.getRows(), config.getCols());
        for (PlantType type : PlantType.values()) {
            cards.put(type, new SeedCard(type));
        }
    }

    private Simulator(Simulator other) {
        this.config = other.config;
        this.plants = other.plants.copy();
        this.zombies = other.zombies.copy();
        this.projectiles = other.projectiles.copy();
        this.strikes = other.strikes.copy();
        this.grid = other.grid.copy();
        for (Map.Entry<PlantType, SeedCard> e : other.cards.entrySet()) {
            this.cards.put(e.getKey(), e.getValue().copy());
        }
        this.spawner = other.spawner == null ? null : other.spawner.copy();
        this.frame = other.frame;
        this.sun = other.sun;
        this.gameOver = other.gameOver;
        this.win = other.win;
    }

    /** Deep copy. Nothing done to the copy is visible here, and the other way round. */
    public Simulator copy() {
        return new Simulator(this);
    }

    // ==========================================
    // CLOCK
    // ==========================================

    public void tick() {
        if (gameOver) {
            return;
        }
        frame++;
        decayCards();
        spawnFromWaves();
        updateProjectiles();
        updateZombies();
        updatePlants();
        cleanup();
        checkTerminal();
        if (config.isCheckInvariants()) {
            verifyIntegrity();
        }
    }

    /**
     * Runs up to {@code n} ticks, stopping early once the run is over.
     *
     * @return how many ticks actually ran
     */
    public int tickN(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("tick count must not be negative: " + n);
        }
        int ran = 0;
        while (ran < n && !gameOver) {
            tick();
            ran++;
        }
        return ran;
    }

    private void decayCards() {
        for (SeedCard card : cards.values()) {
            if (card.rechargeCountdown > 0) {
                card.rechargeCountdown--;
            }
        }
    }

    private void spawnFromWaves() {
        if (spawner == null) {
            return;
        }
        for (SpawnRequest request : spawner.update(frame)) {
            if (!spawnZombie(request.type, request.row).isPresent()) {
                log.warn("[Simulator] Wave asked for {} in row {} but the lawn has {} rows",
                        request.type, request.row, config.getRows());
            }
        }
    }

    // --- Phase 1: projectiles ---

    private void updateProjectiles() {
        for (AreaStrike strike : strikes.all()) {
            if (!strike.alive) continue;
            strike.countdown--;
            if (strike.countdown <= 0) {
                detonateStrike(strike);
                strike.alive = false;
            }
        }

        double rightLimit = Geometry.LAWN_RIGHT_X + PROJECTILE_DESPAWN_MARGIN;
        for (Projectile p : projectiles.all()) {
            if (!p.alive) continue;
            p.x += p.velocity;
            if (p.x > rightLimit || p.x < 0) {
                p.alive = false;
                continue;
            }
            resolveProjectile(p);
        }
    }

    private void resolveProjectile(Projectile p) {
        if (p.type.isSplash()) {
            boolean hitAny = false;
            for (Zombie z : zombies.all()) {
                if (z.alive && CollisionUtil.isInSplash(p.x, p.row, z.x, z.row, p.type.getSplashRadius())) {
                    hitZombie(z, p);
                    hitAny = true;
                }
            }
            if (hitAny) {
                p.alive = false;
            }
            return;
        }

        // The first zombie a shot meets is the nearest one along its direction of travel
        Zombie target = null;
        for (Zombie z : zombies.all()) {
            if (!z.alive || !CollisionUtil.isDirectHit(p.x, p.row, z.x, z.row)) continue;
            if (target == null || (p.velocity >= 0 ? z.x < target.x : z.x > target.x)) {
                target = z;
            }
        }
        if (target != null) {
            hitZombie(target, p);
            p.alive = false;
        }
    }

    private void hitZombie(Zombie z, Projectile p) {
        boolean killed = DamageUtil.applyDamage(z, p.damage);
        if (killed) {
            onZombieKilled(z, p.type.name());
            return;
        }
        if (p.type.isSlowing()) {
            StatusEffectUtil.applySlow(z);
        }
        if (p.type.isButtering()) {
            StatusEffectUtil.applyButter(z);
        }
    }

    private void detonateStrike(AreaStrike strike) {
        int hits = 0;
        for (Zombie z : zombies.all()) {
            if (z.alive && CollisionUtil.isCobHit(z.x, z.row, strike.x, strike.row)) {
                hits++;
                if (DamageUtil.applyDamage(z, DamageUtil.instantDamage(z.type, InstantWeapon.COB))) {
                    onZombieKilled(z, "COB");
                }
            }
        }
        log.debug("[Simulator] Cob landed at ({}, row {}) on frame {}, {} zombies hit",
                strike.x, strike.row, frame, hits);
    }

    // --- Phase 2: zombies ---

    private void updateZombies() {
        for (Zombie z : zombies.all()) {
            if (!z.alive) continue;
            StatusEffectUtil.decay(z);

            if (z.throwCountdown > 0) {
                z.throwCountdown--;
                if (z.throwCountdown == 0) {
                    releaseImp(z);
                }
                continue;
            }
            if (GargantuarUtil.canThrowNow(z)) {
                z.throwCountdown = GargantuarUtil.IMP_THROW_TIME;
                continue;
            }

            if (z.eating) {
                continueEating(z);
                if (z.eating || !z.alive) {
                    continue;
                }
            }

            z.x -= z.effectiveSpeed();
            checkPlantContact(z);
        }

        for (Zombie imp : pendingZombies) {
            zombies.add(imp);
        }
        pendingZombies.clear();
    }

    private void releaseImp(Zombie thrower) {
        thrower.impsThrown++;
        Zombie imp = new Zombie(ZombieType.IMP, thrower.row, GargantuarUtil.impLandingX(thrower.x));
        pendingZombies.add(imp);
        log.debug("[Simulator] {} threw an imp to x={} on frame {}", thrower, imp.x, frame);
    }

    private void continueEating(Zombie z) {
        Plant target = plants.getAlive(z.targetPlantId);
        if (target == null) {
            z.stopEating();
            return;
        }
        // Frozen or buttered jaws do not move
        if (z.immobilized()) {
            return;
        }
        z.eatCountdown--;
        if (z.eatCountdown > 0) {
            return;
        }

        if (z.giant()) {
            for (int id : grid.idsAt(target.row, target.col)) {
                killPlant(plants.get(id), "smashed by " + z.type);
            }
            z.stopEating();
            return;
        }

        target.health -= config.getBiteDamage();
        z.eatCountdown = config.getBiteInterval();
        if (target.health <= 0) {
            killPlant(target, "eaten by " + z.type);
            z.stopEating();
        }
    }

    private void checkPlantContact(Zombie z) {
        Plant target = null;
        for (int col = 0; col < grid.getCols(); col++) {
            for (int id : grid.idsAt(z.row, col)) {
                Plant p = plants.getAlive(id);
                if (p == null || !CollisionUtil.canReach(z, p)) continue;
                // Overlay comes first in idsAt, so it wins a tie within its own cell
                if (target == null || p.pixelX() > target.pixelX()) {
                    target = p;
                }
            }
        }
        if (target != null) {
            z.eating = true;
            z.targetPlantId = target.id;
            z.eatCountdown = z.giant() ? GargantuarUtil.HAMMER_TIME : config.getBiteInterval();
        }
    }

    // --- Phase 3: plants ---

    private void updatePlants() {
        for (Plant p : plants.all()) {
            if (!p.alive) continue;
            switch (p.type.getRole()) {
                case SHOOTER:
                    updateShooter(p);
                    break;
                case SUN_PRODUCER:
                    updateSunProducer(p);
                    break;
                case INSTANT:
                    updateInstant(p);
                    break;
                case AREA_WEAPON:
                    if (p.attackCountdown > 0) p.attackCountdown--;
                    break;
                case WALL:
                case OVERLAY:
                    break;
                default:
                    throw new IllegalStateException("unhandled plant role " + p.type.getRole());
            }
        }
    }

    private void updateShooter(Plant p) {
        if (p.attackCountdown > 0) {
            p.attackCountdown--;
        }
        if (p.attackCountdown <= 0 && hasTarget(p)) {
            fire(p);
            p.attackCountdown = p.type.getInterval();
        }
    }

    private boolean hasTarget(Plant p) {
        double px = p.pixelX();
        for (Zombie z : zombies.all()) {
            if (!z.alive) continue;
            switch (p.type) {
                case THREEPEATER:
                    if (Math.abs(z.row - p.row) <= 1 && z.x > px) return true;
                    break;
                case SPLITPEA:
                    if (z.row == p.row) return true;
                    break;
                case PUFFSHROOM:
                    if (z.row == p.row && z.x > px && z.x <= px + PlantType.PUFF_RANGE) return true;
                    break;
                default:
                    if (z.row == p.row && z.x > px) return true;
            }
        }
        return false;
    }

    private void fire(Plant p) {
        double px = p.pixelX();
        switch (p.type) {
            case REPEATER:
                shoot(p, ProjectileType.PEA, p.row, px + SHOT_OFFSET, false);
                shoot(p, ProjectileType.PEA, p.row, px + SHOT_OFFSET + 5, false);
                break;
            case GATLINGPEA:
                for (int i = 0; i < 4; i++) {
                    shoot(p, ProjectileType.PEA, p.row, px + SHOT_OFFSET + i * 3, false);
                }
                break;
            case THREEPEATER:
                for (int r = p.row - 1; r <= p.row + 1; r++) {
                    if (r >= 0 && r < config.getRows()) {
                        shoot(p, ProjectileType.PEA, r, px + SHOT_OFFSET, false);
                    }
                }
                break;
            case SPLITPEA:
                shoot(p, ProjectileType.PEA, p.row, px + SHOT_OFFSET, false);
                shoot(p, ProjectileType.PEA, p.row, px + BACKWARD_SHOT_OFFSET, true);
                break;
            case KERNELPULT:
                p.shotCount++;
                ProjectileType kernel = p.shotCount % BUTTER_EVERY == 0 ? ProjectileType.BUTTER : ProjectileType.KERNEL;
                shoot(p, kernel, p.row, px + SHOT_OFFSET, false);
                break;
            default:
                shoot(p, p.type.getProjectile(), p.row, px + SHOT_OFFSET, false);
        }
    }

    private void shoot(Plant source, ProjectileType type, int row, double x, boolean backward) {
        projectiles.add(new Projectile(type, row, x, Geometry.rowToY(row), source.id, backward));
    }

    private void updateSunProducer(Plant p) {
        if (!config.isSunProduction()) {
            return;
        }
        p.attackCountdown--;
        if (p.attackCountdown <= 0) {
            sun += p.type.getSunYield();
            p.attackCountdown = p.type.getInterval();
        }
    }

    private void updateInstant(Plant p) {
        if (p.type == PlantType.SQUASH && !p.locked) {
            lockSquash(p);
            return;
        }
        p.attackCountdown--;
        if (p.attackCountdown <= 0) {
            detonate(p);
        }
    }

    private void lockSquash(Plant p) {
        double center = Geometry.colToCenterX(p.col);
        Zombie best = null;
        for (Zombie z : zombies.all()) {
            if (!z.alive || z.row != p.row || !CollisionUtil.isInSquashReach(p.pixelX(), z.x)) continue;
            if (best == null || Math.abs(z.x - center) < Math.abs(best.x - center)) {
                best = z;
            }
        }
        if (best != null) {
            p.locked = true;
            p.lockedX = best.x;
            p.attackCountdown = p.type.getInterval();
        }
    }

    private void detonate(Plant p) {
        int hits = 0;
        for (Zombie z : zombies.all()) {
            if (!z.alive) continue;
            InstantWeapon weapon;
            switch (p.type) {
                case CHERRY_BOMB:
                    if (!CollisionUtil.isCherryHit(z.x, z.row, p.row, p.col)) continue;
                    weapon = InstantWeapon.CHERRY_BOMB;
                    break;
                case JALAPENO:
                    if (!CollisionUtil.isJalapenoHit(z.row, p.row)) continue;
                    weapon = InstantWeapon.JALAPENO;
                    break;
                case DOOMSHROOM:
                    if (!CollisionUtil.isDoomHit(z.x, z.row, p.row, p.col)) continue;
                    weapon = InstantWeapon.DOOMSHROOM;
                    break;
                case SQUASH:
                    if (!CollisionUtil.isSquashHit(z.x, z.row, p.lockedX, p.row)) continue;
                    weapon = InstantWeapon.SQUASH;
                    break;
                case ICESHROOM:
                    StatusEffectUtil.applyIceChain(z);
                    hits++;
                    continue;
                default:
                    throw new IllegalStateException(p.type + " is not an instant plant");
            }
            hits++;
            if (DamageUtil.applyDamage(z, DamageUtil.instantDamage(z.type, weapon))) {
                onZombieKilled(z, weapon.name());
            }
        }
        log.debug("[Simulator] {} went off on frame {}, {} zombies hit", p, frame, hits);
        killPlant(p, "spent");
    }

    // --- Phase 4 and 5 ---

    private void cleanup() {
        projectiles.compact();
        strikes.compact();
        zombies.compact();
        plants.compact();
    }

    private void checkTerminal() {
        boolean anyAlive = false;
        for (Zombie z : zombies.all()) {
            if (!z.alive) continue;
            anyAlive = true;
            if (z.x < 0) {
                gameOver = true;
                win = false;
                log.debug("[Simulator] {} reached the house on frame {}", z, frame);
                return;
            }
        }
        if (!anyAlive && spawner != null && spawner.isFinished()) {
            gameOver = true;
            win = true;
            log.debug("[Simulator] Level cleared on frame {}", frame);
        }
    }

    private void killPlant(Plant p, String reason) {
        if (p == null || !p.alive) {
            return;
        }
        p.alive = false;
        p.health = Math.min(p.health, 0);
        grid.remove(p.id, p.row, p.col);
        log.debug("[Simulator] {} lost on frame {} ({})", p, frame, reason);
    }

    private void onZombieKilled(Zombie z, String cause) {
        z.stopEating();
        log.debug("[Simulator] {} killed by {} on frame {}", z, cause, frame);
    }

    // ==========================================
    // MUTATORS (all or nothing)
    // ==========================================

    public ActionResult placePlant(PlantType type, int row, int col) {
        if (type == null) {
            throw new IllegalArgumentException("plant type is required");
        }
        if (!grid.inBounds(row, col)) {
            return ActionResult.INVALID_POSITION;
        }
        int occupant = type.isOverlay() ? grid.getOverlay(row, col) : grid.get(row, col);
        if (occupant != GridIndex.EMPTY) {
            return ActionResult.CELL_OCCUPIED;
        }
        if (sun < type.getCost()) {
            return ActionResult.INSUFFICIENT_RESOURCE;
        }
        SeedCard card = cards.get(type);
        if (config.isEnforceCardRecharge() && !card.ready()) {
            return ActionResult.CARD_RECHARGING;
        }

        sun -= type.getCost();
        Plant plant = plants.add(new Plant(type, row, col));
        grid.insert(plant.id, row, col, type.isOverlay());
        card.rechargeCountdown = type.getRechargeTime();
        return ActionResult.SUCCESS;
    }

    /** Removes the regular plant in the cell, or the overlay if it stands alone. */
    public ActionResult removePlant(int row, int col) {
        if (!grid.inBounds(row, col)) {
            return ActionResult.INVALID_POSITION;
        }
        int id = grid.get(row, col);
        if (id == GridIndex.EMPTY) {
            id = grid.getOverlay(row, col);
        }
        if (id == GridIndex.EMPTY) {
            return ActionResult.NO_SUCH_ENTITY;
        }
        killPlant(plants.get(id), "removed");
        return ActionResult.SUCCESS;
    }

    public ActionResult removePlantById(int plantId) {
        Plant p = plants.getAlive(plantId);
        if (p == null) {
            return ActionResult.NO_SUCH_ENTITY;
        }
        killPlant(p, "removed");
        return ActionResult.SUCCESS;
    }

    public Optional<Zombie> spawnZombie(ZombieType type, int row) {
        return spawnZombie(type, row, config.getZombieSpawnX());
    }

    public Optional<Zombie> spawnZombie(ZombieType type, int row, double x) {
        if (type == null) {
            throw new IllegalArgumentException("zombie type is required");
        }
        if (row < 0 || row >= config.getRows()) {
            return Optional.empty();
        }
        return Optional.of(zombies.add(new Zombie(type, row, x)));
    }

    /**
     * Fires the first ready cob cannon at (targetX, targetRow). On the roof the fly time
     * depends on the column the shell lands in.
     */
    public ActionResult fireAreaWeapon(double targetX, int targetRow) {
        if (targetRow < 0 || targetRow >= config.getRows()) {
            return ActionResult.INVALID_POSITION;
        }
        Plant cannon = null;
        for (Plant p : plants.all()) {
            if (p.alive && p.type == PlantType.COB_CANNON && p.attackCountdown <= 0) {
                cannon = p;
                break;
            }
        }
        if (cannon == null) {
            return ActionResult.NO_SUCH_ENTITY;
        }
        int flyTime = TimingUtil.cobFlyTime(config.getScene(), Geometry.xToCol(targetX));
        strikes.add(new AreaStrike(targetRow, targetX, flyTime, cannon.id));
        cannon.attackCountdown = TimingUtil.COB_RECOVER_TIME;
        return ActionResult.SUCCESS;
    }

    @Override
    public ActionResult apply(Action action) {
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        switch (action.type) {
            case WAIT:
                return ActionResult.SUCCESS;
            case PLACE:
                return placePlant(action.plantType, action.row, action.col);
            case REMOVE:
                return removePlant(action.row, action.col);
            case FIRE_AREA_WEAPON:
                return fireAreaWeapon(action.targetX, action.row);
            default:
                throw new IllegalArgumentException("unknown action type " + action.type);
        }
    }

    public void addSun(int amount) {
        sun += amount;
    }

    public void attachSpawner(WaveSpawner spawner) {
        this.spawner = spawner;
    }

    // ==========================================
    // SNAPSHOT / RESTORE
    // ==========================================

    @Override
    public GameState snapshot() {
        GameState state = new GameState();
        state.frame = frame;
        state.sun = sun;
        state.wave = spawner == null ? 0 : spawner.getCurrentWave();
        state.spawner = spawner == null ? null : spawner.saveProgress();
        state.nextPlantId = plants.nextId();
        state.nextZombieId = zombies.nextId();
        state.nextProjectileId = projectiles.nextId();
        state.nextStrikeId = strikes.nextId();
        state.gameOver = gameOver;
        state.win = win;
        state.plants = plants.copyItems();
        state.zombies = zombies.copyItems();
        state.projectiles = projectiles.copyItems();
        state.strikes = strikes.copyItems();
        for (SeedCard card : cards.values()) {
            state.cards.add(card.copy());
        }
        return state;
    }

    /**
     * Replaces the whole lawn with a copy of {@code state}, rebuilding the grid index and id counters.
     * The attached wave spawner picks up the saved progress; a snapshot without one leaves it as it is.
     * On a malformed snapshot nothing changes.
     */
    public void restore(GameState state) {
        if (state == null) {
            throw new IllegalArgumentException("state is required");
        }
        if (state.spawner != null && spawner != null) {
            spawner.checkProgress(state.spawner);
        }
        Arena<Plant> newPlants = new Arena<>(Plant::copy);
        Arena<Zombie> newZombies = new Arena<>(Zombie::copy);
        Arena<Projectile> newProjectiles = new Arena<>(Projectile::copy);
        Arena<AreaStrike> newStrikes = new Arena<>(AreaStrike::copy);
        newPlants.load(state.plants, state.nextPlantId);
        newZombies.load(state.zombies, state.nextZombieId);
        newProjectiles.load(state.projectiles, state.nextProjectileId);
        newStrikes.load(state.strikes, state.nextStrikeId);

        GridIndex newGrid = new GridIndex(config.getRows(), config.getCols());
        for (Plant p : newPlants.all()) {
            if (!p.alive) continue;
            if (!newGrid.inBounds(p.row, p.col)) {
                throw new IllegalArgumentException("plant " + p + " lies outside the lawn");
            }
            newGrid.insert(p.id, p.row, p.col, p.type.isOverlay());
        }

        Map<PlantType, SeedCard> newCards = new EnumMap<>(PlantType.class);
        for (PlantType type : PlantType.values()) {
            newCards.put(type, new SeedCard(type));
        }
        for (SeedCard card : state.cards) {
            if (card.type != null) {
                newCards.put(card.type, card.copy());
            }
        }

        this.plants = newPlants;
        this.zombies = newZombies;
        this.projectiles = newProjectiles;
        this.strikes = newStrikes;
        this.grid = newGrid;
        this.cards = newCards;
        this.frame = state.frame;
        this.sun = state.sun;
        this.gameOver = state.gameOver;
        this.win = state.win;
        this.pendingZombies.clear();
        if (state.spawner != null && spawner != null) {
            spawner.restoreProgress(state.spawner);
        }
    }

    /**
     * Checks the internal consistency rules. A failure here is a bug, not a user error.
     *
     * @throws IllegalStateException on the first violation found
     */
    public void verifyIntegrity() {
        for (int r = 0; r < grid.getRows(); r++) {
            for (int c = 0; c < grid.getCols(); c++) {
                checkCell(grid.get(r, c), r, c, false);
                checkCell(grid.getOverlay(r, c), r, c, true);
            }
        }
        for (Plant p : plants.all()) {
            if (!p.alive) continue;
            int indexed = p.type.isOverlay() ? grid.getOverlay(p.row, p.col) : grid.get(p.row, p.col);
            if (indexed != p.id) {
                throw new IllegalStateException("alive plant " + p + " is missing from the grid index");
            }
        }
        int lastId = -1;
        for (Zombie z : zombies.all()) {
            if (z.id <= lastId) {
                throw new IllegalStateException("zombie ids out of order at " + z.id);
            }
            lastId = z.id;
            if (z.alive && z.bodyHealth <= 0) {
                throw new IllegalStateException("zombie " + z + " is alive with no body health");
            }
        }
    }

    private void checkCell(int id, int row, int col, boolean overlay) {
        if (id == GridIndex.EMPTY) {
            return;
        }
        Plant p = plants.get(id);
        if (p == null || !p.alive) {
            throw new IllegalStateException("grid cell " + row + "," + col + " points at dead plant " + id);
        }
        if (p.row != row || p.col != col || p.type.isOverlay() != overlay) {
            throw new IllegalStateException("grid cell " + row + "," + col + " points at misplaced plant " + p);
        }
    }

    // ==========================================
    // QUERIES
    // ==========================================

    public SimulationConfig getConfig() { return config; }
    public long getFrame() { return frame; }
    public int getSun() { return sun; }
    public boolean isGameOver() { return gameOver; }
    public boolean isWin() { return win; }
    public WaveSpawner getSpawner() { return spawner; }

    public Plant getPlant(int id) {
        return plants.getAlive(id);
    }

    public Zombie getZombie(int id) {
        return zombies.getAlive(id);
    }

    public Plant plantAt(int row, int col) {
        int id = grid.get(row, col);
        return id == GridIndex.EMPTY ? null : plants.getAlive(id);
    }

    public Plant overlayAt(int row, int col) {
        int id = grid.getOverlay(row, col);
        return id == GridIndex.EMPTY ? null : plants.getAlive(id);
    }

    public List<Plant> alivePlants() {
        return plants.alive();
    }

    public List<Zombie> aliveZombies() {
        return zombies.alive();
    }

    public List<Projectile> liveProjectiles() {
        return projectiles.alive();
    }

    public List<AreaStrike> pendingStrikes() {
        return strikes.alive();
    }

    public SeedCard getCard(PlantType type) {
        return cards.get(type);
    }

    public int totalZombieHealth() {
        int total = 0;
        for (Zombie z : zombies.all()) {
            if (z.alive) total += z.totalHealth();
        }
        return total;
    }
}
