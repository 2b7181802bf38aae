package io.github.manjago.tidepool.sim;

import io.github.manjago.tidepool.agent.AgentIdentity;
import io.github.manjago.tidepool.agent.DeathCause;
import io.github.manjago.tidepool.agent.DefaultGenetics;
import io.github.manjago.tidepool.agent.EnergyBurn;
import io.github.manjago.tidepool.agent.EnergyLedger;
import io.github.manjago.tidepool.agent.Fish;
import io.github.manjago.tidepool.agent.FishFactory;
import io.github.manjago.tidepool.agent.Food;
import io.github.manjago.tidepool.agent.Genetics;
import io.github.manjago.tidepool.agent.Genome;
import io.github.manjago.tidepool.agent.LifecycleStateMachine;
import io.github.manjago.tidepool.config.SimulatorConfig;
import io.github.manjago.tidepool.core.Bounds;
import io.github.manjago.tidepool.core.GameRng;
import io.github.manjago.tidepool.energy.EnergyDeltaRouter;
import io.github.manjago.tidepool.energy.EnergySources;
import io.github.manjago.tidepool.energy.EnergyTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main simulation engine for Tidepool.
 *
 * Owns the tank, the fish registry and the energy and reproduction
 * machinery, and drives them one tick at a time. Can be started and
 * stopped; supports graceful shutdown.
 *
 * One tick:
 * 1. every live fish ages, grows, pays its metabolism and may die of old age
 * 2. one fish may find food
 * 3. the reproduction sweep queues births
 * 4. dead fish are queued for removal and the registry commits
 */
public class Simulator {

    private static final Logger log = LoggerFactory.getLogger(Simulator.class);

    /** Share of max speed a fish drifts at, at most. */
    private static final double DRIFT_SPEED_RATIO = 0.6;

    private final SimulatorConfig config;
    private final GameRng rng;

    // Core components
    private final TankWorld world;
    private final Population population;
    private final EnergyTracker energyTracker;
    private final Genetics genetics;
    private final FishFactory factory;
    private final EnergyDeltaRouter router;
    private final ReproductionOrchestrator orchestrator;
    private final InteractionOutcomeHandler interactions;

    // Statistics
    private long tick = 0;
    private int extinctions = 0;
    private double timeModifier = 1.0;

    // Control
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    // Event listener
    private SimulatorListener listener = SimulatorListener.NOOP;

    // Random seed used (for reproducibility logging)
    private final long actualSeed;

    public Simulator(SimulatorConfig config) {
        this(config, new GameRng(config.effectiveSeed()));
    }

    /**
     * Create with an existing RNG (checkpoint restore, tests).
     */
    public Simulator(SimulatorConfig config, GameRng rng) {
        this.config = config;
        this.rng = rng;
        this.actualSeed = rng.getInitialSeed();
        this.world = new TankWorld(config.worldWidth(), config.worldHeight());
        this.population = new Population(config.population().maxPopulation());
        this.energyTracker = new EnergyTracker();
        this.genetics = new DefaultGenetics();
        this.factory = new FishFactory(config.energy(), config.lifecycle(), config.reproduction());
        this.router = new EnergyDeltaRouter(config.energy(), world, population, energyTracker, rng, () -> tick);
        this.orchestrator = new ReproductionOrchestrator(config.reproduction(), config.population(),
                factory, genetics, population, router, world, rng);
        this.interactions = new InteractionOutcomeHandler(population, router, orchestrator);

        log.info("Simulator created (seed: {})", actualSeed);
    }

    /**
     * Get the actual random seed used (useful for reproducing runs).
     */
    public long getActualSeed() {
        return actualSeed;
    }

    /**
     * Set event listener for simulation events.
     */
    public void setListener(SimulatorListener listener) {
        this.listener = listener != null ? listener : SimulatorListener.NOOP;
    }

    /**
     * Seed founders: random genomes at random points, generation 0.
     *
     * @param count number of founders, 0 = use config.initialPopulation
     */
    public void seedPopulation(int count) {
        int n = count > 0 ? count : config.initialPopulation();
        int seeded = 0;
        for (int i = 0; i < n; i++) {
            Genome genome = genetics.randomGenome(rng);
            double[] point = world.randomPoint(rng, config.population().spawnMargin());
            Fish founder = factory.create(population.nextAgentId(), genome, 0, AgentIdentity.NO_PARENT,
                    FishFactory.DEFAULT_SPECIES, point[0], point[1], factory.initialEnergy(genome), tick);
            if (population.requestSpawn(founder, "founder")) {
                seeded++;
            }
        }
        finishTick(population.commitTick(tick));
        log.info("Seeded {} founders", seeded);
    }

    /**
     * Run simulation for specified number of ticks.
     * Returns when ticks complete or stop is requested.
     *
     * @param ticks number of ticks to run (0 = use config.maxTicks)
     */
    public void run(long ticks) {
        long targetTicks = ticks > 0 ? ticks : config.maxTicks();
        boolean infinite = targetTicks == 0;

        if (running.getAndSet(true)) {
            log.warn("Simulator already running");
            return;
        }

        stopRequested.set(false);
        log.info("Starting simulation{}", infinite ? " (infinite)" : String.format(" for %,d ticks", targetTicks));

        long startTime = System.currentTimeMillis();
        long ticksDone = 0;

        try {
            while (!stopRequested.get()) {
                if (!infinite && ticksDone >= targetTicks) {
                    break;
                }

                runTick();
                ticksDone++;

                // Progress report
                if (config.reportInterval() > 0 && tick % config.reportInterval() == 0) {
                    reportProgress();
                }

                // Checkpoint
                if (config.checkpointInterval() > 0 && tick % config.checkpointInterval() == 0) {
                    listener.onCheckpoint(tick);
                }
            }
        } finally {
            running.set(false);
            long elapsed = System.currentTimeMillis() - startTime;
            log.info("Simulation stopped after {} ticks ({} ms, {} ticks/sec)",
                    ticksDone, elapsed, ticksDone * 1000 / Math.max(1, elapsed));
        }
    }

    /**
     * Request graceful stop.
     */
    public void stop() {
        log.info("Stop requested");
        stopRequested.set(true);
    }

    /**
     * Check if simulation is running.
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Run a single simulation tick.
     */
    public void runTick() {
        tick++;
        energyTracker.setTick(tick);
        population.beginTick(tick);

        List<Fish> snapshot = population.getLiveAgents();
        for (Fish fish : snapshot) {
            updateFish(fish);
        }

        feed();

        if (!snapshot.isEmpty() && population.getActiveCount() == 0) {
            extinctions++;
            log.info("Tick {}: population extinct", tick);
            listener.onExtinction(tick);
        }

        orchestrator.updateTick(tick);

        for (Fish fish : population.getAll()) {
            if (!fish.isActive()) {
                population.requestRemove(fish, fish.describeDeathCause());
            }
        }
        finishTick(population.commitTick(tick));
    }

    private void updateFish(Fish fish) {
        LifecycleStateMachine lifecycle = fish.getLifecycle();
        lifecycle.advance(lifecycle.getAge() + 1, tick);
        syncMaxEnergy(fish);

        drift(fish);

        EnergyBurn burn = fish.getEnergyLedger().calculateBurn(
                fish.getSpeed(), config.maxSpeed(), lifecycle.getStage(), timeModifier, lifecycle.getSize());
        router.modifyEnergy(fish, -burn.total(), EnergySources.METABOLISM);

        if (fish.isActive() && lifecycle.isDyingOfOldAge()) {
            fish.getMortality().die(DeathCause.OLD_AGE, tick);
        }
    }

    /**
     * Capacity follows size. Growth only raises it; a clamp is recorded so
     * the energy it removes is still accounted for.
     */
    private void syncMaxEnergy(Fish fish) {
        EnergyLedger ledger = fish.getEnergyLedger();
        double target = factory.maxEnergyForSize(fish.getLifecycle().getSize());
        if (target != ledger.getMaxEnergy()) {
            double clamped = ledger.setMaxEnergy(target);
            if (clamped > 0) {
                energyTracker.record(EnergySources.CAPACITY_CLAMP, -clamped);
            }
        }
    }

    /**
     * Random wandering so fish spread out and pay some movement cost.
     */
    private void drift(Fish fish) {
        double angle = rng.nextDouble(0, 2 * Math.PI);
        double speed = rng.nextDouble(0, config.maxSpeed() * DRIFT_SPEED_RATIO);
        double vx = Math.cos(angle) * speed;
        double vy = Math.sin(angle) * speed;
        Bounds bounds = world.getBounds();
        fish.setVelocity(vx, vy);
        fish.moveTo(bounds.clampX(fish.getX() + vx), bounds.clampY(fish.getY() + vy));
    }

    /**
     * With the configured probability one fish eats: the nearest spilled
     * food if there is any, otherwise plankton.
     */
    private void feed() {
        if (!rng.nextBoolean(config.feedingProbability())) {
            return;
        }
        List<Fish> live = population.getLiveAgents();
        if (live.isEmpty()) {
            return;
        }
        Fish eater = rng.choose(live);

        Optional<Food> nearest = population.getFood().stream()
                .min(Comparator.comparingDouble(eater::distanceSquaredTo));
        if (nearest.isPresent() && population.takeFood(nearest.get())) {
            router.modifyEnergy(eater, nearest.get().getEnergy(), EnergySources.FOOD);
        } else {
            router.modifyEnergy(eater, config.planktonEnergy(), EnergySources.PLANKTON);
        }
    }

    private void finishTick(Population.TickCommit commit) {
        for (Population.Removal removal : commit.removed()) {
            String cause = removal.fish().describeDeathCause();
            log.debug("Fish {} left the tank: {}", removal.fish().getId(), cause);
            listener.onDeath(removal.fish(), cause, tick);
        }
        for (Fish child : commit.spawned()) {
            listener.onSpawn(child, tick);
        }
    }

    // ========== External events ==========

    /**
     * Apply a minigame result between two fish.
     *
     * @return offspring queued as a result, if any
     */
    public Optional<Fish> applyInteraction(InteractionOutcome outcome) {
        return interactions.handle(outcome, tick);
    }

    /**
     * Remember that a predator got close to a fish.
     */
    public void recordPredatorEncounter(int fishId) {
        population.findById(fishId).ifPresent(
                fish -> fish.getMortality().recordPredatorEncounter(fish.getAge()));
    }

    /**
     * A predator bites a fish. Counts as an encounter; the damage is an
     * energy loss, so a fatal bite shows up as predation.
     *
     * @return energy actually taken
     */
    public double applyPredation(int fishId, double damage) {
        Optional<Fish> target = population.findById(fishId).filter(Fish::isActive);
        if (target.isEmpty()) {
            return 0.0;
        }
        Fish fish = target.get();
        fish.getMortality().recordPredatorEncounter(fish.getAge());
        return -router.modifyEnergy(fish, -Math.abs(damage), EnergySources.PREDATION);
    }

    /**
     * A fish swims out of the tank. It is removed at the end of the tick.
     *
     * @return false if the fish is unknown or not active
     */
    public boolean migrate(int fishId) {
        Optional<Fish> target = population.findById(fishId).filter(Fish::isActive);
        return target.isPresent() && population.requestRemove(target.get(), DeathCause.MIGRATION.label());
    }

    /**
     * Give a fish energy from an outside source.
     *
     * @return energy committed to the fish (the rest was banked or spilled)
     */
    public double feed(int fishId, double amount, String source) {
        return population.findById(fishId)
                .filter(Fish::isActive)
                .map(fish -> router.modifyEnergy(fish, amount, source))
                .orElse(0.0);
    }

    /**
     * Day/night style multiplier applied to existence and metabolism costs.
     */
    public void setTimeModifier(double timeModifier) {
        if (!(timeModifier >= 0)) {
            throw new IllegalArgumentException("Time modifier must not be negative: " + timeModifier);
        }
        this.timeModifier = timeModifier;
    }

    // ========== Restore ==========

    /**
     * Restore counters after a checkpoint load.
     */
    public void restoreState(long tick, int extinctions, long lastEmergencyTick) {
        this.tick = tick;
        this.extinctions = extinctions;
        this.orchestrator.setLastEmergencyTick(lastEmergencyTick);
        this.energyTracker.setTick(tick);
        this.population.beginTick(tick);
        log.info("Restored simulator state at tick {}", tick);
    }

    private void reportProgress() {
        log.info("Tick {}: {} alive, {} spawns, {} deaths, {} food",
                tick, population.getActiveCount(), population.getTotalSpawns(),
                population.getTotalRemovals(), population.getFood().size());

        listener.onProgress(getStats());
    }

    // ========== Getters ==========

    public SimulatorConfig getConfig() { return config; }
    public long getTick() { return tick; }
    public GameRng getGameRng() { return rng; }
    public TankWorld getWorld() { return world; }
    public Population getPopulation() { return population; }
    public EnergyTracker getEnergyTracker() { return energyTracker; }
    public EnergyDeltaRouter getRouter() { return router; }
    public ReproductionOrchestrator getOrchestrator() { return orchestrator; }
    public FishFactory getFactory() { return factory; }
    public int getExtinctions() { return extinctions; }

    /**
     * Get current simulation statistics.
     */
    public SimulatorStats getStats() {
        List<Fish> live = population.getLiveAgents();
        double fishEnergy = live.stream().mapToDouble(Fish::getEnergy).sum();
        double banked = live.stream().mapToDouble(f -> f.getReproductionLedger().getOverflowBank()).sum();
        Runtime runtime = Runtime.getRuntime();
        long heapUsed = (runtime.totalMemory() - runtime.freeMemory()) / (1024 * 1024);
        long heapMax = runtime.maxMemory() / (1024 * 1024);

        return new SimulatorStats(
            tick,
            population.getTotalSpawns(),
            orchestrator.getBankedBirths(),
            orchestrator.getTraitBirths(),
            orchestrator.getSexualBirths(),
            orchestrator.getEmergencySpawns(),
            orchestrator.getFailedSpawns(),
            population.getTotalRemovals(),
            population.getRemovalsByCause(),
            live.size(),
            population.getMaxAlive(),
            extinctions,
            fishEnergy,
            banked,
            population.getFood().size(),
            population.getFoodEnergy(),
            heapUsed,
            heapMax
        );
    }
}
