package io.github.manjago.tidepool.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Configuration for the Tidepool simulator.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record SimulatorConfig(
    EnergySettings energy,
    LifecycleSettings lifecycle,
    ReproductionSettings reproduction,
    PopulationSettings population,

    // World
    double worldWidth,
    double worldHeight,
    double maxSpeed,

    // Feeding
    double feedingProbability,
    double planktonEnergy,

    // Run
    long seed,                // 0 = random
    int initialPopulation,
    long maxTicks,            // 0 = infinite

    // Persistence
    Path dataFile,
    int checkpointInterval,   // ticks between checkpoints, 0 = disabled

    // Reporting
    int reportInterval        // ticks between progress reports
) {

    /**
     * Load default configuration.
     */
    public static SimulatorConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static SimulatorConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load()).resolve();
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static SimulatorConfig fromConfig(Config config) {
        Config c = config.getConfig("tidepool");

        return new SimulatorConfig(
            EnergySettings.fromConfig(c.getConfig("energy")),
            LifecycleSettings.fromConfig(c.getConfig("lifecycle")),
            ReproductionSettings.fromConfig(c.getConfig("reproduction"), c.getConfig("interaction")),
            PopulationSettings.fromConfig(c.getConfig("population")),
            c.getDouble("world.width"),
            c.getDouble("world.height"),
            c.getDouble("world.max-speed"),
            c.getDouble("feeding.probability"),
            c.getDouble("feeding.plankton-energy"),
            c.getLong("simulation.seed"),
            c.getInt("simulation.initial-population"),
            c.getLong("simulation.max-ticks"),
            Path.of(c.getString("persistence.file")),
            c.getInt("persistence.checkpoint-interval"),
            c.getInt("reporting.interval")
        );
    }

    /**
     * Seed to use for this run: the configured one, or a fresh random seed when 0.
     */
    public long effectiveSeed() {
        return seed != 0 ? seed : ThreadLocalRandom.current().nextLong();
    }

    /**
     * Builder for programmatic configuration, starting from reference.conf defaults.
     */
    public static Builder builder() {
        return new Builder(defaults());
    }

    /**
     * Builder starting from this configuration.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private EnergySettings energy;
        private LifecycleSettings lifecycle;
        private ReproductionSettings reproduction;
        private PopulationSettings population;
        private double worldWidth;
        private double worldHeight;
        private double maxSpeed;
        private double feedingProbability;
        private double planktonEnergy;
        private long seed;
        private int initialPopulation;
        private long maxTicks;
        private Path dataFile;
        private int checkpointInterval;
        private int reportInterval;

        private Builder(SimulatorConfig base) {
            this.energy = base.energy();
            this.lifecycle = base.lifecycle();
            this.reproduction = base.reproduction();
            this.population = base.population();
            this.worldWidth = base.worldWidth();
            this.worldHeight = base.worldHeight();
            this.maxSpeed = base.maxSpeed();
            this.feedingProbability = base.feedingProbability();
            this.planktonEnergy = base.planktonEnergy();
            this.seed = base.seed();
            this.initialPopulation = base.initialPopulation();
            this.maxTicks = base.maxTicks();
            this.dataFile = base.dataFile();
            this.checkpointInterval = base.checkpointInterval();
            this.reportInterval = base.reportInterval();
        }

        public Builder energy(EnergySettings energy) { this.energy = energy; return this; }
        public Builder lifecycle(LifecycleSettings lifecycle) { this.lifecycle = lifecycle; return this; }
        public Builder reproduction(ReproductionSettings reproduction) { this.reproduction = reproduction; return this; }
        public Builder population(PopulationSettings population) { this.population = population; return this; }
        public Builder maxPopulation(int max, int critical) { this.population = population.withMaxPopulation(max, critical); return this; }
        public Builder worldSize(double width, double height) { this.worldWidth = width; this.worldHeight = height; return this; }
        public Builder maxSpeed(double speed) { this.maxSpeed = speed; return this; }
        public Builder feedingProbability(double p) { this.feedingProbability = p; return this; }
        public Builder planktonEnergy(double e) { this.planktonEnergy = e; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder initialPopulation(int n) { this.initialPopulation = n; return this; }
        public Builder maxTicks(long max) { this.maxTicks = max; return this; }
        public Builder dataFile(Path file) { this.dataFile = file; return this; }
        public Builder checkpointInterval(int interval) { this.checkpointInterval = interval; return this; }
        public Builder reportInterval(int interval) { this.reportInterval = interval; return this; }

        public SimulatorConfig build() {
            return new SimulatorConfig(
                energy, lifecycle, reproduction, population,
                worldWidth, worldHeight, maxSpeed,
                feedingProbability, planktonEnergy,
                seed, initialPopulation, maxTicks,
                dataFile, checkpointInterval, reportInterval
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            SimulatorConfig:
              world:                  %.0f x %.0f (max speed %.2f)
              energy.max-default:     %.1f
              energy.bank-multiplier: %.2f
              lifecycle.stages:       baby<%d, juvenile<%d, adult<%d, lifespan %d
              reproduction.cooldown:  %d ticks
              reproduction.credits:   %s
              population.max:         %d (critical %d)
              simulation.seed:        %s
              simulation.initial:     %d fish
              simulation.max-ticks:   %s
              persistence.file:       %s
              persistence.checkpoint: %,d ticks
              reporting.interval:     %,d ticks
            """,
            worldWidth, worldHeight, maxSpeed,
            energy.maxEnergyDefault(),
            energy.bankMultiplier(),
            lifecycle.babyMaxAge(), lifecycle.juvenileMaxAge(), lifecycle.adultMaxAge(), lifecycle.baseMaxAge(),
            reproduction.cooldownTicks(),
            reproduction.creditsEnabled() ? String.format("%.2f required", reproduction.creditsRequired()) : "disabled",
            population.maxPopulation(), population.criticalPopulation(),
            seed == 0 ? "random" : String.valueOf(seed),
            initialPopulation,
            maxTicks == 0 ? "infinite" : String.format("%,d", maxTicks),
            dataFile,
            checkpointInterval,
            reportInterval
        );
    }
}
