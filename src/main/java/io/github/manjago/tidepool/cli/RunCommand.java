package io.github.manjago.tidepool.cli;

import io.github.manjago.tidepool.config.SimulatorConfig;
import io.github.manjago.tidepool.persistence.CheckpointStore;
import io.github.manjago.tidepool.sim.Simulator;
import io.github.manjago.tidepool.sim.SimulatorListener;
import io.github.manjago.tidepool.sim.SimulatorStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Run simulation command.
 *
 * Examples:
 *   tidepool run                           # Run with defaults
 *   tidepool run -t 100000                 # Run 100K ticks
 *   tidepool run --config my.conf          # Use custom config
 *   tidepool run --seed 42 -o run.mv       # Reproducible run, checkpoint to run.mv
 *   tidepool run --resume run.mv -t 5000   # Continue a saved run
 */
@Command(
    name = "run",
    description = "Run a new simulation or resume a saved one",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-t", "--ticks"}, description = "Max ticks (0 = infinite)")
    private Long maxTicks;

    @Option(names = {"-s", "--seed"}, description = "Random seed (0 = random)")
    private Long seed;

    @Option(names = {"-n", "--initial-population"}, description = "Number of founder fish")
    private Integer initialPopulation;

    @Option(names = {"-m", "--max-population"}, description = "Population cap")
    private Integer maxPopulation;

    @Option(names = {"-o", "--output"}, description = "Checkpoint file, written periodically and at the end")
    private Path outputFile;

    @Option(names = {"-r", "--resume"},
            description = "Resume from checkpoint (config from --config if given, else from the checkpoint)")
    private Path resumeFile;

    @Option(names = {"--checkpoint-interval"}, description = "Checkpoint interval (ticks, 0 = disabled)")
    private Integer checkpointInterval;

    @Option(names = {"--report-interval"}, description = "Progress report interval (ticks)")
    private Integer reportInterval;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (minimal output)")
    private boolean quiet;

    @Override
    public Integer call() {
        Simulator simulator;
        try {
            simulator = createSimulator();
        } catch (IOException | RuntimeException e) {
            System.err.println("❌ Cannot start simulation: " + e.getMessage());
            log.error("Cannot start simulation", e);
            return 1;
        }

        SimulatorConfig config = simulator.getConfig();
        if (!quiet) {
            printBanner();
            printConfig(config, simulator);
        }

        // Setup graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (simulator.isRunning()) {
                System.out.println("\n⏸️  Stopping gracefully...");
                simulator.stop();
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }));

        simulator.setListener(new ConsoleProgressListener(simulator,
                outputFile != null ? outputFile : config.dataFile(), quiet));

        if (!quiet) {
            System.out.println("▶️  Running simulation...\n");
        }

        long startTime = System.currentTimeMillis();
        simulator.run(maxTicks != null ? maxTicks : 0);
        long elapsed = System.currentTimeMillis() - startTime;

        int exitCode = 0;
        if (outputFile != null) {
            exitCode = saveCheckpoint(simulator, outputFile) ? 0 : 1;
        }

        if (!quiet) {
            printFinalReport(simulator, elapsed);
        }

        return exitCode;
    }

    private Simulator createSimulator() throws IOException {
        if (resumeFile != null) {
            if (!CheckpointStore.isValidCheckpoint(resumeFile)) {
                throw new IOException("Not a valid checkpoint: " + resumeFile);
            }
            if (!quiet) {
                System.out.println("📂 " + CheckpointStore.getInfo(resumeFile));
            }
            return CheckpointStore.restore(resumeFile, configFile != null ? buildConfig() : null);
        }

        Simulator simulator = new Simulator(buildConfig());
        if (!quiet) {
            System.out.println("🌱 Seeding founders...");
        }
        simulator.seedPopulation(0);
        return simulator;
    }

    SimulatorConfig buildConfig() {
        SimulatorConfig.Builder builder = configFile != null
                ? SimulatorConfig.fromFile(configFile).toBuilder()
                : SimulatorConfig.builder();

        // Override from CLI options
        if (maxTicks != null) builder.maxTicks(maxTicks);
        if (seed != null) builder.seed(seed);
        if (initialPopulation != null) builder.initialPopulation(initialPopulation);
        if (outputFile != null) builder.dataFile(outputFile);
        if (checkpointInterval != null) builder.checkpointInterval(checkpointInterval);
        if (reportInterval != null) builder.reportInterval(reportInterval);

        SimulatorConfig config = builder.build();
        if (maxPopulation != null) {
            int critical = Math.min(config.population().criticalPopulation(), maxPopulation - 1);
            config = config.toBuilder().maxPopulation(maxPopulation, Math.max(0, critical)).build();
        }
        return config;
    }

    private static boolean saveCheckpoint(Simulator simulator, Path file) {
        try {
            CheckpointStore.save(simulator, file);
            return true;
        } catch (IOException e) {
            System.err.println("❌ Checkpoint failed: " + e.getMessage());
            log.error("Checkpoint to {} failed", file, e);
            return false;
        }
    }

    private void printBanner() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║          TIDEPOOL Simulator           ║");
        System.out.println("║     Energy, Growth and Offspring      ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();
    }

    private void printConfig(SimulatorConfig config, Simulator simulator) {
        System.out.println("Configuration:");
        System.out.printf("  Tank:            %.0f x %.0f%n", config.worldWidth(), config.worldHeight());
        System.out.printf("  Population cap:  %d (critical %d)%n",
                config.population().maxPopulation(), config.population().criticalPopulation());
        System.out.printf("  Seed:            %d%n", simulator.getActualSeed());
        long ticks = maxTicks != null ? maxTicks : config.maxTicks();
        System.out.printf("  Max ticks:       %s%n",
                ticks == 0 ? "∞ (infinite)" : String.format("%,d", ticks));
        System.out.println();
    }

    private void printFinalReport(Simulator simulator, long elapsedMs) {
        SimulatorStats stats = simulator.getStats();
        double speed = stats.totalTicks() * 1000.0 / Math.max(1, elapsedMs);

        System.out.println();
        System.out.println("═══════════════════════════════════════");
        System.out.println("         SIMULATION COMPLETE           ");
        System.out.println("═══════════════════════════════════════");
        System.out.println();

        System.out.printf("⏱️  Time: %s  |  Speed: %,.0f ticks/sec%n",
                formatDuration(elapsedMs), speed);
        System.out.println();

        System.out.println("🐟 Population:");
        System.out.printf("   Alive: %,d (max %,d)  |  Extinctions: %,d%n",
                stats.aliveCount(), stats.maxAlive(), stats.extinctions());
        System.out.printf("   Births: %,d banked, %,d trait, %,d sexual, %,d emergency (%,d failed)%n",
                stats.bankedBirths(), stats.traitBirths(), stats.sexualBirths(),
                stats.emergencySpawns(), stats.failedSpawns());
        System.out.printf("   Deaths: %,d%n", stats.totalDeaths());
        for (Map.Entry<String, Integer> e : stats.deathsByCause().entrySet()) {
            System.out.printf("     %-14s %,d%n", e.getKey(), e.getValue());
        }
        System.out.println();

        System.out.println("⚡ Energy:");
        System.out.printf("   In fish: %,.1f  |  Banked: %,.1f  |  Food: %,.1f (%d items)%n",
                stats.totalFishEnergy(), stats.totalBankedEnergy(), stats.foodEnergy(), stats.foodCount());
        simulator.getEnergyTracker().getTopSources(5).forEach((source, total) ->
                System.out.printf("   %-22s %,+.1f%n", source, total));

        System.out.println();
        System.out.println("═══════════════════════════════════════");
    }

    private String formatDuration(long ms) {
        if (ms < 1000) {
            return ms + " ms";
        } else if (ms < 60_000) {
            return String.format("%.1f sec", ms / 1000.0);
        } else {
            long minutes = ms / 60_000;
            long seconds = (ms % 60_000) / 1000;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    /**
     * Console progress listener with live updates; writes periodic checkpoints.
     */
    private static class ConsoleProgressListener implements SimulatorListener {
        private static final String[] SPINNER = {"⠋", "⠙", "⠹", "⠸", "⠼", "⠴", "⠦", "⠧", "⠇", "⠏"};

        private final Simulator simulator;
        private final Path checkpointFile;
        private final boolean quiet;
        private int spinnerIdx = 0;

        ConsoleProgressListener(Simulator simulator, Path checkpointFile, boolean quiet) {
            this.simulator = simulator;
            this.checkpointFile = checkpointFile;
            this.quiet = quiet;
        }

        @Override
        public void onProgress(SimulatorStats stats) {
            if (quiet) {
                return;
            }
            String spinner = SPINNER[spinnerIdx++ % SPINNER.length];

            // Compact one-line progress
            System.out.printf("\r%s Tick %,d  |  🐟 %d alive  |  🐣 %d births  |  💀 %d deaths  |  🍤 %d food   ",
                    spinner,
                    stats.totalTicks(),
                    stats.aliveCount(),
                    stats.totalSpawns(),
                    stats.totalDeaths(),
                    stats.foodCount());
            System.out.flush();
        }

        @Override
        public void onExtinction(long tick) {
            if (!quiet) {
                System.out.printf("%n☠️  Extinction at tick %,d%n", tick);
            }
        }

        @Override
        public void onCheckpoint(long tick) {
            if (checkpointFile != null && saveCheckpoint(simulator, checkpointFile) && !quiet) {
                System.out.printf("%n💾 Checkpoint at tick %,d%n", tick);
            }
        }
    }
}
