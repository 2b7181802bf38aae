package io.github.manjago.tidepool.cli;

import io.github.manjago.tidepool.agent.LifeStage;
import io.github.manjago.tidepool.persistence.AgentRecord;
import io.github.manjago.tidepool.persistence.CheckpointStore;
import io.github.manjago.tidepool.persistence.CheckpointStore.CheckpointData;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * CLI command: checkpoint
 *
 * Work with checkpoint files.
 *
 * Usage:
 *   tidepool checkpoint info run.mv          # Show checkpoint info
 *   tidepool checkpoint diff run1.mv run2.mv # Compare two checkpoints
 */
@Command(
    name = "checkpoint",
    description = "Work with checkpoint files",
    mixinStandardHelpOptions = true,
    subcommands = {
        CheckpointCommand.InfoCommand.class,
        CheckpointCommand.DiffCommand.class
    }
)
public class CheckpointCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Use 'checkpoint info' or 'checkpoint diff'");
        System.out.println("Run 'tidepool checkpoint --help' for usage");
        return 0;
    }

    // ========== Subcommand: info ==========

    @Command(
        name = "info",
        description = "Show detailed checkpoint information",
        mixinStandardHelpOptions = true
    )
    public static class InfoCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Checkpoint file (.mv)")
        private Path checkpointFile;

        @Option(names = {"-a", "--all"}, description = "Show all fish (not just first 20)")
        private boolean showAll;

        @Override
        public Integer call() {
            CheckpointData data;
            try {
                data = CheckpointStore.load(checkpointFile);
            } catch (IOException | RuntimeException e) {
                System.err.println("❌ Error reading checkpoint: " + e.getMessage());
                return 1;
            }

            System.out.println("═".repeat(60));
            System.out.println("CHECKPOINT INFO: " + checkpointFile.getFileName());
            System.out.println("═".repeat(60));
            System.out.println();

            System.out.println("📋 Metadata:");
            System.out.printf("   Version:      %d%n", data.version());
            System.out.printf("   Tick:         %,d%n", data.tick());
            System.out.printf("   Seed:         %d%n", data.seed());
            System.out.printf("   Tank:         %.0f x %.0f%n", data.worldWidth(), data.worldHeight());
            System.out.println();

            System.out.println("🐟 Population:");
            System.out.printf("   Fish:         %d (cap %d, critical %d)%n",
                    data.agents().size(), data.maxPopulation(), data.criticalPopulation());
            System.out.printf("   Extinctions:  %,d%n", data.extinctions());
            System.out.printf("   Next fish ID: %d%n", data.nextAgentId());
            System.out.printf("   Food items:   %d (%,.1f energy)%n",
                    data.food().size(), data.food().stream().mapToDouble(f -> f.getEnergy()).sum());
            System.out.println();

            System.out.println("🎲 RNG:");
            if (data.hasDeterministicRng()) {
                var rng = data.rngState();
                byte[] rngBytes = rng.toBytes();
                System.out.printf("   Initial seed: %d%n", rng.initialSeed());
                System.out.printf("   State size: %d bytes%n", rngBytes.length);
                System.out.printf("   State hash: %08X%n", Arrays.hashCode(rngBytes));
                System.out.println("   ✅ Deterministic resume supported");
            } else {
                System.out.println("   ❌ No RNG state (non-deterministic)");
            }
            System.out.println();

            List<AgentRecord> agents = data.agents();
            if (agents.isEmpty()) {
                return 0;
            }

            Map<LifeStage, Integer> byStage = new EnumMap<>(LifeStage.class);
            Map<String, Integer> bySpecies = new TreeMap<>();
            double energy = 0;
            double banked = 0;
            int maxGeneration = 0;
            for (AgentRecord a : agents) {
                byStage.merge(a.stage(), 1, Integer::sum);
                bySpecies.merge(a.species(), 1, Integer::sum);
                energy += a.energy();
                banked += a.overflowBank();
                maxGeneration = Math.max(maxGeneration, a.generation());
            }

            System.out.println("📊 Population Analysis:");
            for (LifeStage stage : LifeStage.values()) {
                int n = byStage.getOrDefault(stage, 0);
                System.out.printf("   %-9s %,d (%.1f%%)%n", stage, n, 100.0 * n / agents.size());
            }
            System.out.printf("   Energy in fish: %,.1f  |  Banked: %,.1f%n", energy, banked);
            System.out.printf("   Deepest generation: %d%n", maxGeneration);
            bySpecies.forEach((species, n) -> System.out.printf("   Species %s: %,d%n", species, n));
            System.out.println();

            System.out.println("🧬 Fish:");
            int limit = showAll ? Integer.MAX_VALUE : 20;
            agents.stream().limit(limit).forEach(a ->
                System.out.printf("   #%d %-8s gen=%d age=%d energy=%.1f/%.1f bank=%.1f cooldown=%d %s%n",
                    a.id(), a.stage(), a.generation(), a.age(), a.energy(), a.maxEnergy(),
                    a.overflowBank(), a.cooldown(), a.state()));

            if (!showAll && agents.size() > 20) {
                System.out.printf("   ... and %d more (use -a to show all)%n", agents.size() - 20);
            }

            return 0;
        }
    }

    // ========== Subcommand: diff ==========

    @Command(
        name = "diff",
        description = "Compare two checkpoints for determinism verification",
        mixinStandardHelpOptions = true
    )
    public static class DiffCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "First checkpoint file")
        private Path file1;

        @Parameters(index = "1", description = "Second checkpoint file")
        private Path file2;

        @Override
        public Integer call() {
            CheckpointData d1;
            CheckpointData d2;
            try {
                d1 = CheckpointStore.load(file1);
                d2 = CheckpointStore.load(file2);
            } catch (IOException | RuntimeException e) {
                System.err.println("❌ Error comparing checkpoints: " + e.getMessage());
                return 1;
            }

            System.out.println("═".repeat(60));
            System.out.println("CHECKPOINT DIFF");
            System.out.println("═".repeat(60));
            System.out.printf("File 1: %s%n", file1);
            System.out.printf("File 2: %s%n", file2);
            System.out.println();

            List<String> diffs = diff(d1, d2);

            System.out.println("📊 COMPARISON RESULT:");
            System.out.println();

            if (diffs.isEmpty()) {
                System.out.println("✅ CHECKPOINTS ARE IDENTICAL!");
                System.out.printf("   - %,d ticks%n", d1.tick());
                System.out.printf("   - %d fish, %d food items%n", d1.agents().size(), d1.food().size());
                return 0;
            }
            System.out.println("❌ CHECKPOINTS DIFFER!");
            System.out.printf("   Found %d difference(s):%n", diffs.size());
            for (String diff : diffs) {
                System.out.println("   • " + diff);
            }
            return 1;
        }

        static List<String> diff(CheckpointData d1, CheckpointData d2) {
            List<String> diffs = new ArrayList<>();

            compareField(diffs, "version", d1.version(), d2.version());
            compareField(diffs, "tick", d1.tick(), d2.tick());
            compareField(diffs, "seed", d1.seed(), d2.seed());
            compareField(diffs, "extinctions", d1.extinctions(), d2.extinctions());
            compareField(diffs, "nextAgentId", d1.nextAgentId(), d2.nextAgentId());
            compareField(diffs, "nextFoodId", d1.nextFoodId(), d2.nextFoodId());
            compareField(diffs, "lastEmergencyTick", d1.lastEmergencyTick(), d2.lastEmergencyTick());
            compareField(diffs, "food count", d1.food().size(), d2.food().size());

            if (d1.hasDeterministicRng() && d2.hasDeterministicRng()) {
                if (!Arrays.equals(d1.rngState().toBytes(), d2.rngState().toBytes())) {
                    diffs.add("rng.state: bytes differ");
                }
            } else if (d1.hasDeterministicRng() != d2.hasDeterministicRng()) {
                diffs.add("rng: one has RNG state, other doesn't");
            }

            if (!Objects.equals(d1.lastGenome(), d2.lastGenome())) {
                diffs.add("lastGenome differs");
            }

            compareAgents(diffs, d1.agents(), d2.agents());
            return diffs;
        }

        private static void compareField(List<String> diffs, String name, long v1, long v2) {
            if (v1 != v2) {
                diffs.add(String.format("%s: %d vs %d", name, v1, v2));
            }
        }

        private static void compareAgents(List<String> diffs, List<AgentRecord> list1, List<AgentRecord> list2) {
            if (list1.size() != list2.size()) {
                diffs.add(String.format("fish count: %d vs %d", list1.size(), list2.size()));
                return;
            }

            Map<Integer, AgentRecord> map2 = new HashMap<>();
            for (AgentRecord a : list2) {
                map2.put(a.id(), a);
            }

            int reported = 0;
            for (AgentRecord a1 : list1) {
                AgentRecord a2 = map2.get(a1.id());
                if (a2 == null) {
                    diffs.add(String.format("fish #%d: exists in file1 but not file2", a1.id()));
                } else if (!a1.equals(a2)) {
                    diffs.add(String.format("fish #%d: state differs", a1.id()));
                } else {
                    continue;
                }
                if (++reported >= 10) {
                    diffs.add("... (further fish differences not listed)");
                    return;
                }
            }
        }
    }
}
