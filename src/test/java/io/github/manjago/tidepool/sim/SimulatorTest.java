package io.github.manjago.tidepool.sim;

import io.github.manjago.tidepool.agent.Fish;
import io.github.manjago.tidepool.config.SimulatorConfig;
import io.github.manjago.tidepool.energy.EnergySources;
import io.github.manjago.tidepool.persistence.AgentRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SimulatorTest {

    private static SimulatorConfig.Builder config(long seed) {
        return SimulatorConfig.builder()
                .seed(seed)
                .initialPopulation(12)
                .maxPopulation(30, 5)
                .checkpointInterval(0)
                .reportInterval(0);
    }

    private static List<AgentRecord> snapshot(Simulator simulator) {
        return simulator.getPopulation().getAll().stream()
                .map(AgentRecord::of)
                .collect(Collectors.toList());
    }

    /** Records every event it sees. */
    private static class RecordingListener implements SimulatorListener {
        final List<Fish> spawned = new ArrayList<>();
        final List<String> deaths = new ArrayList<>();
        final List<Long> extinctions = new ArrayList<>();
        final List<Long> checkpoints = new ArrayList<>();

        @Override
        public void onSpawn(Fish child, long tick) {
            spawned.add(child);
        }

        @Override
        public void onDeath(Fish fish, String cause, long tick) {
            deaths.add(cause);
        }

        @Override
        public void onExtinction(long tick) {
            extinctions.add(tick);
        }

        @Override
        public void onCheckpoint(long tick) {
            checkpoints.add(tick);
        }
    }

    // ========== Running ==========

    @Nested
    @DisplayName("Running")
    class Running {

        @Test
        @DisplayName("Founders are seeded and announced")
        void seeding() {
            Simulator simulator = new Simulator(config(42).build());
            RecordingListener listener = new RecordingListener();
            simulator.setListener(listener);

            simulator.seedPopulation(0);

            assertEquals(12, simulator.getPopulation().getActiveCount());
            assertEquals(12, listener.spawned.size());
            assertEquals(0, simulator.getTick());
            assertTrue(listener.spawned.stream().allMatch(f -> f.getGeneration() == 0));
        }

        @Test
        @DisplayName("Same seed gives the same run")
        void deterministicReplay() {
            Simulator first = new Simulator(config(42).build());
            Simulator second = new Simulator(config(42).build());
            first.seedPopulation(0);
            second.seedPopulation(0);

            first.run(1500);
            second.run(1500);

            assertEquals(1500, first.getTick());
            assertEquals(snapshot(first), snapshot(second));
            assertEquals(first.getPopulation().getFoodEnergy(), second.getPopulation().getFoodEnergy());
            assertArrayEquals(first.getGameRng().saveState().toBytes(), second.getGameRng().saveState().toBytes());
            assertEquals(first.getEnergyTracker().getTotals(), second.getEnergyTracker().getTotals());
        }

        @Test
        @DisplayName("Ledgers stay in range and the cap holds on every tick")
        void invariantsHold() {
            Simulator simulator = new Simulator(config(7).build());
            simulator.seedPopulation(0);
            int max = simulator.getConfig().population().maxPopulation();
            double bankMultiplier = simulator.getConfig().energy().bankMultiplier();

            for (int i = 0; i < 2000; i++) {
                simulator.runTick();
                assertTrue(simulator.getPopulation().getActiveCount() <= max);
                for (Fish fish : simulator.getPopulation().getLiveAgents()) {
                    assertTrue(fish.getEnergy() >= 0 && fish.getEnergy() <= fish.getMaxEnergy(), fish.toString());
                    assertTrue(fish.getReproductionLedger().getOverflowBank()
                            <= fish.getMaxEnergy() * bankMultiplier + 1e-9, fish.toString());
                }
            }
            assertTrue(simulator.getEnergyTracker().getTotal(EnergySources.METABOLISM) < 0);
        }

        @Test
        @DisplayName("Checkpoint hook fires on the interval and stop ends the run")
        void checkpointAndStop() {
            Simulator simulator = new Simulator(config(1).checkpointInterval(10).build());
            simulator.seedPopulation(0);
            RecordingListener listener = new RecordingListener() {
                @Override
                public void onCheckpoint(long tick) {
                    super.onCheckpoint(tick);
                    if (checkpoints.size() == 3) {
                        simulator.stop();
                    }
                }
            };
            simulator.setListener(listener);

            simulator.run(0);

            assertEquals(List.of(10L, 20L, 30L), listener.checkpoints);
            assertEquals(30, simulator.getTick());
            assertFalse(simulator.isRunning());
        }

        @Test
        @DisplayName("Starved tank counts an extinction and recovers")
        void extinction() {
            Simulator simulator = new Simulator(config(5).feedingProbability(0).build());
            simulator.seedPopulation(0);
            RecordingListener listener = new RecordingListener();
            simulator.setListener(listener);
            for (Fish fish : simulator.getPopulation().getLiveAgents()) {
                fish.getEnergyLedger().commit(1e-6);
            }

            simulator.runTick();

            assertEquals(1, simulator.getExtinctions());
            assertEquals(List.of(1L), listener.extinctions);
            assertEquals(12, listener.deaths.size());
            assertTrue(listener.deaths.stream().allMatch("starvation"::equals), listener.deaths.toString());
            assertEquals(1, simulator.getPopulation().getActiveCount());
            assertEquals(1, simulator.getStats().emergencySpawns());
        }
    }

    // ========== External events ==========

    @Nested
    @DisplayName("External events")
    class ExternalEvents {

        private Simulator seeded(RecordingListener listener) {
            Simulator simulator = new Simulator(config(9).feedingProbability(0).build());
            simulator.seedPopulation(0);
            simulator.setListener(listener);
            return simulator;
        }

        @Test
        @DisplayName("Migrating fish leaves at the end of the tick")
        void migrate() {
            RecordingListener listener = new RecordingListener();
            Simulator simulator = seeded(listener);
            int id = simulator.getPopulation().getLiveAgents().get(0).getId();

            assertTrue(simulator.migrate(id));
            assertFalse(simulator.migrate(id), "already queued");
            assertTrue(simulator.getPopulation().findById(id).isPresent());

            simulator.runTick();

            assertTrue(simulator.getPopulation().findById(id).isEmpty());
            assertEquals(List.of("migration"), listener.deaths);
        }

        @Test
        @DisplayName("Fatal bite is recorded as predation")
        void predation() {
            RecordingListener listener = new RecordingListener();
            Simulator simulator = seeded(listener);
            Fish fish = simulator.getPopulation().getLiveAgents().get(0);
            double energy = fish.getEnergy();

            assertEquals(energy, simulator.applyPredation(fish.getId(), 1e6), 1e-9);
            assertFalse(fish.isActive());
            assertEquals(0.0, simulator.applyPredation(fish.getId(), 5), "dead fish cannot be bitten");

            simulator.runTick();

            assertEquals(List.of("predation"), listener.deaths);
        }

        @Test
        @DisplayName("Encounter without damage makes a later starvation count as predation")
        void encounterThenStarve() {
            RecordingListener listener = new RecordingListener();
            Simulator simulator = seeded(listener);
            Fish fish = simulator.getPopulation().getLiveAgents().get(0);

            simulator.recordPredatorEncounter(fish.getId());
            fish.getEnergyLedger().commit(1e-6);
            simulator.runTick();

            assertEquals(List.of("predation"), listener.deaths);
        }

        @Test
        @DisplayName("Outside food goes through the router")
        void feed() {
            Simulator simulator = seeded(new RecordingListener());
            Fish fish = simulator.getPopulation().getLiveAgents().get(0);
            double before = fish.getEnergy();

            double applied = simulator.feed(fish.getId(), 1.0, EnergySources.FOOD);

            assertEquals(1.0, applied, 1e-9);
            assertEquals(before + 1.0, fish.getEnergy(), 1e-9);
            assertEquals(1.0, simulator.getEnergyTracker().getTotal(EnergySources.FOOD), 1e-9);
            assertEquals(0.0, simulator.feed(12345, 1.0, EnergySources.FOOD));
        }

        @Test
        @DisplayName("Interaction is applied between registered fish")
        void interaction() {
            Simulator simulator = seeded(new RecordingListener());
            List<Fish> live = simulator.getPopulation().getLiveAgents();
            Fish a = live.get(0);
            Fish b = live.get(1);
            double total = a.getEnergy() + b.getEnergy();

            simulator.applyInteraction(InteractionOutcome.win("chase", a.getId(), b.getId(), 2.0, 1.0));

            assertEquals(total, a.getEnergy() + b.getEnergy() + a.getReproductionLedger().getOverflowBank()
                    + simulator.getPopulation().getFoodEnergy(), 1e-9);
            assertEquals(1.0, a.getReproductionLedger().getReproCredits(), 1e-9);
        }

        @Test
        @DisplayName("Negative time modifier is rejected")
        void timeModifier() {
            Simulator simulator = seeded(new RecordingListener());
            assertThrows(IllegalArgumentException.class, () -> simulator.setTimeModifier(-1));
        }
    }

    @Test
    @DisplayName("Stats reflect the registry")
    void stats() {
        Simulator simulator = new Simulator(config(3).build());
        simulator.seedPopulation(0);
        simulator.run(100);

        SimulatorStats stats = simulator.getStats();

        assertEquals(100, stats.totalTicks());
        assertEquals(simulator.getPopulation().getActiveCount(), stats.aliveCount());
        assertEquals(simulator.getPopulation().getTotalSpawns(), stats.totalSpawns());
        assertTrue(stats.toString().contains("Simulation Statistics"));
    }
}
