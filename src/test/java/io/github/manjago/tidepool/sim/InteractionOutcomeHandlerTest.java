package io.github.manjago.tidepool.sim;

import io.github.manjago.tidepool.TestFixtures;
import io.github.manjago.tidepool.agent.DefaultGenetics;
import io.github.manjago.tidepool.agent.Fish;
import io.github.manjago.tidepool.agent.FishFactory;
import io.github.manjago.tidepool.core.GameRng;
import io.github.manjago.tidepool.energy.EnergyDeltaRouter;
import io.github.manjago.tidepool.energy.EnergySources;
import io.github.manjago.tidepool.energy.EnergyTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InteractionOutcomeHandlerTest {

    private static final double EPS = 1e-9;

    private FishFactory factory;
    private Population population;
    private EnergyTracker tracker;
    private InteractionOutcomeHandler handler;

    @BeforeEach
    void setUp() {
        GameRng rng = new GameRng(3);
        TankWorld world = new TankWorld(500, 500);
        factory = TestFixtures.factory();
        population = new Population(10);
        tracker = new EnergyTracker();
        EnergyDeltaRouter router = new EnergyDeltaRouter(TestFixtures.energy(), world, population, tracker,
                rng, () -> 0L);
        ReproductionOrchestrator orchestrator = new ReproductionOrchestrator(TestFixtures.reproduction(),
                TestFixtures.population(10, 0), factory, new DefaultGenetics(), population, router, world, rng);
        handler = new InteractionOutcomeHandler(population, router, orchestrator);
    }

    private Fish[] register(double winnerEnergy, double loserEnergy) {
        Fish winner = TestFixtures.adult(factory, 1, winnerEnergy);
        Fish loser = TestFixtures.adult(factory, 2, loserEnergy);
        population.requestSpawn(winner, "test");
        population.requestSpawn(loser, "test");
        population.commitTick(0);
        return new Fish[]{winner, loser};
    }

    @Test
    @DisplayName("Winner takes the pot and the credits")
    void winnerTakesPot() {
        Fish[] fish = register(60, 50);

        Optional<Fish> child = handler.handle(InteractionOutcome.win("chase", 1, 2, 20, 2.0), 1);

        assertEquals(80, fish[0].getEnergy(), EPS);
        assertEquals(30, fish[1].getEnergy(), EPS);
        assertEquals(2.0, fish[0].getReproductionLedger().getReproCredits(), EPS);
        assertEquals(0.0, fish[1].getReproductionLedger().getReproCredits(), EPS);
        assertTrue(child.isEmpty(), "loser is too weak to mate");
        assertEquals(0.0, tracker.getTotal(EnergySources.INTERACTION), EPS);
        assertEquals(1, handler.getOutcomesApplied());
    }

    @Test
    @DisplayName("Zero-sum pot pays only what the loser had")
    void zeroSumCappedByLoser() {
        Fish[] fish = register(60, 10);

        handler.handle(InteractionOutcome.win("chase", 1, 2, 20, 0), 1);

        assertEquals(70, fish[0].getEnergy(), EPS);
        assertEquals(0, fish[1].getEnergy(), EPS);
        assertFalse(fish[1].isActive());
    }

    @Test
    @DisplayName("Non-zero-sum deltas are applied as given")
    void nonZeroSum() {
        Fish[] fish = register(60, 50);

        handler.handle(new InteractionOutcome("forage", 1, 2, false, 15, -5, 0), 1);

        assertEquals(75, fish[0].getEnergy(), EPS);
        assertEquals(45, fish[1].getEnergy(), EPS);
    }

    @Test
    @DisplayName("Tie changes nothing and produces no offspring")
    void tie() {
        Fish[] fish = register(100, 100);

        assertTrue(handler.handle(InteractionOutcome.tie("chase", 1, 2), 1).isEmpty());
        assertEquals(100, fish[0].getEnergy(), EPS);
        assertEquals(100, fish[1].getEnergy(), EPS);
    }

    @Test
    @DisplayName("Strong pair that finishes a game can mate")
    void offspringAfterWin() {
        Fish[] fish = register(100, 100);

        Optional<Fish> child = handler.handle(InteractionOutcome.win("chase", 1, 2, 5, 1.0), 1);

        assertTrue(child.isPresent());
        assertEquals(5, fish[0].getReproductionLedger().getOverflowBank(), EPS);
        assertEquals(1, population.pendingSpawnCount());
    }

    @Test
    @DisplayName("Unknown or dead players are ignored")
    void ignored() {
        Fish[] fish = register(60, 50);

        assertTrue(handler.handle(InteractionOutcome.win("chase", 1, 99, 20, 1), 1).isEmpty());

        fish[1].getMortality().onEnergyDepleted(1);
        assertTrue(handler.handle(InteractionOutcome.win("chase", 1, 2, 20, 1), 1).isEmpty());
        assertEquals(60, fish[0].getEnergy(), EPS);
        assertEquals(0, handler.getOutcomesApplied());
    }

    @Test
    @DisplayName("Outcome with a single player or negative credits is rejected")
    void invalidOutcome() {
        assertThrows(IllegalArgumentException.class, () -> InteractionOutcome.win("chase", 1, 1, 5, 0));
        assertThrows(IllegalArgumentException.class, () -> InteractionOutcome.win("chase", 1, 2, 5, -1));
    }
}
