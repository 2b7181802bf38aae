package io.github.manjago.tidepool.agent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MortalityTest {

    private static final int WINDOW = 50;
    private static final int MAX_AGE = 200;

    private Mortality mortality;

    @BeforeEach
    void setUp() {
        mortality = new Mortality(WINDOW, true);
    }

    // ========== Starvation ==========

    @Nested
    @DisplayName("Starvation")
    class Starvation {

        @Test
        @DisplayName("Depletion kills an active agent once")
        void depletionKills() {
            assertTrue(mortality.onEnergyDepleted(10));
            assertFalse(mortality.onEnergyDepleted(11));

            assertEquals(EntityState.DEAD, mortality.getState());
            assertEquals(DeathCause.STARVATION, mortality.getRecordedCause());
            assertTrue(mortality.isDead());
            assertFalse(mortality.isActive());
        }

        @Test
        @DisplayName("Restored energy does not revive the dead")
        void noRevival() {
            mortality.onEnergyDepleted(10);
            mortality.onEnergyRestored();

            assertEquals(EntityState.DEAD, mortality.getState());
            assertTrue(mortality.isDead());
        }

        @Test
        @DisplayName("A second cause does not overwrite the first")
        void firstCauseWins() {
            mortality.onEnergyDepleted(10);
            assertFalse(mortality.die(DeathCause.OLD_AGE, 11));
            assertEquals(DeathCause.STARVATION, mortality.getRecordedCause());
        }
    }

    // ========== Removal ==========

    @Nested
    @DisplayName("Removal")
    class Removal {

        @Test
        @DisplayName("Dead agent keeps its cause when removed")
        void deadRemoved() {
            mortality.die(DeathCause.OLD_AGE, 5);

            assertTrue(mortality.markRemoved(6));
            assertEquals(EntityState.REMOVED, mortality.getState());
            assertEquals(DeathCause.OLD_AGE, mortality.getRecordedCause());
        }

        @Test
        @DisplayName("Active agent leaves by migration")
        void activeMigrates() {
            assertTrue(mortality.markRemoved(6));

            assertEquals(EntityState.REMOVED, mortality.getState());
            assertEquals(DeathCause.MIGRATION, mortality.getRecordedCause());
            assertEquals("migration", mortality.describeDeathCause(40, 10, MAX_AGE));
        }

        @Test
        @DisplayName("Removing twice is a no-op")
        void removeTwice() {
            mortality.markRemoved(6);
            assertFalse(mortality.markRemoved(7));
            assertFalse(mortality.onEnergyDepleted(8));
        }

        @Test
        @DisplayName("Migration is not a way to die")
        void migrationViaDieRejected() {
            assertThrows(IllegalArgumentException.class, () -> mortality.die(DeathCause.MIGRATION, 1));
            assertTrue(mortality.isActive());
        }
    }

    // ========== Cause resolution ==========

    @Nested
    @DisplayName("Cause resolution")
    class CauseResolution {

        @Test
        @DisplayName("Starvation soon after a predator encounter is predation")
        void predationWithinWindow() {
            mortality.recordPredatorEncounter(100);
            mortality.onEnergyDepleted(1);

            assertEquals(DeathCause.PREDATION, mortality.resolveDeathCause(0, 100 + WINDOW, MAX_AGE));
            assertEquals(DeathCause.STARVATION, mortality.resolveDeathCause(0, 101 + WINDOW, MAX_AGE));
        }

        @Test
        @DisplayName("Without a recorded cause, zero energy reads as starvation")
        void inferredStarvation() {
            assertEquals(DeathCause.STARVATION, mortality.resolveDeathCause(0, 10, MAX_AGE));

            mortality.recordPredatorEncounter(8);
            assertEquals(DeathCause.PREDATION, mortality.resolveDeathCause(0, 10, MAX_AGE));
        }

        @Test
        @DisplayName("Positive energy at max age reads as old age")
        void inferredOldAge() {
            assertEquals(DeathCause.OLD_AGE, mortality.resolveDeathCause(30, MAX_AGE, MAX_AGE));
            assertNull(mortality.resolveDeathCause(30, MAX_AGE - 1, MAX_AGE));
        }

        @Test
        @DisplayName("Unexplained state is tagged with what was observed")
        void unknownTags() {
            assertEquals("unknown_active_pos_energy_no_hist", mortality.describeDeathCause(30, 10, MAX_AGE));

            Mortality quiet = new Mortality(WINDOW, false);
            quiet.restore(EntityState.DEAD, null, Mortality.NO_ENCOUNTER, 3);
            assertEquals("unknown_dead_pos_energy_no_hist", quiet.describeDeathCause(30, 10, MAX_AGE));
        }

        @Test
        @DisplayName("History is kept when a forced restore is tracked")
        void restoredHistory() {
            mortality.restore(EntityState.DEAD, null, Mortality.NO_ENCOUNTER, 3);

            assertEquals("unknown_dead_pos_energy", mortality.describeDeathCause(30, 10, MAX_AGE));
            assertTrue(mortality.getHistory().get(0).forced());
        }
    }

    @Test
    @DisplayName("Restore brings back state, cause and encounter age")
    void restore() {
        mortality.restore(EntityState.REMOVED, DeathCause.PREDATION, 42, 9);

        assertEquals(EntityState.REMOVED, mortality.getState());
        assertEquals(DeathCause.PREDATION, mortality.getRecordedCause());
        assertEquals(42, mortality.getLastPredatorEncounterAge());
        assertFalse(mortality.isActive());
    }

    // ========== Transition table ==========

    @Test
    @DisplayName("Mortal state table cannot be modified")
    void transitionTableIsReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> EntityState.TRANSITIONS.put(EntityState.DEAD, List.of(EntityState.ACTIVE)));
        assertThrows(UnsupportedOperationException.class,
                () -> EntityState.TRANSITIONS.get(EntityState.DEAD).add(EntityState.ACTIVE));
        assertEquals(List.of(EntityState.REMOVED), EntityState.TRANSITIONS.get(EntityState.DEAD));
    }
}
