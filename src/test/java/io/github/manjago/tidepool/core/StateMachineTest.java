package io.github.manjago.tidepool.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StateMachineTest {

    enum Light { RED, GREEN, YELLOW, BROKEN }

    private static final Map<Light, List<Light>> TABLE = new EnumMap<>(Map.of(
        Light.RED, List.of(Light.GREEN, Light.BROKEN),
        Light.GREEN, List.of(Light.YELLOW, Light.BROKEN),
        Light.YELLOW, List.of(Light.RED, Light.BROKEN),
        Light.BROKEN, List.of()
    ));

    private StateMachine<Light> machine;

    @BeforeEach
    void setUp() {
        machine = new StateMachine<>(Light.RED, TABLE, true);
    }

    // ========== Construction ==========

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Starts in the initial state")
        void startsInInitialState() {
            assertEquals(Light.RED, machine.getState());
            assertTrue(machine.getHistory().isEmpty());
        }

        @Test
        @DisplayName("Initial state missing from the table is rejected")
        void initialStateMustBeInTable() {
            Map<Light, List<Light>> partial = Map.of(Light.GREEN, List.of(Light.YELLOW));
            assertThrows(IllegalArgumentException.class, () -> new StateMachine<>(Light.RED, partial, false));
        }

        @Test
        @DisplayName("Non-positive history size is rejected")
        void historySizeMustBePositive() {
            assertThrows(IllegalArgumentException.class, () -> new StateMachine<>(Light.RED, TABLE, true, 0));
        }
    }

    // ========== Transitions ==========

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("Listed transition succeeds and is recorded")
        void validTransition() {
            TransitionResult<Light> result = machine.tryTransition(Light.GREEN, 5, "timer");

            assertTrue(result.isOk());
            assertEquals(Light.GREEN, result.unwrap());
            assertEquals(Light.GREEN, machine.getState());

            StateTransition<Light> entry = machine.getHistory().get(0);
            assertEquals(Light.RED, entry.from());
            assertEquals(Light.GREEN, entry.to());
            assertEquals(5, entry.tick());
            assertEquals("timer", entry.reason());
            assertFalse(entry.forced());
        }

        @Test
        @DisplayName("Unlisted transition fails and leaves the state untouched")
        void invalidTransition() {
            TransitionResult<Light> result = machine.tryTransition(Light.YELLOW, 1, "skip");

            assertTrue(result.isErr());
            assertEquals(Light.RED, machine.getState());
            assertTrue(machine.getHistory().isEmpty());
            assertTrue(result.getError().contains("RED -> YELLOW"), result.getError());
            assertTrue(result.getError().contains("[GREEN, BROKEN]"), result.getError());
        }

        @Test
        @DisplayName("Strict transition throws on a rejected change")
        void strictTransitionThrows() {
            assertThrows(InvalidTransitionException.class, () -> machine.transition(Light.YELLOW, 1, "skip"));
            assertEquals(Light.RED, machine.getState());
        }

        @Test
        @DisplayName("Terminal state accepts nothing")
        void terminalState() {
            machine.transition(Light.BROKEN, 1, "hit by truck");

            assertTrue(machine.getValidTransitions().isEmpty());
            for (Light target : Light.values()) {
                assertFalse(machine.canTransition(target));
            }
        }

        @Test
        @DisplayName("Valid transitions follow the current state")
        void validTransitions() {
            assertEquals(Set.of(Light.GREEN, Light.BROKEN), machine.getValidTransitions());
            machine.transition(Light.GREEN, 1, null);
            assertEquals(Set.of(Light.YELLOW, Light.BROKEN), machine.getValidTransitions());
        }
    }

    // ========== Forced state and history ==========

    @Nested
    @DisplayName("Forced state and history")
    class ForcedAndHistory {

        @Test
        @DisplayName("Forced state bypasses the table and is marked")
        void forcedState() {
            machine.forceState(Light.YELLOW, 3, "restore");

            assertEquals(Light.YELLOW, machine.getState());
            assertTrue(machine.getHistory().get(0).forced());
            assertTrue(machine.getHistory().get(0).toString().startsWith("[FORCED]"));
        }

        @Test
        @DisplayName("History evicts the oldest entry when full")
        void boundedHistory() {
            StateMachine<Light> small = new StateMachine<>(Light.RED, TABLE, true, 2);
            small.transition(Light.GREEN, 1, "a");
            small.transition(Light.YELLOW, 2, "b");
            small.transition(Light.RED, 3, "c");

            List<StateTransition<Light>> history = small.getHistory();
            assertEquals(2, history.size());
            assertEquals("b", history.get(0).reason());
            assertEquals("c", history.get(1).reason());
        }

        @Test
        @DisplayName("Disabled history records nothing")
        void disabledHistory() {
            StateMachine<Light> quiet = new StateMachine<>(Light.RED, TABLE, false);
            quiet.transition(Light.GREEN, 1, "a");

            assertFalse(quiet.isHistoryEnabled());
            assertTrue(quiet.getHistory().isEmpty());
        }
    }
}
