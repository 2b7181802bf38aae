package io.github.manjago.tidepool.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finite state machine over an enum with an explicit transition table.
 *
 * Only transitions listed in the table are accepted. {@link #tryTransition}
 * is the normal path and never throws; {@link #transition} throws and is meant
 * for call sites where a rejected transition can only be a bug.
 * {@link #forceState} bypasses the table (restore, tests) and is marked as
 * forced in the history.
 *
 * History is optional and bounded: when full, the oldest entry is evicted.
 */
public class StateMachine<S extends Enum<S>> {

    /** Default number of history entries kept. */
    public static final int DEFAULT_MAX_HISTORY = 100;

    private final Map<S, Set<S>> transitions;
    private final boolean historyEnabled;
    private final int maxHistory;
    private final ArrayDeque<StateTransition<S>> history;

    private S state;

    public StateMachine(S initialState, Map<S, ? extends Collection<S>> transitionTable, boolean historyEnabled) {
        this(initialState, transitionTable, historyEnabled, DEFAULT_MAX_HISTORY);
    }

    /**
     * @param initialState    starting state, must be a key of the table
     * @param transitionTable state → valid target states
     * @param historyEnabled  record transitions
     * @param maxHistory      history capacity (must be positive)
     */
    public StateMachine(S initialState,
                        Map<S, ? extends Collection<S>> transitionTable,
                        boolean historyEnabled,
                        int maxHistory) {
        if (initialState == null) {
            throw new IllegalArgumentException("Initial state must not be null");
        }
        if (!transitionTable.containsKey(initialState)) {
            throw new IllegalArgumentException("Initial state " + initialState
                    + " not in transition table. Valid states: " + transitionTable.keySet());
        }
        if (maxHistory <= 0) {
            throw new IllegalArgumentException("maxHistory must be positive: " + maxHistory);
        }

        Map<S, Set<S>> copy = new HashMap<>();
        for (Map.Entry<S, ? extends Collection<S>> e : transitionTable.entrySet()) {
            Set<S> targets = e.getValue().isEmpty()
                    ? EnumSet.noneOf(initialState.getDeclaringClass())
                    : EnumSet.copyOf(e.getValue());
            copy.put(e.getKey(), Collections.unmodifiableSet(targets));
        }
        this.transitions = Collections.unmodifiableMap(copy);
        this.state = initialState;
        this.historyEnabled = historyEnabled;
        this.maxHistory = maxHistory;
        this.history = new ArrayDeque<>();
    }

    public S getState() {
        return state;
    }

    /**
     * @return true if the table allows current → target
     */
    public boolean canTransition(S target) {
        return transitions.getOrDefault(state, Set.of()).contains(target);
    }

    /**
     * Attempt a transition. On failure the state is left untouched and the
     * result carries a message naming the valid targets.
     */
    public TransitionResult<S> tryTransition(S target, long tick, String reason) {
        if (!canTransition(target)) {
            return TransitionResult.err(String.format(
                    "Invalid transition: %s -> %s. Valid targets from %s: %s",
                    state, target, state, describeTargets(getValidTransitions())));
        }
        S old = state;
        state = target;
        record(old, target, tick, reason, false);
        return TransitionResult.ok(target);
    }

    /**
     * Transition that must succeed.
     *
     * @throws InvalidTransitionException if the table rejects it
     */
    public S transition(S target, long tick, String reason) {
        return tryTransition(target, tick, reason).unwrap();
    }

    /**
     * Set the state without validation. Recorded as forced.
     */
    public void forceState(S newState, long tick, String reason) {
        if (newState == null) {
            throw new IllegalArgumentException("Forced state must not be null");
        }
        S old = state;
        state = newState;
        record(old, newState, tick, reason, true);
    }

    /**
     * @return valid targets from the current state
     */
    public Set<S> getValidTransitions() {
        return transitions.getOrDefault(state, Set.of());
    }

    /**
     * @return history, oldest first (empty when disabled)
     */
    public List<StateTransition<S>> getHistory() {
        return new ArrayList<>(history);
    }

    public boolean isHistoryEnabled() {
        return historyEnabled;
    }

    private void record(S from, S to, long tick, String reason, boolean forced) {
        if (!historyEnabled) {
            return;
        }
        if (history.size() >= maxHistory) {
            history.pollFirst();
        }
        history.addLast(new StateTransition<>(from, to, tick, reason == null ? "" : reason, forced));
    }

    private static <S extends Enum<S>> String describeTargets(Set<S> targets) {
        return targets.stream()
                .sorted()
                .map(Enum::name)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String toString() {
        return "StateMachine[state=" + state + "]";
    }
}
