package io.github.manjago.tidepool.agent;

import io.github.manjago.tidepool.core.StateMachine;
import io.github.manjago.tidepool.core.StateTransition;
import io.github.manjago.tidepool.core.TransitionResult;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Mortal state of one agent: ACTIVE, DEAD or REMOVED, plus the recorded
 * cause and the data needed to infer one.
 *
 * Starvation is only ever entered through {@link #onEnergyDepleted}, which
 * the energy router calls when a commit leaves the agent at zero.
 */
public class Mortality {

    private static final Logger log = LoggerFactory.getLogger(Mortality.class);

    /** No predator encounter recorded. */
    public static final int NO_ENCOUNTER = Integer.MIN_VALUE;

    private final StateMachine<EntityState> states;
    private final int predatorEncounterWindow;

    private DeathCause cause;
    private boolean cachedDead;
    private int lastPredatorEncounterAge = NO_ENCOUNTER;

    /**
     * @param predatorEncounterWindow ticks after an encounter during which a
     *                                starvation death counts as predation
     * @param trackHistory            keep transition history
     */
    public Mortality(int predatorEncounterWindow, boolean trackHistory) {
        this.predatorEncounterWindow = predatorEncounterWindow;
        this.states = new StateMachine<>(EntityState.ACTIVE, EntityState.TRANSITIONS, trackHistory);
    }

    // ========== Events ==========

    /**
     * Energy hit zero. Moves ACTIVE to DEAD(starvation).
     *
     * @return true if this call killed the agent
     */
    public boolean onEnergyDepleted(long tick) {
        if (states.getState() != EntityState.ACTIVE) {
            return false;
        }
        TransitionResult<EntityState> result = states.tryTransition(
                EntityState.DEAD, tick, DeathCause.STARVATION.label());
        if (result.isErr()) {
            log.warn("Starvation transition rejected: {}", result.getError());
            return false;
        }
        cause = DeathCause.STARVATION;
        cachedDead = true;
        return true;
    }

    /**
     * Energy is positive again. Clears a stale dead flag on an agent that is
     * still ACTIVE; a committed death is never undone.
     */
    public void onEnergyRestored() {
        if (cachedDead && states.getState() == EntityState.ACTIVE) {
            log.debug("Clearing stale dead flag");
            cachedDead = false;
        }
    }

    /**
     * Kill an ACTIVE agent for the given cause.
     *
     * @return true if the agent died by this call
     */
    public boolean die(DeathCause deathCause, long tick) {
        if (deathCause == DeathCause.MIGRATION) {
            throw new IllegalArgumentException("Migration removes, use markRemoved");
        }
        TransitionResult<EntityState> result = states.tryTransition(EntityState.DEAD, tick, deathCause.label());
        if (result.isErr()) {
            log.debug("Ignoring {} death: {}", deathCause.label(), result.getError());
            return false;
        }
        cause = deathCause;
        cachedDead = true;
        return true;
    }

    /**
     * Take the agent out of the registry. A dead agent keeps its cause; an
     * active one leaves by migration.
     *
     * @return false if the agent was already removed
     */
    public boolean markRemoved(long tick) {
        switch (states.getState()) {
            case DEAD -> {
                // DEAD -> REMOVED is always in the table
                states.transition(EntityState.REMOVED, tick, cause != null ? cause.label() : "removed");
                return true;
            }
            case ACTIVE -> {
                TransitionResult<EntityState> result = states.tryTransition(
                        EntityState.REMOVED, tick, DeathCause.MIGRATION.label());
                if (result.isErr()) {
                    log.warn("Removal rejected: {}", result.getError());
                    return false;
                }
                cause = DeathCause.MIGRATION;
                cachedDead = true;
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    /**
     * Remember that a predator got close at the given age.
     */
    public void recordPredatorEncounter(int age) {
        lastPredatorEncounterAge = age;
    }

    // ========== Cause ==========

    /**
     * Resolve the cause of death from the recorded reason, falling back to
     * inference from energy and age.
     *
     * @return the cause, or null when nothing explains the state
     */
    public @Nullable DeathCause resolveDeathCause(double energy, int age, int maxAge) {
        if (cause != null) {
            if (cause == DeathCause.STARVATION && recentPredatorEncounter(age)) {
                return DeathCause.PREDATION;
            }
            return cause;
        }
        if (states.getState() == EntityState.REMOVED) {
            return DeathCause.MIGRATION;
        }
        if (energy <= 0) {
            return recentPredatorEncounter(age) ? DeathCause.PREDATION : DeathCause.STARVATION;
        }
        if (age >= maxAge) {
            return DeathCause.OLD_AGE;
        }
        return null;
    }

    /**
     * Label of {@link #resolveDeathCause}, or {@code unknown_<tags>} naming
     * what was observed when nothing applies.
     */
    public String describeDeathCause(double energy, int age, int maxAge) {
        DeathCause resolved = resolveDeathCause(energy, age, maxAge);
        if (resolved != null) {
            return resolved.label();
        }
        StringBuilder tag = new StringBuilder("unknown_");
        tag.append(states.getState().name().toLowerCase());
        if (energy > 0) {
            tag.append("_pos_energy");
        }
        if (!states.isHistoryEnabled() || states.getHistory().isEmpty()) {
            tag.append("_no_hist");
        }
        return tag.toString();
    }

    private boolean recentPredatorEncounter(int age) {
        return lastPredatorEncounterAge != NO_ENCOUNTER
                && age - lastPredatorEncounterAge <= predatorEncounterWindow;
    }

    // ========== Queries ==========

    public EntityState getState() {
        return states.getState();
    }

    public boolean isActive() {
        return !cachedDead && states.getState() == EntityState.ACTIVE;
    }

    public boolean isDead() {
        return cachedDead || states.getState() != EntityState.ACTIVE;
    }

    /**
     * @return recorded cause, or null while alive or when none was recorded
     */
    public @Nullable DeathCause getRecordedCause() {
        return cause;
    }

    public int getLastPredatorEncounterAge() {
        return lastPredatorEncounterAge;
    }

    public List<StateTransition<EntityState>> getHistory() {
        return states.getHistory();
    }

    // ========== Restore ==========

    /**
     * Rebuild from persisted fields.
     *
     * @param recordedCause null when none was recorded
     */
    public void restore(EntityState state, DeathCause recordedCause, int predatorEncounterAge, long tick) {
        if (state != EntityState.ACTIVE) {
            states.forceState(state, tick, "restore");
        }
        this.cause = recordedCause;
        this.cachedDead = state != EntityState.ACTIVE;
        this.lastPredatorEncounterAge = predatorEncounterAge;
    }

    @Override
    public String toString() {
        return cause != null ? states.getState() + "(" + cause.label() + ")" : states.getState().name();
    }
}
