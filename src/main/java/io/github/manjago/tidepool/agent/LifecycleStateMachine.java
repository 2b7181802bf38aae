package io.github.manjago.tidepool.agent;

import io.github.manjago.tidepool.config.LifecycleSettings;
import io.github.manjago.tidepool.core.StateMachine;
import io.github.manjago.tidepool.core.StateTransition;
import io.github.manjago.tidepool.core.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Age-driven life stage of one agent, plus the body size derived from it.
 *
 * The stage is a pure function of age, but it is only ever reached through
 * single forward steps of the underlying {@link StateMachine}. A large age
 * jump (time skip, stale restored age) is walked one boundary at a time.
 */
public class LifecycleStateMachine {

    private static final Logger log = LoggerFactory.getLogger(LifecycleStateMachine.class);

    /** One step per stage boundary. */
    static final int MAX_ADVANCE_STEPS = LifeStage.values().length - 1;

    private final LifecycleSettings settings;
    private final StateMachine<LifeStage> stages;
    private final int maxAge;
    private final double geneticSizeModifier;

    private int age;
    private double size;

    /**
     * New-born lifecycle: age 0, BABY, baby size.
     *
     * @param maxAge              lifespan in ticks
     * @param geneticSizeModifier fixed genetic size multiplier
     */
    public LifecycleStateMachine(int maxAge, double geneticSizeModifier, LifecycleSettings settings) {
        this.settings = settings;
        this.maxAge = maxAge;
        this.geneticSizeModifier = geneticSizeModifier;
        this.stages = new StateMachine<>(LifeStage.BABY, LifeStage.TRANSITIONS,
                settings.trackHistory(), settings.historySize());
        this.age = 0;
        this.size = computeSize(LifeStage.BABY, 0);
    }

    /**
     * Move to a new age and walk the stage forward as needed.
     *
     * @param newAge age in ticks; lower than the current age is ignored
     * @param tick   current tick, for history
     * @return the stage after the walk
     */
    public LifeStage advance(int newAge, long tick) {
        if (newAge < age) {
            log.warn("Ignoring age going backwards: {} -> {}", age, newAge);
            return getStage();
        }
        age = newAge;

        LifeStage target = targetStage(age);
        int steps = 0;
        // A stage already at or past the target (forced, restored) stays put
        while (getStage().isBefore(target) && steps < MAX_ADVANCE_STEPS) {
            LifeStage next = getStage().next();
            if (next == null) {
                break;
            }
            TransitionResult<LifeStage> result = stages.tryTransition(next, tick, "aged to " + age);
            if (result.isErr()) {
                log.warn("Lifecycle transition failed at age {}: {}", age, result.getError());
                break;
            }
            steps++;
        }

        size = computeSize(getStage(), age);
        return getStage();
    }

    /**
     * Stage a given age maps to, from the fixed thresholds.
     */
    public LifeStage targetStage(int forAge) {
        if (forAge < settings.babyMaxAge()) {
            return LifeStage.BABY;
        } else if (forAge < settings.juvenileMaxAge()) {
            return LifeStage.JUVENILE;
        } else if (forAge < settings.adultMaxAge()) {
            return LifeStage.ADULT;
        }
        return LifeStage.ELDER;
    }

    private double computeSize(LifeStage stage, int forAge) {
        double base;
        if (stage == LifeStage.BABY) {
            double progress = Math.min(1.0, (double) forAge / settings.babyMaxAge());
            base = settings.babySize() + (settings.adultSize() - settings.babySize()) * progress;
        } else {
            base = settings.adultSize();
        }
        return base * geneticSizeModifier;
    }

    /**
     * Override stage and age without validation (restore, tests). Logged and
     * recorded as forced.
     */
    public void forceStage(LifeStage stage, int newAge, long tick, String reason) {
        log.info("Forcing life stage {} -> {} (age {}): {}", getStage(), stage, newAge, reason);
        stages.forceState(stage, tick, reason);
        age = Math.max(0, newAge);
        size = computeSize(stage, age);
    }

    /**
     * Rebuild from persisted stage and age. The stored stage wins even if it
     * disagrees with the age; the next {@link #advance} walks it forward
     * when it lags, and never moves it when it is ahead.
     */
    public void restore(LifeStage stage, int storedAge, long tick) {
        if (stage != getStage()) {
            stages.forceState(stage, tick, "restore");
        }
        age = Math.max(0, storedAge);
        size = computeSize(stage, age);
    }

    // ========== Queries ==========

    public LifeStage getStage() {
        return stages.getState();
    }

    public int getAge() {
        return age;
    }

    public int getMaxAge() {
        return maxAge;
    }

    public double getSize() {
        return size;
    }

    public double getGeneticSizeModifier() {
        return geneticSizeModifier;
    }

    public boolean isBaby() {
        return getStage() == LifeStage.BABY;
    }

    public boolean isJuvenile() {
        return getStage() == LifeStage.JUVENILE;
    }

    public boolean isAdult() {
        return getStage() == LifeStage.ADULT;
    }

    public boolean isElder() {
        return getStage() == LifeStage.ELDER;
    }

    public boolean isDyingOfOldAge() {
        return age >= maxAge;
    }

    /**
     * @return age / maxAge, or 0 when maxAge is not positive
     */
    public double getAgeRatio() {
        return maxAge > 0 ? (double) age / maxAge : 0.0;
    }

    public Set<LifeStage> getValidNextStages() {
        return stages.getValidTransitions();
    }

    public List<StateTransition<LifeStage>> getTransitionHistory() {
        return stages.getHistory();
    }

    @Override
    public String toString() {
        return String.format("Lifecycle[%s, age=%d/%d, size=%.2f]", getStage(), age, maxAge, size);
    }
}
