package io.github.manjago.tidepool.agent;

/**
 * Anything that ages through {@link LifeStage}s.
 */
public interface LifecycleAware {

    LifecycleStateMachine getLifecycle();
}
