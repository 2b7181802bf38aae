package io.github.manjago.tidepool.core;

/**
 * Thrown when a state change is rejected by the transition table and the
 * caller treats that as a programming error.
 *
 * Data-driven callers use {@link StateMachine#tryTransition} instead and
 * never see this exception.
 */
public class InvalidTransitionException extends RuntimeException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
