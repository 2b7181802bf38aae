package io.github.manjago.tidepool.core;

import java.util.Objects;

/**
 * Outcome of {@link StateMachine#tryTransition}: either the new state or an error message.
 */
public final class TransitionResult<S extends Enum<S>> {

    private final S state;
    private final String error;

    private TransitionResult(S state, String error) {
        this.state = state;
        this.error = error;
    }

    public static <S extends Enum<S>> TransitionResult<S> ok(S state) {
        return new TransitionResult<>(Objects.requireNonNull(state), null);
    }

    public static <S extends Enum<S>> TransitionResult<S> err(String error) {
        return new TransitionResult<>(null, Objects.requireNonNull(error));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isErr() {
        return error != null;
    }

    /**
     * @return the new state
     * @throws InvalidTransitionException if this is an error result
     */
    public S unwrap() {
        if (error != null) {
            throw new InvalidTransitionException(error);
        }
        return state;
    }

    /**
     * @return the error message, or null on success
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + state + ")" : "Err(" + error + ")";
    }
}
