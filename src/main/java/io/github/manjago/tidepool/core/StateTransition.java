package io.github.manjago.tidepool.core;

/**
 * Record of a single state change, kept in a {@link StateMachine}'s history.
 *
 * @param from   state before the change
 * @param to     state after the change
 * @param tick   simulation tick of the change
 * @param reason free-form description
 * @param forced true when the change bypassed the transition table
 */
public record StateTransition<S extends Enum<S>>(
    S from,
    S to,
    long tick,
    String reason,
    boolean forced
) {

    @Override
    public String toString() {
        return String.format("%s%s -> %s @%d (%s)",
                forced ? "[FORCED] " : "", from, to, tick, reason);
    }
}
