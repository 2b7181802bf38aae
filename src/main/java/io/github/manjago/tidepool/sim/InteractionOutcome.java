package io.github.manjago.tidepool.sim;

/**
 * Result of a minigame between two fish, as far as this core cares: who
 * won, the energy each side gained or lost, and the credits awarded.
 *
 * @param game           game tag, for logs
 * @param winnerId       id of the winner; for a tie, the first player
 * @param loserId        id of the loser; for a tie, the second player
 * @param tie            nobody won
 * @param winnerDelta    energy change of the winner
 * @param loserDelta     energy change of the loser
 * @param creditsAwarded reproduction credits granted to the winner
 */
public record InteractionOutcome(
    String game,
    int winnerId,
    int loserId,
    boolean tie,
    double winnerDelta,
    double loserDelta,
    double creditsAwarded
) {

    public InteractionOutcome {
        if (winnerId == loserId) {
            throw new IllegalArgumentException("A fish cannot play against itself: " + winnerId);
        }
        if (creditsAwarded < 0) {
            throw new IllegalArgumentException("Credits must not be negative: " + creditsAwarded);
        }
    }

    /**
     * Winner takes {@code pot} from the loser.
     */
    public static InteractionOutcome win(String game, int winnerId, int loserId, double pot, double credits) {
        return new InteractionOutcome(game, winnerId, loserId, false, pot, -pot, credits);
    }

    public static InteractionOutcome tie(String game, int firstId, int secondId) {
        return new InteractionOutcome(game, firstId, secondId, true, 0.0, 0.0, 0.0);
    }

    public boolean hasWinner() {
        return !tie;
    }
}
