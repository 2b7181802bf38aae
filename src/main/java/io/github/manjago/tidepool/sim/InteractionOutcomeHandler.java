package io.github.manjago.tidepool.sim;

import io.github.manjago.tidepool.agent.Fish;
import io.github.manjago.tidepool.energy.EnergyDeltaRouter;
import io.github.manjago.tidepool.energy.EnergySources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Applies a minigame result: energy deltas through the router, credits to
 * the winner, then a post-interaction birth attempt.
 */
public class InteractionOutcomeHandler {

    private static final Logger log = LoggerFactory.getLogger(InteractionOutcomeHandler.class);

    private final EntityLifecycle lifecycle;
    private final EnergyDeltaRouter router;
    private final ReproductionOrchestrator orchestrator;

    private int outcomesApplied = 0;

    public InteractionOutcomeHandler(EntityLifecycle lifecycle,
                                     EnergyDeltaRouter router,
                                     ReproductionOrchestrator orchestrator) {
        this.lifecycle = lifecycle;
        this.router = router;
        this.orchestrator = orchestrator;
    }

    /**
     * @return offspring queued as a result, if any
     */
    public Optional<Fish> handle(InteractionOutcome outcome, long tick) {
        Optional<Fish> winnerRef = lifecycle.findById(outcome.winnerId());
        Optional<Fish> loserRef = lifecycle.findById(outcome.loserId());
        if (winnerRef.isEmpty() || loserRef.isEmpty()) {
            log.warn("Ignoring {} outcome for unknown fish {} / {}", outcome.game(),
                    outcome.winnerId(), outcome.loserId());
            return Optional.empty();
        }
        Fish winner = winnerRef.get();
        Fish loser = loserRef.get();
        if (!winner.isActive() || !loser.isActive()) {
            log.debug("Ignoring {} outcome: a player is no longer active", outcome.game());
            return Optional.empty();
        }

        applyEnergy(outcome, winner, loser);
        if (outcome.hasWinner() && outcome.creditsAwarded() > 0) {
            winner.getReproductionLedger().addReproCredits(outcome.creditsAwarded());
        }
        outcomesApplied++;

        return orchestrator.reproduceAfterInteraction(outcome, tick);
    }

    /**
     * A zero-sum pot pays the winner exactly what the loser could pay.
     */
    private void applyEnergy(InteractionOutcome outcome, Fish winner, Fish loser) {
        double paid = router.modifyEnergy(loser, outcome.loserDelta(), EnergySources.INTERACTION);
        boolean zeroSum = outcome.winnerDelta() == -outcome.loserDelta();
        double winnings = zeroSum ? -paid : outcome.winnerDelta();
        router.modifyEnergy(winner, winnings, EnergySources.INTERACTION);
    }

    public int getOutcomesApplied() {
        return outcomesApplied;
    }
}
