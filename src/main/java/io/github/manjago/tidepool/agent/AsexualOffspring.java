package io.github.manjago.tidepool.agent;

/**
 * Result of {@link ReproductionLedger#triggerAsexual}.
 *
 * @param genome                 mutated copy of the parent genome
 * @param energyTransferFraction share of the parent's current energy that funds a self-funded birth
 */
public record AsexualOffspring(Genome genome, double energyTransferFraction) {
}
