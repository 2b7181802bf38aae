package io.github.manjago.tidepool.agent;

/**
 * Anything with a {@link ReproductionLedger}. Overflow energy of such an
 * agent is banked before it is spilled.
 */
public interface Reproducible {

    ReproductionLedger getReproductionLedger();
}
