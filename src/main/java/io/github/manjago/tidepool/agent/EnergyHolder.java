package io.github.manjago.tidepool.agent;

/**
 * Anything that owns an {@link EnergyLedger}.
 */
public interface EnergyHolder {

    EnergyLedger getEnergyLedger();
}
