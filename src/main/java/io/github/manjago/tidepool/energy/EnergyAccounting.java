package io.github.manjago.tidepool.energy;

/**
 * Receives every committed energy delta, tagged with its source.
 * Implementations are diagnostics only; the router ignores their failures.
 */
public interface EnergyAccounting {

    void record(String source, double delta);

    /**
     * Accounting that drops everything.
     */
    EnergyAccounting NOOP = (source, delta) -> { };
}
