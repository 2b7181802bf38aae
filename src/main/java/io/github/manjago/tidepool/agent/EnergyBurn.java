package io.github.manjago.tidepool.agent;

/**
 * Breakdown of one tick's energy cost. All parts are non-negative and
 * {@code total == existence + metabolism + movement}.
 */
public record EnergyBurn(double existence, double metabolism, double movement, double total) {

    public static EnergyBurn of(double existence, double metabolism, double movement) {
        return new EnergyBurn(existence, metabolism, movement, existence + metabolism + movement);
    }
}
