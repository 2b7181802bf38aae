package io.github.manjago.tidepool.sim;

/**
 * What one reproduction sweep did.
 *
 * @param bankedSpawns    births funded from an overflow bank
 * @param traitSpawns     births from the asexual trait roll
 * @param emergencySpawns population recovery spawns
 * @param failedSpawns    spawn requests rejected or failed (refunded)
 * @param population      active plus pending fish after the sweep
 */
public record ReproductionTickStats(
    int bankedSpawns,
    int traitSpawns,
    int emergencySpawns,
    int failedSpawns,
    int population
) {

    public int totalSpawns() {
        return bankedSpawns + traitSpawns + emergencySpawns;
    }
}
