package io.github.manjago.tidepool.sim;

import java.util.Map;

/**
 * Snapshot of simulation statistics.
 */
public record SimulatorStats(
    long totalTicks,
    int totalSpawns,
    int bankedBirths,
    int traitBirths,
    int sexualBirths,
    int emergencySpawns,
    int failedSpawns,
    int totalDeaths,
    Map<String, Integer> deathsByCause,
    int aliveCount,
    int maxAlive,
    int extinctions,
    double totalFishEnergy,
    double totalBankedEnergy,
    int foodCount,
    double foodEnergy,
    long heapUsedMB,          // JVM heap used in MB
    long heapMaxMB            // JVM heap max in MB
) {

    /**
     * Calculate ticks per spawn (reproduction efficiency).
     */
    public double ticksPerSpawn() {
        return totalSpawns > 0 ? (double) totalTicks / totalSpawns : 0;
    }

    /**
     * Calculate death rate (deaths per 1000 ticks).
     */
    public double deathRatePer1000() {
        return totalTicks > 0 ? totalDeaths * 1000.0 / totalTicks : 0;
    }

    /**
     * Deaths recorded for one cause label.
     */
    public int deaths(String cause) {
        return deathsByCause.getOrDefault(cause, 0);
    }

    /**
     * Get heap usage percentage.
     */
    public double heapUsagePercent() {
        return heapMaxMB > 0 ? 100.0 * heapUsedMB / heapMaxMB : 0;
    }

    @Override
    public String toString() {
        StringBuilder causes = new StringBuilder();
        for (Map.Entry<String, Integer> e : deathsByCause.entrySet()) {
            causes.append(String.format("  %-16s%,d%n", e.getKey() + ":", e.getValue()));
        }
        return String.format("""
            === Simulation Statistics ===
            Ticks:            %,d
            Spawns:           %,d (%.1f ticks/spawn)
              Banked:         %,d
              Trait:          %,d
              Sexual:         %,d
              Emergency:      %,d
              Failed:         %,d
            Deaths:           %,d (%.2f per 1K ticks)
            %s
            Population:
              Alive:          %,d
              Max alive:      %,d
              Extinctions:    %,d

            Energy:
              In fish:        %,.1f
              Banked:         %,.1f
              Food:           %,.1f (%,d items)

            JVM:
              Heap:           %,d / %,d MB (%.1f%%)
            """,
            totalTicks,
            totalSpawns, ticksPerSpawn(),
            bankedBirths,
            traitBirths,
            sexualBirths,
            emergencySpawns,
            failedSpawns,
            totalDeaths, deathRatePer1000(),
            causes,
            aliveCount,
            maxAlive,
            extinctions,
            totalFishEnergy,
            totalBankedEnergy,
            foodEnergy, foodCount,
            heapUsedMB, heapMaxMB, heapUsagePercent()
        );
    }
}
