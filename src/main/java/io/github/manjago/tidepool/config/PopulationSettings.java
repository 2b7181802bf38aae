package io.github.manjago.tidepool.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Population cap and emergency spawning ({@code tidepool.population}).
 */
public record PopulationSettings(
    int maxPopulation,
    int criticalPopulation,
    int emergencyCooldown,
    double emergencyProbabilityScale,
    int spawnMargin
) {

    public PopulationSettings {
        if (maxPopulation <= 0) {
            throw new IllegalArgumentException("population.max must be positive: " + maxPopulation);
        }
        if (criticalPopulation < 0 || criticalPopulation >= maxPopulation) {
            throw new IllegalArgumentException(String.format(
                    "population.critical must be in [0, max): critical=%d, max=%d",
                    criticalPopulation, maxPopulation));
        }
    }

    public static PopulationSettings defaults() {
        return fromConfig(ConfigFactory.load().getConfig("tidepool.population"));
    }

    public static PopulationSettings fromConfig(Config c) {
        return new PopulationSettings(
            c.getInt("max"),
            c.getInt("critical"),
            c.getInt("emergency-cooldown"),
            c.getDouble("emergency-probability-scale"),
            c.getInt("spawn-margin")
        );
    }

    public PopulationSettings withMaxPopulation(int max, int critical) {
        return new PopulationSettings(max, critical, emergencyCooldown, emergencyProbabilityScale, spawnMargin);
    }

    public PopulationSettings withEmergencyCooldown(int value) {
        return new PopulationSettings(maxPopulation, criticalPopulation, value, emergencyProbabilityScale, spawnMargin);
    }
}
