package io.github.manjago.tidepool.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Energy economy constants ({@code tidepool.energy}).
 */
public record EnergySettings(
    double maxEnergyDefault,
    double initialRatio,
    double baseMetabolism,
    double existenceCost,
    double existenceSizeExponent,
    double movementCost,
    double movementSizeExponent,
    double sprintThreshold,
    double sprintCost,
    double babyMetabolismMultiplier,
    double elderMetabolismMultiplier,
    double starvationRatio,
    double criticalRatio,
    double lowRatio,
    double safeRatio,
    double bankMultiplier
) {

    public EnergySettings {
        if (maxEnergyDefault <= 0) {
            throw new IllegalArgumentException("energy.max-default must be positive: " + maxEnergyDefault);
        }
        if (bankMultiplier < 0) {
            throw new IllegalArgumentException("energy.bank-multiplier must not be negative: " + bankMultiplier);
        }
        if (sprintThreshold <= 0 || sprintThreshold > 1) {
            throw new IllegalArgumentException("energy.sprint-threshold must be in (0, 1]: " + sprintThreshold);
        }
    }

    public static EnergySettings defaults() {
        return fromConfig(ConfigFactory.load().getConfig("tidepool.energy"));
    }

    public static EnergySettings fromConfig(Config c) {
        return new EnergySettings(
            c.getDouble("max-default"),
            c.getDouble("initial-ratio"),
            c.getDouble("base-metabolism"),
            c.getDouble("existence-cost"),
            c.getDouble("existence-size-exponent"),
            c.getDouble("movement-cost"),
            c.getDouble("movement-size-exponent"),
            c.getDouble("sprint-threshold"),
            c.getDouble("sprint-cost"),
            c.getDouble("baby-metabolism-multiplier"),
            c.getDouble("elder-metabolism-multiplier"),
            c.getDouble("starvation-ratio"),
            c.getDouble("critical-ratio"),
            c.getDouble("low-ratio"),
            c.getDouble("safe-ratio"),
            c.getDouble("bank-multiplier")
        );
    }

    public EnergySettings withMaxEnergyDefault(double value) {
        return new EnergySettings(value, initialRatio, baseMetabolism, existenceCost, existenceSizeExponent,
                movementCost, movementSizeExponent, sprintThreshold, sprintCost, babyMetabolismMultiplier,
                elderMetabolismMultiplier, starvationRatio, criticalRatio, lowRatio, safeRatio, bankMultiplier);
    }

    public EnergySettings withBankMultiplier(double value) {
        return new EnergySettings(maxEnergyDefault, initialRatio, baseMetabolism, existenceCost, existenceSizeExponent,
                movementCost, movementSizeExponent, sprintThreshold, sprintCost, babyMetabolismMultiplier,
                elderMetabolismMultiplier, starvationRatio, criticalRatio, lowRatio, safeRatio, value);
    }

    public EnergySettings withBaseMetabolism(double value) {
        return new EnergySettings(maxEnergyDefault, initialRatio, value, existenceCost, existenceSizeExponent,
                movementCost, movementSizeExponent, sprintThreshold, sprintCost, babyMetabolismMultiplier,
                elderMetabolismMultiplier, starvationRatio, criticalRatio, lowRatio, safeRatio, bankMultiplier);
    }
}
