package io.github.manjago.tidepool.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Reproduction gating and funding ({@code tidepool.reproduction} and {@code tidepool.interaction}).
 */
public record ReproductionSettings(
    double energyRatio,
    double asexualEnergyRatio,
    int cooldownTicks,
    double energyTransferFraction,
    double creditsRequired,
    double mutationRate,
    double mutationStrength,

    // Post-interaction (sexual) reproduction
    double interactionEnergyRatio,
    double matingDistance,
    double parentContribution,
    double winnerWeight,
    double interactionMutationRate,
    double interactionMutationStrength,
    double offspringJitter
) {

    public ReproductionSettings {
        if (cooldownTicks < 0) {
            throw new IllegalArgumentException("reproduction.cooldown-ticks must not be negative: " + cooldownTicks);
        }
        if (creditsRequired < 0) {
            throw new IllegalArgumentException("reproduction.credits-required must not be negative: " + creditsRequired);
        }
    }

    public static ReproductionSettings defaults() {
        Config root = ConfigFactory.load().getConfig("tidepool");
        return fromConfig(root.getConfig("reproduction"), root.getConfig("interaction"));
    }

    public static ReproductionSettings fromConfig(Config repro, Config interaction) {
        return new ReproductionSettings(
            repro.getDouble("energy-ratio"),
            repro.getDouble("asexual-energy-ratio"),
            repro.getInt("cooldown-ticks"),
            repro.getDouble("energy-transfer-fraction"),
            repro.getDouble("credits-required"),
            repro.getDouble("mutation-rate"),
            repro.getDouble("mutation-strength"),
            interaction.getDouble("energy-ratio"),
            interaction.getDouble("mating-distance"),
            interaction.getDouble("parent-contribution"),
            interaction.getDouble("winner-weight"),
            interaction.getDouble("mutation-rate"),
            interaction.getDouble("mutation-strength"),
            interaction.getDouble("offspring-jitter")
        );
    }

    /**
     * @return true when reproduction is gated on credits
     */
    public boolean creditsEnabled() {
        return creditsRequired > 0;
    }

    public ReproductionSettings withCreditsRequired(double value) {
        return new ReproductionSettings(energyRatio, asexualEnergyRatio, cooldownTicks, energyTransferFraction,
                value, mutationRate, mutationStrength, interactionEnergyRatio, matingDistance,
                parentContribution, winnerWeight, interactionMutationRate, interactionMutationStrength,
                offspringJitter);
    }

    public ReproductionSettings withCooldownTicks(int value) {
        return new ReproductionSettings(energyRatio, asexualEnergyRatio, value, energyTransferFraction,
                creditsRequired, mutationRate, mutationStrength, interactionEnergyRatio, matingDistance,
                parentContribution, winnerWeight, interactionMutationRate, interactionMutationStrength,
                offspringJitter);
    }
}
