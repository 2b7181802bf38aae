package io.github.manjago.tidepool.agent;

import io.github.manjago.tidepool.config.EnergySettings;

/**
 * Per-agent energy budget.
 *
 * Holds current and max energy and computes metabolic burn, but never
 * applies a burn on its own: every change goes through
 * {@link io.github.manjago.tidepool.energy.EnergyDeltaRouter}, which calls
 * {@link #commit(double)}.
 *
 * Status queries work on the ratio current/max so a large fish at 10% is as
 * hungry as a small fish at 10%.
 */
public class EnergyLedger {

    private final EnergySettings settings;
    private final double baseMetabolism;

    private double energy;
    private double maxEnergy;

    /**
     * @param maxEnergy      capacity, must be positive
     * @param baseMetabolism per-tick metabolic rate, must not be negative
     * @param initialEnergy  starting energy, clamped to [0, maxEnergy]
     * @param settings       cost and threshold constants
     */
    public EnergyLedger(double maxEnergy, double baseMetabolism, double initialEnergy, EnergySettings settings) {
        if (maxEnergy <= 0) {
            throw new IllegalArgumentException("maxEnergy must be positive: " + maxEnergy);
        }
        if (baseMetabolism < 0) {
            throw new IllegalArgumentException("baseMetabolism must not be negative: " + baseMetabolism);
        }
        this.settings = settings;
        this.baseMetabolism = baseMetabolism;
        this.maxEnergy = maxEnergy;
        this.energy = Math.max(0.0, Math.min(maxEnergy, initialEnergy));
    }

    // ========== Burn ==========

    /**
     * Compute this tick's cost without applying it.
     *
     * @param speed         current speed (velocity magnitude)
     * @param maxSpeed      top speed; non-positive means no movement cost
     * @param stage         life stage, scales all parts
     * @param timeModifier  day/night style multiplier
     * @param size          body size
     */
    public EnergyBurn calculateBurn(double speed, double maxSpeed, LifeStage stage, double timeModifier, double size) {
        double existence = settings.existenceCost() * timeModifier
                * Math.pow(size, settings.existenceSizeExponent());

        double metabolism = baseMetabolism * timeModifier;

        double movement = 0.0;
        double speedRatio = maxSpeed > 0 ? Math.abs(speed) / maxSpeed : 0.0;
        if (speedRatio > 0) {
            double sizeFactor = Math.pow(size, settings.movementSizeExponent());
            movement = settings.movementCost() * speedRatio * sizeFactor;

            if (speedRatio > settings.sprintThreshold()) {
                double excess = speedRatio - settings.sprintThreshold();
                movement += settings.sprintCost() * excess * excess * excess * sizeFactor;
            }
        }

        double stageMultiplier = stageMultiplier(stage);
        return EnergyBurn.of(existence * stageMultiplier, metabolism * stageMultiplier, movement * stageMultiplier);
    }

    private double stageMultiplier(LifeStage stage) {
        return switch (stage) {
            case BABY -> settings.babyMetabolismMultiplier();
            case ELDER -> settings.elderMetabolismMultiplier();
            default -> 1.0;
        };
    }

    // ========== Mutation ==========

    /**
     * Set the energy. Callers outside the router must not use this.
     *
     * @throws IllegalArgumentException if the value is outside [0, maxEnergy]
     */
    public void commit(double newEnergy) {
        if (Double.isNaN(newEnergy) || newEnergy < 0 || newEnergy > maxEnergy) {
            throw new IllegalArgumentException(String.format(
                    "Energy %.4f outside [0, %.4f]", newEnergy, maxEnergy));
        }
        this.energy = newEnergy;
    }

    /**
     * Change capacity (size changed). Energy above the new max is clamped down.
     *
     * @return energy removed by the clamp (0 when capacity grew)
     */
    public double setMaxEnergy(double newMax) {
        if (newMax <= 0) {
            throw new IllegalArgumentException("maxEnergy must be positive: " + newMax);
        }
        this.maxEnergy = newMax;
        if (energy > newMax) {
            double clamped = energy - newMax;
            energy = newMax;
            return clamped;
        }
        return 0.0;
    }

    // ========== Queries ==========

    public double getEnergy() {
        return energy;
    }

    public double getMaxEnergy() {
        return maxEnergy;
    }

    public double getBaseMetabolism() {
        return baseMetabolism;
    }

    /**
     * @return energy / max, or 0 when max is not positive
     */
    public double getEnergyRatio() {
        return maxEnergy > 0 ? energy / maxEnergy : 0.0;
    }

    public boolean isStarving() {
        return getEnergyRatio() < settings.starvationRatio();
    }

    public boolean isCritical() {
        return getEnergyRatio() < settings.criticalRatio();
    }

    public boolean isLow() {
        return getEnergyRatio() < settings.lowRatio();
    }

    public boolean isSafe() {
        return getEnergyRatio() >= settings.safeRatio();
    }

    public boolean hasAtLeast(double threshold) {
        return energy >= threshold;
    }

    /**
     * @return "Starving", "Critical Energy", "Low Energy", "Safe Energy" or "Moderate Energy"
     */
    public String describeState() {
        if (isStarving()) {
            return "Starving";
        }
        if (isCritical()) {
            return "Critical Energy";
        }
        if (isLow()) {
            return "Low Energy";
        }
        if (isSafe()) {
            return "Safe Energy";
        }
        return "Moderate Energy";
    }

    @Override
    public String toString() {
        return String.format("Energy[%.1f/%.1f]", energy, maxEnergy);
    }
}
