package io.github.manjago.tidepool.agent;

import io.github.manjago.tidepool.config.EnergySettings;
import io.github.manjago.tidepool.config.LifecycleSettings;
import io.github.manjago.tidepool.config.ReproductionSettings;

/**
 * Builds fish with a fresh set of components seeded from a genome.
 *
 * Max energy follows body size: {@code maxEnergyDefault × size}, so a newborn
 * starts with the capacity of a baby and grows into an adult's.
 */
public class FishFactory {

    public static final String DEFAULT_SPECIES = "guppy";

    private final EnergySettings energySettings;
    private final LifecycleSettings lifecycleSettings;
    private final ReproductionSettings reproductionSettings;

    public FishFactory(EnergySettings energySettings,
                       LifecycleSettings lifecycleSettings,
                       ReproductionSettings reproductionSettings) {
        this.energySettings = energySettings;
        this.lifecycleSettings = lifecycleSettings;
        this.reproductionSettings = reproductionSettings;
    }

    /**
     * New-born fish (BABY, age 0).
     *
     * @param initialEnergy energy actually transferred to the fish; anything
     *                      above its capacity must not be passed in
     */
    public Fish create(int id, Genome genome, int generation, int parentId, String species,
                       double x, double y, double initialEnergy, long tick) {
        LifecycleStateMachine lifecycle = new LifecycleStateMachine(
                maxAge(genome), genome.sizeModifier(), lifecycleSettings);
        EnergyLedger energy = new EnergyLedger(
                maxEnergyForSize(lifecycle.getSize()), baseMetabolism(genome), initialEnergy, energySettings);
        return new Fish(
                new AgentIdentity(id, generation, parentId, species),
                genome,
                tick,
                energy,
                lifecycle,
                new ReproductionLedger(reproductionSettings),
                newMortality(),
                x, y);
    }

    // ========== Derived values ==========

    /**
     * Capacity of a newborn with this genome; also the full cost of a baby.
     */
    public double offspringMaxEnergy(Genome genome) {
        return maxEnergyForSize(lifecycleSettings.babySize() * genome.sizeModifier());
    }

    /**
     * Full-baby cost for a neutral genome, the bank level that allows a banked birth.
     */
    public double fullBabyCost() {
        return energySettings.maxEnergyDefault() * lifecycleSettings.babySize();
    }

    public double maxEnergyForSize(double size) {
        return energySettings.maxEnergyDefault() * size;
    }

    public int maxAge(Genome genome) {
        return (int) Math.round(lifecycleSettings.baseMaxAge() * genome.lifespanModifier());
    }

    public double baseMetabolism(Genome genome) {
        return energySettings.baseMetabolism() * genome.metabolismModifier();
    }

    /**
     * Initial energy for founders and emergency spawns.
     */
    public double initialEnergy(Genome genome) {
        return offspringMaxEnergy(genome) * energySettings.initialRatio();
    }

    // ========== Component builders (restore) ==========

    public EnergyLedger newEnergyLedger(double maxEnergy, double baseMetabolism, double energy) {
        return new EnergyLedger(maxEnergy, baseMetabolism, energy, energySettings);
    }

    public LifecycleStateMachine newLifecycle(Genome genome) {
        return new LifecycleStateMachine(maxAge(genome), genome.sizeModifier(), lifecycleSettings);
    }

    public ReproductionLedger newReproductionLedger() {
        return new ReproductionLedger(reproductionSettings);
    }

    public Mortality newMortality() {
        return new Mortality(lifecycleSettings.predatorEncounterWindow(), lifecycleSettings.trackHistory());
    }
}
