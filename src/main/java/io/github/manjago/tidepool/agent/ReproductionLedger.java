package io.github.manjago.tidepool.agent;

import io.github.manjago.tidepool.config.ReproductionSettings;
import io.github.manjago.tidepool.core.GameRng;

/**
 * Reproduction timing and resources of one agent: cooldown, overflow bank
 * and reproduction credits.
 *
 * Genome construction is delegated to {@link Genetics}; this ledger only
 * decides when an agent may reproduce and what funds it.
 */
public class ReproductionLedger {

    /** Tolerance for ratio thresholds, so 95.0 of 100 passes a 0.95 gate. */
    private static final double EPSILON = 1e-9;

    private final ReproductionSettings settings;

    private int cooldown;
    private double overflowBank;
    private double reproCredits;

    public ReproductionLedger(ReproductionSettings settings) {
        this.settings = settings;
    }

    // ========== Overflow bank ==========

    /**
     * Deposit overflow energy, up to {@code maxBank}.
     *
     * @return amount actually banked; the caller routes the rest elsewhere
     */
    public double bankOverflow(double amount, double maxBank) {
        if (amount <= 0) {
            return 0.0;
        }
        double available = Math.max(0.0, maxBank - overflowBank);
        double banked = Math.min(amount, available);
        overflowBank += banked;
        return banked;
    }

    /**
     * Withdraw up to {@code maxAmount} from the bank.
     *
     * @return amount withdrawn
     */
    public double consumeBank(double maxAmount) {
        if (maxAmount <= 0 || overflowBank <= 0) {
            return 0.0;
        }
        double used = Math.min(overflowBank, maxAmount);
        overflowBank -= used;
        return used;
    }

    /**
     * Put back a withdrawal whose birth did not happen. Not capped: the
     * amount was in the bank a moment ago.
     */
    public void refundBank(double amount) {
        if (amount > 0) {
            overflowBank += amount;
        }
    }

    // ========== Gating ==========

    /**
     * ADULT, at least the reproduction energy ratio of max energy, off cooldown.
     */
    public boolean canReproduce(LifeStage stage, double energy, double maxEnergy) {
        return stage == LifeStage.ADULT
                && cooldown <= 0
                && energy + EPSILON >= maxEnergy * settings.energyRatio();
    }

    /**
     * {@link #canReproduce} plus the stricter asexual ratio: a self-funded
     * birth needs a fuller parent than a cooperatively funded one.
     */
    public boolean canAsexuallyReproduce(LifeStage stage, double energy, double maxEnergy) {
        return canReproduce(stage, energy, maxEnergy)
                && energy + EPSILON >= maxEnergy * settings.asexualEnergyRatio();
    }

    /**
     * Start an asexual birth: sets the cooldown and builds the offspring genome.
     */
    public AsexualOffspring triggerAsexual(Genome parentGenome, Genetics genetics, GameRng rng) {
        cooldown = settings.cooldownTicks();
        Genome offspring = genetics.mutate(parentGenome, settings.mutationRate(), settings.mutationStrength(), rng);
        return new AsexualOffspring(offspring, settings.energyTransferFraction());
    }

    // ========== Cooldown ==========

    /**
     * Decrement the cooldown by one tick, floored at 0.
     */
    public void tickCooldown() {
        if (cooldown > 0) {
            cooldown--;
        }
    }

    public int getCooldown() {
        return cooldown;
    }

    public void setCooldown(int cooldown) {
        this.cooldown = Math.max(0, cooldown);
    }

    /**
     * Start the standard cooldown, keeping a longer one if already running.
     */
    public void startCooldown() {
        cooldown = Math.max(cooldown, settings.cooldownTicks());
    }

    // ========== Credits ==========

    public boolean hasReproCredits(double required) {
        return reproCredits + EPSILON >= required;
    }

    /**
     * @return amount consumed (never more than held)
     */
    public double consumeReproCredits(double amount) {
        if (amount <= 0) {
            return 0.0;
        }
        double used = Math.min(reproCredits, amount);
        reproCredits -= used;
        return used;
    }

    public void addReproCredits(double amount) {
        if (amount > 0) {
            reproCredits += amount;
        }
    }

    public double getReproCredits() {
        return reproCredits;
    }

    public double getOverflowBank() {
        return overflowBank;
    }

    // ========== Restore ==========

    /**
     * Rebuild from persisted fields.
     */
    public void restore(int cooldown, double overflowBank, double reproCredits) {
        if (overflowBank < 0 || reproCredits < 0) {
            throw new IllegalArgumentException("Bank and credits must not be negative");
        }
        this.cooldown = Math.max(0, cooldown);
        this.overflowBank = overflowBank;
        this.reproCredits = reproCredits;
    }

    public String describeState() {
        if (cooldown > 0) {
            return String.format("Cooldown (%d ticks until ready)", cooldown);
        }
        return "Ready to reproduce";
    }

    @Override
    public String toString() {
        return String.format("Reproduction[cooldown=%d, bank=%.1f, credits=%.2f]", cooldown, overflowBank, reproCredits);
    }
}
