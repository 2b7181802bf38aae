package io.github.manjago.tidepool.agent;

import io.github.manjago.tidepool.core.GameRng;

/**
 * Reference genetics: uniform founders, Gaussian point mutation, per-trait crossover.
 */
public class DefaultGenetics implements Genetics {

    private static final double MODIFIER_RANGE = Genome.MODIFIER_MAX - Genome.MODIFIER_MIN;
    private static final double MAX_FOUNDER_ASEXUAL_CHANCE = 0.01;

    @Override
    public Genome randomGenome(GameRng rng) {
        return new Genome(
            rng.nextDouble(0.7, 1.3),
            rng.nextDouble(0.7, 1.3),
            rng.nextDouble(0.7, 1.3),
            rng.nextDouble(0.0, MAX_FOUNDER_ASEXUAL_CHANCE)
        );
    }

    @Override
    public Genome mutate(Genome genome, double rate, double strength, GameRng rng) {
        return new Genome(
            mutateTrait(genome.sizeModifier(), MODIFIER_RANGE, rate, strength, rng),
            mutateTrait(genome.lifespanModifier(), MODIFIER_RANGE, rate, strength, rng),
            mutateTrait(genome.metabolismModifier(), MODIFIER_RANGE, rate, strength, rng),
            mutateTrait(genome.asexualChance(), MAX_FOUNDER_ASEXUAL_CHANCE, rate, strength, rng)
        );
    }

    @Override
    public Genome crossover(Genome a, double weightA, Genome b, GameRng rng) {
        return new Genome(
            rng.nextBoolean(weightA) ? a.sizeModifier() : b.sizeModifier(),
            rng.nextBoolean(weightA) ? a.lifespanModifier() : b.lifespanModifier(),
            rng.nextBoolean(weightA) ? a.metabolismModifier() : b.metabolismModifier(),
            rng.nextBoolean(weightA) ? a.asexualChance() : b.asexualChance()
        );
    }

    private static double mutateTrait(double value, double range, double rate, double strength, GameRng rng) {
        if (!rng.nextBoolean(rate)) {
            return value;
        }
        return value + rng.nextGaussian() * strength * range;
    }
}
