package io.github.manjago.tidepool.agent;

import io.github.manjago.tidepool.core.GameRng;

/**
 * Genome construction. The core only needs genomes that seed
 * max energy, size, max age and the asexual trait.
 */
public interface Genetics {

    /**
     * Fresh genome for founders and extinction recovery.
     */
    Genome randomGenome(GameRng rng);

    /**
     * Copy with each trait perturbed with probability {@code rate} by up to {@code strength}.
     */
    Genome mutate(Genome genome, double rate, double strength, GameRng rng);

    /**
     * Per-trait mix of two parents; {@code weightA} is the chance a trait comes from {@code a}.
     */
    Genome crossover(Genome a, double weightA, Genome b, GameRng rng);
}
