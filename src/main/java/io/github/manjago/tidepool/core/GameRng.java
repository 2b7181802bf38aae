package io.github.manjago.tidepool.core;

import org.apache.commons.rng.RandomProviderState;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.core.RandomProviderDefaultState;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.io.Serial;
import java.io.Serializable;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * The one random stream of a simulation run.
 *
 * Every stochastic decision in the tank (trait rolls, emergency spawn
 * probability, mate choice, spill jitter, genome mutation) draws from the
 * same explicitly passed instance, so a fixed seed replays the same run.
 *
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP:
 * - Fast and high quality
 * - State is just 2 longs (128 bits)
 * - Supports explicit save/restore for checkpoints
 *
 * IMPORTANT: Do not change RandomSource between versions!
 * Changing algorithm would break replay determinism.
 */
public final class GameRng {

    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    private final long initialSeed;
    private final RestorableUniformRandomProvider rng;
    private final ZigguratSampler.NormalizedGaussian gaussian;

    /**
     * Create new RNG with given seed.
     */
    public GameRng(long seed) {
        this.initialSeed = seed;
        this.rng = ALGORITHM.create(seed);
        this.gaussian = ZigguratSampler.NormalizedGaussian.of(rng);
    }

    private GameRng(long initialSeed, RandomProviderState state) {
        this.initialSeed = initialSeed;
        this.rng = ALGORITHM.create(initialSeed);
        this.rng.restoreState(state);
        this.gaussian = ZigguratSampler.NormalizedGaussian.of(rng);
    }

    // ========== Random Methods ==========

    /**
     * Returns uniformly distributed int in [0, bound).
     */
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    /**
     * Returns uniformly distributed int in [min, max] (both inclusive).
     */
    public int nextIntInclusive(int min, int max) {
        if (max <= min) {
            return min;
        }
        return min + rng.nextInt(max - min + 1);
    }

    /**
     * Returns uniformly distributed long.
     */
    public long nextLong() {
        return rng.nextLong();
    }

    /**
     * Returns uniformly distributed double in [0, 1).
     */
    public double nextDouble() {
        return rng.nextDouble();
    }

    /**
     * Returns uniformly distributed double in [min, max).
     */
    public double nextDouble(double min, double max) {
        if (max <= min) {
            return min;
        }
        return min + (max - min) * rng.nextDouble();
    }

    /**
     * Returns true with probability p.
     */
    public boolean nextBoolean(double probability) {
        return rng.nextDouble() < probability;
    }

    /**
     * Gaussian with mean 0 and standard deviation 1. The sampler holds no
     * cached values, so saved state alone reproduces the sequence.
     */
    public double nextGaussian() {
        return gaussian.sample();
    }

    /**
     * Pick one element uniformly.
     *
     * @throws IllegalArgumentException if the list is empty
     */
    public <T> T choose(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty list");
        }
        return items.get(rng.nextInt(items.size()));
    }

    // ========== State Management ==========

    /**
     * Get initial seed (for logging/debugging).
     */
    public long getInitialSeed() {
        return initialSeed;
    }

    /**
     * Save current state for checkpoint.
     * Call this at the START of checkpoint creation, before any more random calls.
     */
    public GameRngState saveState() {
        RandomProviderState state = rng.saveState();
        byte[] stateBytes = ((RandomProviderDefaultState) state).getState();
        return new GameRngState(initialSeed, stateBytes);
    }

    /**
     * Restore RNG from saved state.
     */
    public static GameRng restore(GameRngState state) {
        RandomProviderState rngState = new RandomProviderDefaultState(state.stateBytes());
        return new GameRng(state.initialSeed(), rngState);
    }

    // ========== State Record ==========

    /**
     * Immutable snapshot of RNG state for serialization.
     */
    public record GameRngState(long initialSeed, byte[] stateBytes) implements Serializable {

        @Serial
        private static final long serialVersionUID = 1L;

        /**
         * Serialize to bytes for storage.
         * Format: [8 bytes seed][4 bytes length][N bytes state]
         */
        public byte[] toBytes() {
            ByteBuffer buf = ByteBuffer.allocate(8 + 4 + stateBytes.length);
            buf.putLong(initialSeed);
            buf.putInt(stateBytes.length);
            buf.put(stateBytes);
            return buf.array();
        }

        /**
         * Deserialize from bytes.
         */
        public static GameRngState fromBytes(byte[] bytes) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            long seed = buf.getLong();
            int len = buf.getInt();
            byte[] stateBytes = new byte[len];
            buf.get(stateBytes);
            return new GameRngState(seed, stateBytes);
        }
    }
}
