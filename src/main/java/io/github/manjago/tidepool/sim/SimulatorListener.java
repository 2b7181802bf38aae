package io.github.manjago.tidepool.sim;

import io.github.manjago.tidepool.agent.Fish;

/**
 * Listener for simulation events.
 *
 * Implement this interface to react to simulation events,
 * for example to log events to a file or print progress.
 */
public interface SimulatorListener {

    /**
     * Called when a new fish enters the tank (end of tick).
     *
     * @param child the new fish
     * @param tick current simulation tick
     */
    default void onSpawn(Fish child, long tick) {}

    /**
     * Called when a fish leaves the tank (end of tick).
     *
     * @param fish the removed fish
     * @param cause resolved cause label, e.g. "starvation"
     * @param tick current simulation tick
     */
    default void onDeath(Fish fish, String cause, long tick) {}

    /**
     * Called when the last fish is gone, before recovery.
     *
     * @param tick current simulation tick
     */
    default void onExtinction(long tick) {}

    /**
     * Called periodically with progress statistics.
     *
     * @param stats current statistics
     */
    default void onProgress(SimulatorStats stats) {}

    /**
     * Called when a checkpoint should be saved.
     *
     * @param tick current tick
     */
    default void onCheckpoint(long tick) {}

    /**
     * No-op listener that does nothing.
     */
    SimulatorListener NOOP = new SimulatorListener() {};
}
