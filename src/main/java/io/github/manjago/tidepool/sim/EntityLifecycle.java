package io.github.manjago.tidepool.sim;

import io.github.manjago.tidepool.agent.Fish;
import io.github.manjago.tidepool.agent.Genome;

import java.util.List;
import java.util.Optional;

/**
 * Owner of population membership.
 *
 * Spawn and remove requests are buffered and applied together at the end
 * of the tick, so everything iterating a snapshot during the tick sees a
 * stable list.
 */
public interface EntityLifecycle {

    /**
     * Queue a new fish for insertion at the end of the tick.
     *
     * @return false if the request was rejected (population full, duplicate id)
     */
    boolean requestSpawn(Fish fish, String reason);

    /**
     * Queue a registered fish for removal at the end of the tick.
     *
     * @return false if the fish is unknown or already queued
     */
    boolean requestRemove(Fish fish, String reason);

    /**
     * @return snapshot of registered ACTIVE fish, in registration order
     */
    List<Fish> getLiveAgents();

    /**
     * @return spawns queued this tick and not yet applied
     */
    int pendingSpawnCount();

    /**
     * Allocate a fresh agent id.
     */
    int nextAgentId();

    /**
     * Registered fish by id, active or not.
     */
    Optional<Fish> findById(int id);

    /**
     * Genome of the fish most recently added to the registry, even if it
     * has since died.
     */
    Optional<Genome> getLastRegisteredGenome();
}
