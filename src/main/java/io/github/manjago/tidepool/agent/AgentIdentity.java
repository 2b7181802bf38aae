package io.github.manjago.tidepool.agent;

/**
 * Stable identity of an agent.
 *
 * @param id         unique agent id
 * @param generation 0 for founders, parent generation + 1 for offspring
 * @param parentId   id of the (first) parent, -1 for founders and emergency spawns
 * @param species    species tag; only same-species agents mate
 */
public record AgentIdentity(int id, int generation, int parentId, String species) {

    public static final int NO_PARENT = -1;

    public AgentIdentity {
        if (species == null || species.isBlank()) {
            throw new IllegalArgumentException("Species must not be blank");
        }
    }

    public boolean hasParent() {
        return parentId != NO_PARENT;
    }
}
