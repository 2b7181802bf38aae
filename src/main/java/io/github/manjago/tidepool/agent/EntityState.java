package io.github.manjago.tidepool.agent;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mortal state of an agent. DEAD and REMOVED are terminal for behaviour;
 * REMOVED additionally means the registry no longer lists the agent.
 */
public enum EntityState {
    ACTIVE,
    DEAD,
    REMOVED;

    public static final Map<EntityState, List<EntityState>> TRANSITIONS;

    static {
        Map<EntityState, List<EntityState>> map = new EnumMap<>(EntityState.class);
        map.put(ACTIVE, List.of(DEAD, REMOVED));
        map.put(DEAD, List.of(REMOVED));
        map.put(REMOVED, List.of());
        TRANSITIONS = Collections.unmodifiableMap(map);
    }
}
