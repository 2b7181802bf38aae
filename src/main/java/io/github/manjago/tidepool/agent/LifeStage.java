package io.github.manjago.tidepool.agent;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Life stages of a fish, in lifetime order.
 */
public enum LifeStage {
    /** Just born, cannot reproduce, cheap metabolism */
    BABY,

    /** Growing, cannot reproduce */
    JUVENILE,

    /** Prime of life, the only stage that reproduces */
    ADULT,

    /** Final stage before natural death, costly metabolism */
    ELDER;

    /**
     * Forward-only, one step at a time. ELDER is terminal; death is tracked by {@link Mortality}.
     */
    public static final Map<LifeStage, List<LifeStage>> TRANSITIONS;

    static {
        Map<LifeStage, List<LifeStage>> map = new EnumMap<>(LifeStage.class);
        map.put(BABY, List.of(JUVENILE));
        map.put(JUVENILE, List.of(ADULT));
        map.put(ADULT, List.of(ELDER));
        map.put(ELDER, List.of());
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    /**
     * @return the adjacent later stage, or null for ELDER
     */
    @Contract(pure = true)
    public @Nullable LifeStage next() {
        LifeStage[] stages = values();
        return ordinal() + 1 < stages.length ? stages[ordinal() + 1] : null;
    }

    public boolean isBefore(LifeStage other) {
        return ordinal() < other.ordinal();
    }

    /**
     * @return display name, e.g. "Adult"
     */
    public String label() {
        String name = name();
        return name.charAt(0) + name.substring(1).toLowerCase();
    }
}
