package io.github.manjago.tidepool.agent;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

/**
 * Why an agent left the tank.
 */
public enum DeathCause {
    /** Energy reached zero */
    STARVATION("starvation"),

    /** Age reached max age */
    OLD_AGE("old_age"),

    /** Energy reached zero shortly after a predator encounter */
    PREDATION("predation"),

    /** Left through a tank boundary (removed, not dead) */
    MIGRATION("migration");

    private final String label;

    DeathCause(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return the cause with this label, or null
     */
    @Contract(pure = true)
    public static @Nullable DeathCause fromLabel(String label) {
        for (DeathCause cause : values()) {
            if (cause.label.equals(label)) {
                return cause;
            }
        }
        return null;
    }
}
