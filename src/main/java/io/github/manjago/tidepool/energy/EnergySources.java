package io.github.manjago.tidepool.energy;

/**
 * Source tags attached to energy deltas.
 */
public final class EnergySources {

    public static final String METABOLISM = "metabolism";
    public static final String FOOD = "food";
    public static final String PLANKTON = "plankton";
    public static final String PREDATION = "predation";
    public static final String INTERACTION = "interaction";

    /** Parent energy handed to an asexual offspring */
    public static final String ASEXUAL_REPRODUCTION = "asexual_reproduction";

    /** Parent energy handed to a sexual offspring */
    public static final String SEXUAL_REPRODUCTION = "sexual_reproduction";

    /** Refund of a transfer whose spawn was rejected */
    public static final String REPRODUCTION_REFUND = "reproduction_refund";

    /** Energy above a capacity that shrank */
    public static final String CAPACITY_CLAMP = "capacity_clamp";

    // Overflow destinations, recorded next to the source that caused them
    public static final String OVERFLOW_BANK = "overflow_bank";
    public static final String OVERFLOW_FOOD = "overflow_food";
    public static final String OVERFLOW_LOST = "overflow_lost";

    private EnergySources() {
    }
}
