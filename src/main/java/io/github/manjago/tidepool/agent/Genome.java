package io.github.manjago.tidepool.agent;

/**
 * The heritable traits this core reads.
 *
 * Modifiers are multipliers around 1.0; the asexual chance is a per-tick
 * probability used by the trait-probability reproduction path.
 */
public record Genome(
    double sizeModifier,
    double lifespanModifier,
    double metabolismModifier,
    double asexualChance
) {

    public static final double MODIFIER_MIN = 0.5;
    public static final double MODIFIER_MAX = 2.0;

    /** Neutral genome: all modifiers 1.0, never reproduces by trait roll. */
    public static final Genome NEUTRAL = new Genome(1.0, 1.0, 1.0, 0.0);

    public Genome {
        sizeModifier = clampModifier(sizeModifier);
        lifespanModifier = clampModifier(lifespanModifier);
        metabolismModifier = clampModifier(metabolismModifier);
        asexualChance = Math.max(0.0, Math.min(1.0, asexualChance));
    }

    public Genome withAsexualChance(double chance) {
        return new Genome(sizeModifier, lifespanModifier, metabolismModifier, chance);
    }

    public Genome withSizeModifier(double modifier) {
        return new Genome(modifier, lifespanModifier, metabolismModifier, asexualChance);
    }

    static double clampModifier(double value) {
        if (Double.isNaN(value)) {
            return 1.0;
        }
        return Math.max(MODIFIER_MIN, Math.min(MODIFIER_MAX, value));
    }
}
