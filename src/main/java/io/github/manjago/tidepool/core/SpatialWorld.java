package io.github.manjago.tidepool.core;

/**
 * The part of the world this core needs: its extent. Spawn and spill
 * positions are clamped to it.
 */
public interface SpatialWorld {

    Bounds getBounds();

    /**
     * Clamp a coordinate pair into the bounds.
     *
     * @return {x, y}
     */
    default double[] clamp(double x, double y) {
        Bounds b = getBounds();
        return new double[]{b.clampX(x), b.clampY(y)};
    }
}
