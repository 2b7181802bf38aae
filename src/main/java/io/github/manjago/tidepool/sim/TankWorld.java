package io.github.manjago.tidepool.sim;

import io.github.manjago.tidepool.core.Bounds;
import io.github.manjago.tidepool.core.GameRng;
import io.github.manjago.tidepool.core.SpatialWorld;

/**
 * Rectangular tank starting at the origin.
 */
public class TankWorld implements SpatialWorld {

    private final Bounds bounds;

    public TankWorld(double width, double height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Tank size must be positive: " + width + "x" + height);
        }
        this.bounds = new Bounds(0, 0, width, height);
    }

    @Override
    public Bounds getBounds() {
        return bounds;
    }

    /**
     * Uniform random point, kept {@code margin} away from the walls where the tank allows.
     *
     * @return {x, y}
     */
    public double[] randomPoint(GameRng rng, double margin) {
        double mx = Math.min(margin, bounds.width() / 2);
        double my = Math.min(margin, bounds.height() / 2);
        double x = bounds.minX() + mx + rng.nextDouble() * (bounds.width() - 2 * mx);
        double y = bounds.minY() + my + rng.nextDouble() * (bounds.height() - 2 * my);
        return new double[]{x, y};
    }

    @Override
    public String toString() {
        return String.format("Tank[%.0fx%.0f]", bounds.width(), bounds.height());
    }
}
