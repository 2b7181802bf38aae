package io.github.manjago.tidepool.agent;

/**
 * Energy lying in the tank, created when overflow energy cannot be banked.
 */
public class Food implements Positioned {

    private final int id;
    private final double x;
    private final double y;
    private final double energy;
    private final long createdTick;

    public Food(int id, double x, double y, double energy, long createdTick) {
        if (!(energy > 0)) {
            throw new IllegalArgumentException("Food energy must be positive: " + energy);
        }
        this.id = id;
        this.x = x;
        this.y = y;
        this.energy = energy;
        this.createdTick = createdTick;
    }

    public int getId() {
        return id;
    }

    @Override
    public double getX() {
        return x;
    }

    @Override
    public double getY() {
        return y;
    }

    public double getEnergy() {
        return energy;
    }

    public long getCreatedTick() {
        return createdTick;
    }

    @Override
    public String toString() {
        return String.format("Food#%d[%.1f at (%.0f, %.0f)]", id, energy, x, y);
    }
}
