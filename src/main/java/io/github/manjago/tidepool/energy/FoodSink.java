package io.github.manjago.tidepool.energy;

import io.github.manjago.tidepool.agent.Food;

/**
 * Creates food entities from spilled energy.
 */
public interface FoodSink {

    /**
     * @param x      position, already clamped to the world
     * @param y      position, already clamped to the world
     * @param energy positive amount
     * @return the created food
     */
    Food spawnFood(double x, double y, double energy);
}
