package io.github.manjago.tidepool.agent;

/**
 * Anything with a position in the tank.
 */
public interface Positioned {

    double getX();

    double getY();
}
