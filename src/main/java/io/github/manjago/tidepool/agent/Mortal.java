package io.github.manjago.tidepool.agent;

/**
 * Anything that can die. Energy depletion is published to its {@link Mortality}.
 */
public interface Mortal {

    Mortality getMortality();
}
