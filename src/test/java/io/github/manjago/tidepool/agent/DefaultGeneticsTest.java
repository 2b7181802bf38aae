package io.github.manjago.tidepool.agent;

import io.github.manjago.tidepool.core.GameRng;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultGeneticsTest {

    private final Genetics genetics = new DefaultGenetics();

    @RepeatedTest(20)
    @DisplayName("Founder genomes stay near neutral")
    void randomGenome() {
        Genome genome = genetics.randomGenome(new GameRng(System.nanoTime()));

        assertTrue(genome.sizeModifier() >= 0.7 && genome.sizeModifier() < 1.3);
        assertTrue(genome.asexualChance() >= 0 && genome.asexualChance() < 0.01);
    }

    @Test
    @DisplayName("Zero rate copies, full rate changes every trait")
    void mutate() {
        Genome parent = new Genome(1.0, 1.0, 1.0, 0.005);
        GameRng rng = new GameRng(11);

        assertEquals(parent, genetics.mutate(parent, 0.0, 0.5, rng));

        Genome child = genetics.mutate(parent, 1.0, 0.5, rng);
        assertNotEquals(parent.sizeModifier(), child.sizeModifier());
        assertNotEquals(parent.lifespanModifier(), child.lifespanModifier());
        assertNotEquals(parent.metabolismModifier(), child.metabolismModifier());
    }

    @Test
    @DisplayName("Crossover takes every trait from one parent or the other")
    void crossover() {
        Genome a = new Genome(0.6, 0.6, 0.6, 0.0);
        Genome b = new Genome(1.8, 1.8, 1.8, 1.0);

        assertEquals(a, genetics.crossover(a, 1.0, b, new GameRng(1)));
        assertEquals(b, genetics.crossover(a, 0.0, b, new GameRng(1)));

        Genome mixed = genetics.crossover(a, 0.5, b, new GameRng(5));
        assertTrue(mixed.sizeModifier() == 0.6 || mixed.sizeModifier() == 1.8);
        assertTrue(mixed.asexualChance() == 0.0 || mixed.asexualChance() == 1.0);
    }
}
