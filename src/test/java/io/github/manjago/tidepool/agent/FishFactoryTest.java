package io.github.manjago.tidepool.agent;

import io.github.manjago.tidepool.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FishFactoryTest {

    private final FishFactory factory = TestFixtures.factory();

    @Test
    @DisplayName("Newborn is an active baby sized by its genome")
    void newborn() {
        Genome big = Genome.NEUTRAL.withSizeModifier(1.5);

        Fish fish = factory.create(4, big, 2, 1, "molly", 10, 20, 30, 99);

        assertEquals(LifeStage.BABY, fish.getStage());
        assertEquals(0, fish.getAge());
        assertEquals(75, fish.getMaxEnergy(), 1e-9);
        assertEquals(30, fish.getEnergy(), 1e-9);
        assertEquals(2, fish.getGeneration());
        assertEquals(1, fish.getParentId());
        assertEquals("molly", fish.getSpecies());
        assertEquals(99, fish.getBirthTick());
        assertTrue(fish.isActive());
        assertEquals(0, fish.getReproductionLedger().getOverflowBank());
    }

    @Test
    @DisplayName("Derived values follow the genome modifiers")
    void derivedValues() {
        Genome genome = new Genome(1.2, 0.5, 2.0, 0);

        assertEquals(60, factory.offspringMaxEnergy(genome), 1e-9);
        assertEquals(50, factory.fullBabyCost(), 1e-9);
        assertEquals(100, factory.maxAge(genome));
        assertEquals(0.04, factory.baseMetabolism(genome), 1e-12);
        assertEquals(30, factory.initialEnergy(genome), 1e-9);
    }

    @Test
    @DisplayName("Genome traits are clamped to their ranges")
    void genomeClamped() {
        Genome wild = new Genome(9, 0.1, Double.NaN, 3);

        assertEquals(Genome.MODIFIER_MAX, wild.sizeModifier());
        assertEquals(Genome.MODIFIER_MIN, wild.lifespanModifier());
        assertEquals(1.0, wild.metabolismModifier());
        assertEquals(1.0, wild.asexualChance());
    }
}
