package io.github.manjago.tidepool.sim;

import io.github.manjago.tidepool.agent.AgentIdentity;
import io.github.manjago.tidepool.agent.AsexualOffspring;
import io.github.manjago.tidepool.agent.Fish;
import io.github.manjago.tidepool.agent.FishFactory;
import io.github.manjago.tidepool.agent.Genetics;
import io.github.manjago.tidepool.agent.Genome;
import io.github.manjago.tidepool.agent.LifeStage;
import io.github.manjago.tidepool.agent.ReproductionLedger;
import io.github.manjago.tidepool.config.PopulationSettings;
import io.github.manjago.tidepool.config.ReproductionSettings;
import io.github.manjago.tidepool.core.Bounds;
import io.github.manjago.tidepool.core.GameRng;
import io.github.manjago.tidepool.energy.EnergyDeltaRouter;
import io.github.manjago.tidepool.energy.EnergySources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides who reproduces, once per tick, under the population cap.
 *
 * Order within a tick:
 * 1. every cooldown ticks down
 * 2. banked births: ADULT fish whose overflow bank covers a full baby
 * 3. trait births: ADULT fish at 95% energy that win their asexual roll,
 *    paying for the baby out of their own energy
 * 4. emergency spawns when the population is empty or low
 *
 * A fifth path, {@link #reproduceAfterInteraction}, runs when a minigame
 * ends and applies the same gating before taking energy from both parents.
 *
 * Nothing here changes membership directly: births are requests to the
 * {@link EntityLifecycle}, which applies them at the end of the tick.
 */
public class ReproductionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReproductionOrchestrator.class);

    /** Newborns appear within this distance of an asexual parent on each axis. */
    static final double BIRTH_SCATTER = 15.0;

    private static final long NEVER = Long.MIN_VALUE / 2;

    private final ReproductionSettings reproduction;
    private final PopulationSettings population;
    private final FishFactory factory;
    private final Genetics genetics;
    private final EntityLifecycle lifecycle;
    private final EnergyDeltaRouter router;
    private final TankWorld world;
    private final GameRng rng;

    private long lastEmergencyTick = NEVER;

    // Statistics
    private int bankedBirths = 0;
    private int traitBirths = 0;
    private int sexualBirths = 0;
    private int emergencySpawns = 0;
    private int failedSpawns = 0;

    public ReproductionOrchestrator(ReproductionSettings reproduction,
                                    PopulationSettings population,
                                    FishFactory factory,
                                    Genetics genetics,
                                    EntityLifecycle lifecycle,
                                    EnergyDeltaRouter router,
                                    TankWorld world,
                                    GameRng rng) {
        this.reproduction = reproduction;
        this.population = population;
        this.factory = factory;
        this.genetics = genetics;
        this.lifecycle = lifecycle;
        this.router = router;
        this.world = world;
        this.rng = rng;
    }

    /**
     * Run the per-tick sweep.
     */
    public ReproductionTickStats updateTick(long tick) {
        List<Fish> snapshot = lifecycle.getLiveAgents();
        for (Fish fish : snapshot) {
            fish.getReproductionLedger().tickCooldown();
        }

        int count = snapshot.size() + lifecycle.pendingSpawnCount();
        int max = population.maxPopulation();
        int banked = 0;
        int trait = 0;
        int failed = 0;

        // Banked asexual
        for (Fish parent : snapshot) {
            if (count >= max) {
                break;
            }
            if (!canBankedReproduce(parent)) {
                continue;
            }
            if (spawnFromBank(parent, tick)) {
                banked++;
                count++;
            } else {
                failed++;
            }
        }

        // Trait-probability asexual
        for (Fish parent : snapshot) {
            if (count >= max) {
                break;
            }
            if (!canTraitReproduce(parent)) {
                continue;
            }
            if (rng.nextDouble() >= parent.getGenome().asexualChance()) {
                continue;
            }
            if (spawnSelfFunded(parent, tick)) {
                trait++;
                count++;
            } else {
                failed++;
            }
        }

        // Emergency
        int emergency = 0;
        if (shouldEmergencySpawn(count, tick)) {
            if (spawnEmergency(snapshot, count, tick)) {
                emergency++;
                count++;
            } else {
                failed++;
            }
        }

        bankedBirths += banked;
        traitBirths += trait;
        emergencySpawns += emergency;
        failedSpawns += failed;
        return new ReproductionTickStats(banked, trait, emergency, failed, count);
    }

    // ========== Banked asexual ==========

    private boolean canBankedReproduce(Fish fish) {
        ReproductionLedger ledger = fish.getReproductionLedger();
        return fish.getStage() == LifeStage.ADULT
                && ledger.getCooldown() == 0
                && ledger.getOverflowBank() >= factory.fullBabyCost()
                && hasCredits(ledger);
    }

    private boolean spawnFromBank(Fish parent, long tick) {
        ReproductionLedger ledger = parent.getReproductionLedger();
        int previousCooldown = ledger.getCooldown();

        AsexualOffspring offspring = ledger.triggerAsexual(parent.getGenome(), genetics, rng);
        double funded = ledger.consumeBank(factory.offspringMaxEnergy(offspring.genome()));
        Fish child = createChild(parent, offspring.genome(), funded, tick);

        if (submit(child, "banked_asexual")) {
            consumeCredits(ledger);
            log.debug("Banked birth {} from {} ({} energy)", child.toShortString(), parent.toShortString(),
                    String.format("%.1f", funded));
            return true;
        }
        ledger.refundBank(funded);
        ledger.setCooldown(previousCooldown);
        return false;
    }

    // ========== Trait asexual ==========

    private boolean canTraitReproduce(Fish fish) {
        ReproductionLedger ledger = fish.getReproductionLedger();
        return ledger.canAsexuallyReproduce(fish.getStage(), fish.getEnergy(), fish.getMaxEnergy())
                && hasCredits(ledger);
    }

    private boolean spawnSelfFunded(Fish parent, long tick) {
        ReproductionLedger ledger = parent.getReproductionLedger();
        int previousCooldown = ledger.getCooldown();

        AsexualOffspring offspring = ledger.triggerAsexual(parent.getGenome(), genetics, rng);
        double transfer = Math.min(factory.offspringMaxEnergy(offspring.genome()),
                parent.getEnergy() * offspring.energyTransferFraction());
        double withdrawn = -router.modifyEnergy(parent, -transfer, EnergySources.ASEXUAL_REPRODUCTION);
        Fish child = createChild(parent, offspring.genome(), withdrawn, tick);

        if (submit(child, "trait_asexual")) {
            consumeCredits(ledger);
            log.debug("Trait birth {} from {} ({} energy)", child.toShortString(), parent.toShortString(),
                    String.format("%.1f", withdrawn));
            return true;
        }
        router.modifyEnergy(parent, withdrawn, EnergySources.REPRODUCTION_REFUND);
        ledger.setCooldown(previousCooldown);
        return false;
    }

    private Fish createChild(Fish parent, Genome genome, double energy, long tick) {
        Bounds bounds = world.getBounds();
        double x = bounds.clampX(parent.getX() + rng.nextDouble(-BIRTH_SCATTER, BIRTH_SCATTER));
        double y = bounds.clampY(parent.getY() + rng.nextDouble(-BIRTH_SCATTER, BIRTH_SCATTER));
        return factory.create(lifecycle.nextAgentId(), genome,
                parent.getGeneration() + 1, parent.getId(), parent.getSpecies(),
                x, y, energy, tick);
    }

    // ========== Emergency ==========

    private boolean shouldEmergencySpawn(int count, long tick) {
        if (count == 0) {
            return true;
        }
        if (count >= population.maxPopulation()) {
            return false;
        }
        if (tick - lastEmergencyTick < population.emergencyCooldown()) {
            return false;
        }
        return rng.nextDouble() < emergencyProbability(count);
    }

    /**
     * Chance of an emergency spawn at a given population: 1.0 below the
     * critical population, then falling off quadratically towards the cap.
     */
    public double emergencyProbability(int count) {
        int max = population.maxPopulation();
        int critical = population.criticalPopulation();
        if (count >= max) {
            return 0.0;
        }
        if (count < critical) {
            return 1.0;
        }
        double fraction = (double) (count - critical) / (max - critical);
        double remaining = 1.0 - fraction;
        return remaining * remaining * population.emergencyProbabilityScale();
    }

    private boolean spawnEmergency(List<Fish> snapshot, int count, long tick) {
        long previousEmergency = lastEmergencyTick;
        lastEmergencyTick = tick;

        Optional<Fish> template = healthiest(snapshot);
        Genome genome = emergencyGenome(template);
        int generation = template.map(Fish::getGeneration).orElse(0);
        double[] point = world.randomPoint(rng, population.spawnMargin());
        Fish spawn = factory.create(lifecycle.nextAgentId(), genome, generation, AgentIdentity.NO_PARENT,
                FishFactory.DEFAULT_SPECIES, point[0], point[1], factory.initialEnergy(genome), tick);

        if (submit(spawn, "emergency")) {
            if (count == 0) {
                log.info("Extinction at tick {}: emergency spawn {}", tick, spawn.toShortString());
            } else {
                log.debug("Emergency spawn {} (population {})", spawn.toShortString(), count);
            }
            return true;
        }
        lastEmergencyTick = previousEmergency;
        return false;
    }

    private static Optional<Fish> healthiest(List<Fish> snapshot) {
        return snapshot.stream()
                .filter(Fish::isActive)
                .max(Comparator.comparingDouble(f -> f.getEnergyLedger().getEnergyRatio()));
    }

    /**
     * Mutated clone of the template fish, else of the last registered
     * genome, else a fresh random genome. A clone keeps the template's generation.
     */
    private Genome emergencyGenome(Optional<Fish> template) {
        Optional<Genome> source = template
                .map(Fish::getGenome)
                .or(lifecycle::getLastRegisteredGenome);
        return source
                .map(g -> genetics.mutate(g, reproduction.mutationRate(), reproduction.mutationStrength(), rng))
                .orElseGet(() -> genetics.randomGenome(rng));
    }

    // ========== Post-interaction sexual ==========

    /**
     * Try a sexual birth after a minigame. Both parents pay
     * {@code parentContribution} of their current energy, scaled down so the
     * total never exceeds the baby's capacity.
     *
     * @return the queued offspring, or empty if any gate failed
     */
    public Optional<Fish> reproduceAfterInteraction(InteractionOutcome outcome, long tick) {
        if (outcome.tie()) {
            return Optional.empty();
        }
        Optional<Fish> winnerRef = lifecycle.findById(outcome.winnerId());
        Optional<Fish> mateRef = lifecycle.findById(outcome.loserId());
        if (winnerRef.isEmpty() || mateRef.isEmpty()) {
            return Optional.empty();
        }
        Fish winner = winnerRef.get();
        Fish mate = mateRef.get();

        String rejection = checkMating(winner, mate);
        if (rejection != null) {
            log.debug("No offspring from {} x {}: {}", winner.toShortString(), mate.toShortString(), rejection);
            return Optional.empty();
        }

        Genome mixed = genetics.crossover(winner.getGenome(), reproduction.winnerWeight(), mate.getGenome(), rng);
        Genome genome = genetics.mutate(mixed, reproduction.interactionMutationRate(),
                reproduction.interactionMutationStrength(), rng);

        double winnerShare = winner.getEnergy() * reproduction.parentContribution();
        double mateShare = mate.getEnergy() * reproduction.parentContribution();
        double capacity = factory.offspringMaxEnergy(genome);
        double total = winnerShare + mateShare;
        if (total > capacity) {
            double scale = capacity / total;
            winnerShare *= scale;
            mateShare *= scale;
        }

        double fromWinner = -router.modifyEnergy(winner, -winnerShare, EnergySources.SEXUAL_REPRODUCTION);
        double fromMate = -router.modifyEnergy(mate, -mateShare, EnergySources.SEXUAL_REPRODUCTION);

        Bounds bounds = world.getBounds();
        double jitter = reproduction.offspringJitter();
        double x = bounds.clampX((winner.getX() + mate.getX()) / 2 + rng.nextDouble(-jitter, jitter));
        double y = bounds.clampY((winner.getY() + mate.getY()) / 2 + rng.nextDouble(-jitter, jitter));
        int generation = Math.max(winner.getGeneration(), mate.getGeneration()) + 1;
        Fish child = factory.create(lifecycle.nextAgentId(), genome, generation, winner.getId(),
                winner.getSpecies(), x, y, fromWinner + fromMate, tick);

        if (!submit(child, "sexual_" + outcome.game())) {
            router.modifyEnergy(winner, fromWinner, EnergySources.REPRODUCTION_REFUND);
            router.modifyEnergy(mate, fromMate, EnergySources.REPRODUCTION_REFUND);
            failedSpawns++;
            return Optional.empty();
        }

        winner.getReproductionLedger().startCooldown();
        mate.getReproductionLedger().startCooldown();
        consumeCredits(winner.getReproductionLedger());
        sexualBirths++;
        log.debug("Sexual birth {} from {} x {} after {}", child.toShortString(),
                winner.toShortString(), mate.toShortString(), outcome.game());
        return Optional.of(child);
    }

    /**
     * @return why the pair cannot mate, or null if it can
     */
    private String checkMating(Fish winner, Fish mate) {
        if (!winner.isActive() || !mate.isActive()) {
            return "not active";
        }
        if (!winner.getSpecies().equals(mate.getSpecies())) {
            return "different species";
        }
        if (!hasCredits(winner.getReproductionLedger())) {
            return "no credits";
        }
        if (!readyToMate(winner) || !readyToMate(mate)) {
            return "parent not ready";
        }
        double distance = reproduction.matingDistance();
        if (winner.distanceSquaredTo(mate) > distance * distance) {
            return "too far apart";
        }
        if (lifecycle.getLiveAgents().size() + lifecycle.pendingSpawnCount() >= population.maxPopulation()) {
            return "population full";
        }
        return null;
    }

    private boolean readyToMate(Fish fish) {
        return fish.getStage() == LifeStage.ADULT
                && fish.getReproductionLedger().getCooldown() == 0
                && fish.getEnergy() >= fish.getMaxEnergy() * reproduction.interactionEnergyRatio();
    }

    // ========== Shared ==========

    private boolean hasCredits(ReproductionLedger ledger) {
        return !reproduction.creditsEnabled() || ledger.hasReproCredits(reproduction.creditsRequired());
    }

    private void consumeCredits(ReproductionLedger ledger) {
        if (reproduction.creditsEnabled()) {
            ledger.consumeReproCredits(reproduction.creditsRequired());
        }
    }

    private boolean submit(Fish child, String reason) {
        try {
            return lifecycle.requestSpawn(child, reason);
        } catch (RuntimeException e) {
            log.warn("Spawn request for {} ({}) failed: {}", child.toShortString(), reason, e.getMessage());
            return false;
        }
    }

    // ========== Getters ==========

    public long getLastEmergencyTick() {
        return lastEmergencyTick;
    }

    /**
     * Restore the emergency cooldown clock.
     */
    public void setLastEmergencyTick(long tick) {
        this.lastEmergencyTick = tick;
    }

    public int getBankedBirths() {
        return bankedBirths;
    }

    public int getTraitBirths() {
        return traitBirths;
    }

    public int getSexualBirths() {
        return sexualBirths;
    }

    public int getEmergencySpawns() {
        return emergencySpawns;
    }

    public int getFailedSpawns() {
        return failedSpawns;
    }

    @Override
    public String toString() {
        return String.format("Reproduction[banked=%d, trait=%d, sexual=%d, emergency=%d, failed=%d]",
                bankedBirths, traitBirths, sexualBirths, emergencySpawns, failedSpawns);
    }
}
