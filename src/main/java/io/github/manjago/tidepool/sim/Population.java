package io.github.manjago.tidepool.sim;

import io.github.manjago.tidepool.agent.Fish;
import io.github.manjago.tidepool.agent.Food;
import io.github.manjago.tidepool.agent.Genome;
import io.github.manjago.tidepool.energy.FoodSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Registry of the fish and food in the tank.
 *
 * Fish spawns and removals are deferred: requests made during a tick are
 * buffered and applied in one {@link #commitTick} batch. Food appears
 * immediately since nothing iterates it during the agent sweep.
 *
 * Fish reference each other by id only; {@link #findById} resolves them.
 */
public class Population implements EntityLifecycle, FoodSink {

    private static final Logger log = LoggerFactory.getLogger(Population.class);

    /**
     * A fish leaving the registry and why.
     */
    public record Removal(Fish fish, String reason) {
    }

    /**
     * What one {@link #commitTick} applied.
     */
    public record TickCommit(List<Fish> spawned, List<Removal> removed) {

        public boolean isEmpty() {
            return spawned.isEmpty() && removed.isEmpty();
        }
    }

    private final int maxPopulation;

    // Registration order, for stable snapshots
    private final Map<Integer, Fish> fish = new LinkedHashMap<>();

    private final List<Fish> pendingSpawns = new ArrayList<>();
    private final Map<Integer, Removal> pendingRemovals = new LinkedHashMap<>();

    private final List<Food> food = new ArrayList<>();

    private final Map<String, Integer> removalsByCause = new TreeMap<>();

    private int nextAgentId = 0;
    private int nextFoodId = 0;
    private long currentTick = 0;
    private Genome lastRegisteredGenome;

    // Statistics
    private int totalSpawns = 0;
    private int rejectedSpawns = 0;
    private int totalRemovals = 0;
    private int maxAlive = 0;

    /**
     * @param maxPopulation hard cap on active plus pending fish
     */
    public Population(int maxPopulation) {
        if (maxPopulation <= 0) {
            throw new IllegalArgumentException("maxPopulation must be positive: " + maxPopulation);
        }
        this.maxPopulation = maxPopulation;
    }

    /**
     * Set the tick used to stamp food.
     */
    public void beginTick(long tick) {
        this.currentTick = tick;
    }

    // ========== EntityLifecycle ==========

    @Override
    public boolean requestSpawn(Fish newborn, String reason) {
        if (newborn == null) {
            log.warn("Attempted to spawn null fish");
            return false;
        }
        if (fish.containsKey(newborn.getId()) || isPendingSpawn(newborn.getId())) {
            log.warn("Rejected spawn of {}: id already in use", newborn.toShortString());
            rejectedSpawns++;
            return false;
        }
        if (getActiveCount() + pendingSpawns.size() >= maxPopulation) {
            log.debug("Rejected spawn of {} ({}): population full", newborn.toShortString(), reason);
            rejectedSpawns++;
            return false;
        }
        pendingSpawns.add(newborn);
        log.debug("Queued spawn {} ({})", newborn.toShortString(), reason);
        return true;
    }

    @Override
    public boolean requestRemove(Fish leaving, String reason) {
        if (leaving == null || !fish.containsKey(leaving.getId())) {
            return false;
        }
        if (pendingRemovals.containsKey(leaving.getId())) {
            return false;
        }
        pendingRemovals.put(leaving.getId(), new Removal(leaving, reason));
        return true;
    }

    @Override
    public List<Fish> getLiveAgents() {
        List<Fish> live = new ArrayList<>(fish.size());
        for (Fish f : fish.values()) {
            if (f.isActive()) {
                live.add(f);
            }
        }
        return live;
    }

    @Override
    public int pendingSpawnCount() {
        return pendingSpawns.size();
    }

    @Override
    public int nextAgentId() {
        return nextAgentId++;
    }

    @Override
    public Optional<Fish> findById(int id) {
        return Optional.ofNullable(fish.get(id));
    }

    @Override
    public Optional<Genome> getLastRegisteredGenome() {
        return Optional.ofNullable(lastRegisteredGenome);
    }

    // ========== Commit ==========

    /**
     * Apply all queued removals, then all queued spawns.
     *
     * @param tick tick being finished, recorded in the mortal state history
     */
    public TickCommit commitTick(long tick) {
        if (pendingSpawns.isEmpty() && pendingRemovals.isEmpty()) {
            return new TickCommit(List.of(), List.of());
        }

        List<Removal> removed = new ArrayList<>(pendingRemovals.values());
        pendingRemovals.clear();
        for (Removal removal : removed) {
            Fish leaving = removal.fish();
            leaving.getMortality().markRemoved(tick);
            fish.remove(leaving.getId());
            totalRemovals++;
            removalsByCause.merge(leaving.describeDeathCause(), 1, Integer::sum);
            log.debug("Removed {} ({}, {})", leaving.toShortString(), removal.reason(), leaving.describeDeathCause());
        }

        List<Fish> spawned = new ArrayList<>(pendingSpawns);
        pendingSpawns.clear();
        for (Fish newborn : spawned) {
            register(newborn);
            totalSpawns++;
        }

        maxAlive = Math.max(maxAlive, getActiveCount());
        return new TickCommit(spawned, removed);
    }

    private void register(Fish newborn) {
        fish.put(newborn.getId(), newborn);
        lastRegisteredGenome = newborn.getGenome();
        if (newborn.getId() >= nextAgentId) {
            nextAgentId = newborn.getId() + 1;
        }
    }

    private boolean isPendingSpawn(int id) {
        for (Fish f : pendingSpawns) {
            if (f.getId() == id) {
                return true;
            }
        }
        return false;
    }

    // ========== Food ==========

    @Override
    public Food spawnFood(double x, double y, double energy) {
        Food item = new Food(nextFoodId++, x, y, energy, currentTick);
        food.add(item);
        return item;
    }

    /**
     * Take a food item out of the tank.
     *
     * @return false if it was already eaten
     */
    public boolean takeFood(Food item) {
        return food.remove(item);
    }

    public List<Food> getFood() {
        return new ArrayList<>(food);
    }

    public double getFoodEnergy() {
        return food.stream().mapToDouble(Food::getEnergy).sum();
    }

    // ========== Restore ==========

    /**
     * Replace the whole registry with restored content. Pending requests are dropped.
     */
    public void restore(Collection<Fish> restoredFish, Collection<Food> restoredFood,
                        int nextAgentId, int nextFoodId, Genome lastGenome) {
        fish.clear();
        food.clear();
        pendingSpawns.clear();
        pendingRemovals.clear();
        for (Fish f : restoredFish) {
            fish.put(f.getId(), f);
        }
        food.addAll(restoredFood);
        this.nextAgentId = nextAgentId;
        this.nextFoodId = nextFoodId;
        this.lastRegisteredGenome = lastGenome;
        this.maxAlive = Math.max(maxAlive, getActiveCount());
        log.info("Restored {} fish and {} food", fish.size(), food.size());
    }

    // ========== Getters ==========

    /**
     * All registered fish, including dead ones not yet removed.
     */
    public List<Fish> getAll() {
        return new ArrayList<>(fish.values());
    }

    public int getActiveCount() {
        int count = 0;
        for (Fish f : fish.values()) {
            if (f.isActive()) {
                count++;
            }
        }
        return count;
    }

    public int getMaxPopulation() {
        return maxPopulation;
    }

    public int getTotalSpawns() {
        return totalSpawns;
    }

    public int getRejectedSpawns() {
        return rejectedSpawns;
    }

    public int getTotalRemovals() {
        return totalRemovals;
    }

    public int getMaxAlive() {
        return maxAlive;
    }

    public int peekNextAgentId() {
        return nextAgentId;
    }

    public int peekNextFoodId() {
        return nextFoodId;
    }

    /**
     * Removals so far, by resolved cause label.
     */
    public Map<String, Integer> getRemovalsByCause() {
        return new TreeMap<>(removalsByCause);
    }

    @Override
    public String toString() {
        return String.format("Population[active=%d, registered=%d, pending=%d/%d, food=%d]",
                getActiveCount(), fish.size(), pendingSpawns.size(), pendingRemovals.size(), food.size());
    }
}
