package io.github.manjago.tidepool.persistence;

import io.github.manjago.tidepool.agent.Fish;
import io.github.manjago.tidepool.agent.FishFactory;
import io.github.manjago.tidepool.agent.Food;
import io.github.manjago.tidepool.agent.Genome;
import io.github.manjago.tidepool.config.SimulatorConfig;
import io.github.manjago.tidepool.core.GameRng;
import io.github.manjago.tidepool.sim.Population;
import io.github.manjago.tidepool.sim.Simulator;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checkpoint storage using H2 MVStore.
 *
 * Structure:
 * - "meta" map: metadata (version, tick, seed, counters, id allocators)
 * - "config" map: population cap and tank size
 * - "rng" map: RNG state bytes
 * - "agents" map: one {@link AgentRecord} per fish
 * - "food" map: food items lying in the tank
 * - "lineage" map: last registered genome, the fallback for emergency spawns
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private static final int VERSION = 1;

    // Meta keys
    private static final String KEY_VERSION = "version";
    private static final String KEY_TICK = "tick";
    private static final String KEY_SEED = "seed";
    private static final String KEY_AGENT_COUNT = "agent_count";
    private static final String KEY_EXTINCTIONS = "extinctions";
    private static final String KEY_NEXT_AGENT_ID = "next_agent_id";
    private static final String KEY_NEXT_FOOD_ID = "next_food_id";
    private static final String KEY_LAST_EMERGENCY_TICK = "last_emergency_tick";

    // Config keys
    private static final String KEY_MAX_POPULATION = "max_population";
    private static final String KEY_CRITICAL_POPULATION = "critical_population";
    private static final String KEY_WORLD_WIDTH = "world_width";
    private static final String KEY_WORLD_HEIGHT = "world_height";

    private static final String KEY_LAST_GENOME = "last";

    private CheckpointStore() {
    }

    /**
     * Save checkpoint to MVStore file. Call between ticks.
     */
    public static void save(Simulator sim, Path path) throws IOException {
        log.info("Saving checkpoint to {} (MVStore)", path);

        // RNG state first, before anything else can draw from it
        GameRng.GameRngState rngState = sim.getGameRng().saveState();
        Population population = sim.getPopulation();
        List<Fish> fish = population.getAll();

        try (MVStore store = new MVStore.Builder()
                .fileName(path.toString())
                .compress()
                .open()) {

            MVMap<String, Long> meta = store.openMap("meta");
            meta.put(KEY_VERSION, (long) VERSION);
            meta.put(KEY_TICK, sim.getTick());
            meta.put(KEY_SEED, sim.getActualSeed());
            meta.put(KEY_AGENT_COUNT, (long) fish.size());
            meta.put(KEY_EXTINCTIONS, (long) sim.getExtinctions());
            meta.put(KEY_NEXT_AGENT_ID, (long) population.peekNextAgentId());
            meta.put(KEY_NEXT_FOOD_ID, (long) population.peekNextFoodId());
            meta.put(KEY_LAST_EMERGENCY_TICK, sim.getOrchestrator().getLastEmergencyTick());

            MVMap<String, String> config = store.openMap("config");
            SimulatorConfig cfg = sim.getConfig();
            config.put(KEY_MAX_POPULATION, String.valueOf(cfg.population().maxPopulation()));
            config.put(KEY_CRITICAL_POPULATION, String.valueOf(cfg.population().criticalPopulation()));
            config.put(KEY_WORLD_WIDTH, String.valueOf(cfg.worldWidth()));
            config.put(KEY_WORLD_HEIGHT, String.valueOf(cfg.worldHeight()));

            MVMap<String, byte[]> rng = store.openMap("rng");
            rng.put("state", rngState.toBytes());

            MVMap<Integer, byte[]> agents = store.openMap("agents");
            agents.clear();
            for (Fish f : fish) {
                agents.put(f.getId(), AgentRecord.of(f).toBytes());
            }

            MVMap<Integer, byte[]> food = store.openMap("food");
            food.clear();
            for (Food item : population.getFood()) {
                food.put(item.getId(), serializeFood(item));
            }

            MVMap<String, byte[]> lineage = store.openMap("lineage");
            lineage.clear();
            population.getLastRegisteredGenome()
                    .ifPresent(g -> lineage.put(KEY_LAST_GENOME, serializeGenome(g)));

            store.commit();
        }

        log.info("Checkpoint saved: tick {}, {} fish", sim.getTick(), fish.size());
    }

    /**
     * Load checkpoint data from MVStore file.
     *
     * @throws IOException if the file is from an unsupported version or a record is corrupt
     */
    public static CheckpointData load(Path path) throws IOException {
        log.info("Loading checkpoint from {} (MVStore)", path);

        try (MVStore store = MVStore.open(path.toString())) {

            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            if (version < 1 || version > VERSION) {
                throw new IOException("Unsupported checkpoint version: " + version);
            }

            long tick = meta.getOrDefault(KEY_TICK, 0L);
            long seed = meta.getOrDefault(KEY_SEED, 0L);
            int extinctions = meta.getOrDefault(KEY_EXTINCTIONS, 0L).intValue();
            int nextAgentId = meta.getOrDefault(KEY_NEXT_AGENT_ID, 0L).intValue();
            int nextFoodId = meta.getOrDefault(KEY_NEXT_FOOD_ID, 0L).intValue();
            long lastEmergencyTick = meta.getOrDefault(KEY_LAST_EMERGENCY_TICK, Long.MIN_VALUE / 2);

            MVMap<String, String> configMap = store.openMap("config");
            int maxPopulation = Integer.parseInt(configMap.getOrDefault(KEY_MAX_POPULATION, "60"));
            int criticalPopulation = Integer.parseInt(configMap.getOrDefault(KEY_CRITICAL_POPULATION, "5"));
            double worldWidth = Double.parseDouble(configMap.getOrDefault(KEY_WORLD_WIDTH, "1088.0"));
            double worldHeight = Double.parseDouble(configMap.getOrDefault(KEY_WORLD_HEIGHT, "612.0"));

            MVMap<String, byte[]> rngMap = store.openMap("rng");
            byte[] rngBytes = rngMap.get("state");
            GameRng.GameRngState rngState = rngBytes != null
                ? GameRng.GameRngState.fromBytes(rngBytes)
                : null;

            MVMap<Integer, byte[]> agentsMap = store.openMap("agents");
            List<AgentRecord> agents = new ArrayList<>();
            for (Integer id : agentsMap.keySet()) {
                byte[] data = agentsMap.get(id);
                if (data != null) {
                    agents.add(AgentRecord.fromBytes(data));
                }
            }

            MVMap<Integer, byte[]> foodMap = store.openMap("food");
            List<Food> food = new ArrayList<>();
            for (Integer id : foodMap.keySet()) {
                byte[] data = foodMap.get(id);
                if (data != null) {
                    food.add(deserializeFood(data));
                }
            }

            MVMap<String, byte[]> lineage = store.openMap("lineage");
            byte[] genomeBytes = lineage.get(KEY_LAST_GENOME);
            Genome lastGenome = genomeBytes != null ? deserializeGenome(genomeBytes) : null;

            log.info("Checkpoint loaded: tick {}, {} fish, {} food (v{})",
                tick, agents.size(), food.size(), version);

            return new CheckpointData(
                version, tick, seed, rngState, agents, food, lastGenome,
                extinctions, nextAgentId, nextFoodId, lastEmergencyTick,
                maxPopulation, criticalPopulation, worldWidth, worldHeight
            );
        }
    }

    /**
     * Restore Simulator from checkpoint.
     *
     * @param path checkpoint file
     * @param configOverride optional config override (null = defaults plus checkpoint values)
     * @return restored Simulator ready to run
     */
    public static Simulator restore(Path path, SimulatorConfig configOverride) throws IOException {
        CheckpointData data = load(path);

        SimulatorConfig config;
        if (configOverride != null) {
            config = configOverride;
        } else {
            config = SimulatorConfig.builder()
                    .maxPopulation(data.maxPopulation(), data.criticalPopulation())
                    .worldSize(data.worldWidth(), data.worldHeight())
                    .seed(data.seed())
                    .build();
        }

        GameRng rng;
        if (data.hasDeterministicRng()) {
            rng = GameRng.restore(data.rngState());
            log.info("Restored RNG state from checkpoint (deterministic resume)");
        } else {
            rng = new GameRng(data.seed());
            log.warn("Checkpoint has no RNG state - resume will NOT be deterministic!");
        }

        Simulator sim = new Simulator(config, rng);
        FishFactory factory = sim.getFactory();

        List<Fish> fish = new ArrayList<>(data.agents().size());
        for (AgentRecord record : data.agents()) {
            fish.add(record.toFish(factory, data.tick()));
        }
        sim.getPopulation().restore(fish, data.food(), data.nextAgentId(), data.nextFoodId(), data.lastGenome());
        sim.restoreState(data.tick(), data.extinctions(), data.lastEmergencyTick());

        log.info("Simulator restored: tick {}, {} fish", data.tick(), fish.size());
        return sim;
    }

    /**
     * Check if file is a valid checkpoint.
     */
    public static boolean isValidCheckpoint(Path path) {
        try (MVStore store = MVStore.open(path.toString())) {
            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            return version >= 1 && version <= VERSION;
        } catch (RuntimeException e) {
            log.debug("Not a checkpoint: {} ({})", path, e.getMessage());
            return false;
        }
    }

    /**
     * Get checkpoint info without full load.
     */
    public static String getInfo(Path path) {
        try (MVStore store = MVStore.open(path.toString())) {
            MVMap<String, Long> meta = store.openMap("meta");

            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            long tick = meta.getOrDefault(KEY_TICK, 0L);
            long seed = meta.getOrDefault(KEY_SEED, 0L);
            int agentCount = meta.getOrDefault(KEY_AGENT_COUNT, 0L).intValue();
            int extinctions = meta.getOrDefault(KEY_EXTINCTIONS, 0L).intValue();

            MVMap<String, byte[]> rngMap = store.openMap("rng");
            boolean hasRng = rngMap.get("state") != null;

            return String.format(
                "Checkpoint v%d: %,d ticks, %d fish, %d extinctions, seed=%d%s",
                version, tick, agentCount, extinctions, seed,
                hasRng ? " (deterministic)" : " (non-deterministic)"
            );
        } catch (RuntimeException e) {
            return "Invalid checkpoint: " + e.getMessage();
        }
    }

    // ========== Private helpers ==========

    private static byte[] serializeFood(Food item) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(baos)) {
            out.writeInt(item.getId());
            out.writeDouble(item.getX());
            out.writeDouble(item.getY());
            out.writeDouble(item.getEnergy());
            out.writeLong(item.getCreatedTick());
            out.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Food deserializeFood(byte[] data) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            int id = in.readInt();
            double x = in.readDouble();
            double y = in.readDouble();
            double energy = in.readDouble();
            long createdTick = in.readLong();
            return new Food(id, x, y, energy, createdTick);
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt food record: " + e.getMessage(), e);
        }
    }

    private static byte[] serializeGenome(Genome genome) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(baos)) {
            AgentRecord.writeGenome(out, genome);
            out.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Genome deserializeGenome(byte[] data) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            return AgentRecord.readGenome(in);
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt genome record: " + e.getMessage(), e);
        }
    }

    // ========== Data classes ==========

    /**
     * Loaded checkpoint data.
     */
    public record CheckpointData(
        int version,
        long tick,
        long seed,
        GameRng.GameRngState rngState,
        List<AgentRecord> agents,
        List<Food> food,
        Genome lastGenome,          // null if nothing was ever registered
        int extinctions,
        int nextAgentId,
        int nextFoodId,
        long lastEmergencyTick,
        int maxPopulation,
        int criticalPopulation,
        double worldWidth,
        double worldHeight
    ) {
        public boolean hasDeterministicRng() {
            return rngState != null;
        }
    }
}
