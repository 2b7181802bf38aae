package io.github.manjago.tidepool.persistence;

import io.github.manjago.tidepool.agent.AgentIdentity;
import io.github.manjago.tidepool.agent.DeathCause;
import io.github.manjago.tidepool.agent.EnergyLedger;
import io.github.manjago.tidepool.agent.EntityState;
import io.github.manjago.tidepool.agent.Fish;
import io.github.manjago.tidepool.agent.FishFactory;
import io.github.manjago.tidepool.agent.Genome;
import io.github.manjago.tidepool.agent.LifeStage;
import io.github.manjago.tidepool.agent.LifecycleStateMachine;
import io.github.manjago.tidepool.agent.Mortality;
import io.github.manjago.tidepool.agent.ReproductionLedger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Flat, versioned per-fish record.
 *
 * Holds exactly what is needed to rebuild the components directly; state
 * machine history is not stored.
 */
public record AgentRecord(
    int id,
    int generation,
    int parentId,
    String species,
    Genome genome,
    long birthTick,
    double x,
    double y,
    double energy,
    double maxEnergy,
    double baseMetabolism,
    int age,
    LifeStage stage,
    int cooldown,
    double overflowBank,
    double reproCredits,
    EntityState state,
    DeathCause cause,            // null when none recorded
    int lastPredatorEncounterAge
) {

    public static final int VERSION = 1;

    /**
     * Capture a fish.
     */
    public static AgentRecord of(Fish fish) {
        EnergyLedger energy = fish.getEnergyLedger();
        LifecycleStateMachine lifecycle = fish.getLifecycle();
        ReproductionLedger reproduction = fish.getReproductionLedger();
        Mortality mortality = fish.getMortality();
        return new AgentRecord(
            fish.getId(),
            fish.getGeneration(),
            fish.getParentId(),
            fish.getSpecies(),
            fish.getGenome(),
            fish.getBirthTick(),
            fish.getX(),
            fish.getY(),
            energy.getEnergy(),
            energy.getMaxEnergy(),
            energy.getBaseMetabolism(),
            lifecycle.getAge(),
            lifecycle.getStage(),
            reproduction.getCooldown(),
            reproduction.getOverflowBank(),
            reproduction.getReproCredits(),
            mortality.getState(),
            mortality.getRecordedCause(),
            mortality.getLastPredatorEncounterAge()
        );
    }

    /**
     * Rebuild the fish from the stored fields.
     *
     * @param tick tick of the restore, for forced-state history
     */
    public Fish toFish(FishFactory factory, long tick) {
        LifecycleStateMachine lifecycle = factory.newLifecycle(genome);
        lifecycle.restore(stage, age, tick);

        EnergyLedger energyLedger = factory.newEnergyLedger(maxEnergy, baseMetabolism, energy);

        ReproductionLedger reproduction = factory.newReproductionLedger();
        reproduction.restore(cooldown, overflowBank, reproCredits);

        Mortality mortality = factory.newMortality();
        mortality.restore(state, cause, lastPredatorEncounterAge, tick);

        return new Fish(new AgentIdentity(id, generation, parentId, species), genome, birthTick,
                energyLedger, lifecycle, reproduction, mortality, x, y);
    }

    // ========== Serialization ==========

    public byte[] toBytes() {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(baos)) {

            out.writeInt(VERSION);
            out.writeInt(id);
            out.writeInt(generation);
            out.writeInt(parentId);
            out.writeUTF(species);
            writeGenome(out, genome);
            out.writeLong(birthTick);
            out.writeDouble(x);
            out.writeDouble(y);

            out.writeDouble(energy);
            out.writeDouble(maxEnergy);
            out.writeDouble(baseMetabolism);

            out.writeInt(age);
            out.writeUTF(stage.name());

            out.writeInt(cooldown);
            out.writeDouble(overflowBank);
            out.writeDouble(reproCredits);

            out.writeUTF(state.name());
            out.writeBoolean(cause != null);
            if (cause != null) {
                out.writeUTF(cause.label());
            }
            out.writeInt(lastPredatorEncounterAge);

            out.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @throws IOException if the bytes are truncated or from an unsupported version
     */
    public static AgentRecord fromBytes(byte[] data) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            int version = in.readInt();
            if (version < 1 || version > VERSION) {
                throw new IOException("Unsupported agent record version: " + version);
            }
            int id = in.readInt();
            int generation = in.readInt();
            int parentId = in.readInt();
            String species = in.readUTF();
            Genome genome = readGenome(in);
            long birthTick = in.readLong();
            double x = in.readDouble();
            double y = in.readDouble();

            double energy = in.readDouble();
            double maxEnergy = in.readDouble();
            double baseMetabolism = in.readDouble();

            int age = in.readInt();
            LifeStage stage = LifeStage.valueOf(in.readUTF());

            int cooldown = in.readInt();
            double overflowBank = in.readDouble();
            double reproCredits = in.readDouble();

            EntityState state = EntityState.valueOf(in.readUTF());
            DeathCause cause = null;
            if (in.readBoolean()) {
                String label = in.readUTF();
                cause = DeathCause.fromLabel(label);
                if (cause == null) {
                    throw new IOException("Unknown death cause: " + label);
                }
            }
            int lastPredatorEncounterAge = in.readInt();

            return new AgentRecord(id, generation, parentId, species, genome, birthTick, x, y,
                    energy, maxEnergy, baseMetabolism, age, stage, cooldown, overflowBank, reproCredits,
                    state, cause, lastPredatorEncounterAge);
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt agent record: " + e.getMessage(), e);
        }
    }

    static void writeGenome(DataOutputStream out, Genome genome) throws IOException {
        out.writeDouble(genome.sizeModifier());
        out.writeDouble(genome.lifespanModifier());
        out.writeDouble(genome.metabolismModifier());
        out.writeDouble(genome.asexualChance());
    }

    static Genome readGenome(DataInputStream in) throws IOException {
        return new Genome(in.readDouble(), in.readDouble(), in.readDouble(), in.readDouble());
    }
}
