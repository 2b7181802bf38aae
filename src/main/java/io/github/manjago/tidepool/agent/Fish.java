package io.github.manjago.tidepool.agent;

/**
 * A fish living in the tank.
 *
 * Each fish has:
 * - An identity (id, generation, parent id, species)
 * - A genome that seeded its ledgers
 * - Its own energy, lifecycle, reproduction and mortality components
 * - A position and velocity, driven by code outside this core
 *
 * The components are created together with the fish and never shared.
 */
public class Fish implements EnergyHolder, Mortal, Reproducible, LifecycleAware, Positioned {

    private final AgentIdentity identity;
    private final Genome genome;
    private final long birthTick;

    private final EnergyLedger energy;
    private final LifecycleStateMachine lifecycle;
    private final ReproductionLedger reproduction;
    private final Mortality mortality;

    private double x;
    private double y;
    private double vx;
    private double vy;

    /**
     * Assemble a fish from freshly built components.
     *
     * @param identity     id, generation, parent id and species
     * @param genome       genome the components were seeded from
     * @param birthTick    tick when the fish was created
     */
    public Fish(AgentIdentity identity, Genome genome, long birthTick,
                EnergyLedger energy, LifecycleStateMachine lifecycle,
                ReproductionLedger reproduction, Mortality mortality,
                double x, double y) {
        this.identity = identity;
        this.genome = genome;
        this.birthTick = birthTick;
        this.energy = energy;
        this.lifecycle = lifecycle;
        this.reproduction = reproduction;
        this.mortality = mortality;
        this.x = x;
        this.y = y;
    }

    // ========== Getters ==========

    public int getId() {
        return identity.id();
    }

    public AgentIdentity getIdentity() {
        return identity;
    }

    public int getParentId() {
        return identity.parentId();
    }

    public int getGeneration() {
        return identity.generation();
    }

    public String getSpecies() {
        return identity.species();
    }

    public Genome getGenome() {
        return genome;
    }

    public long getBirthTick() {
        return birthTick;
    }

    @Override
    public EnergyLedger getEnergyLedger() {
        return energy;
    }

    @Override
    public LifecycleStateMachine getLifecycle() {
        return lifecycle;
    }

    @Override
    public ReproductionLedger getReproductionLedger() {
        return reproduction;
    }

    @Override
    public Mortality getMortality() {
        return mortality;
    }

    // ========== Shortcuts ==========

    public double getEnergy() {
        return energy.getEnergy();
    }

    public double getMaxEnergy() {
        return energy.getMaxEnergy();
    }

    public LifeStage getStage() {
        return lifecycle.getStage();
    }

    public int getAge() {
        return lifecycle.getAge();
    }

    public boolean isActive() {
        return mortality.isActive();
    }

    /**
     * Resolved cause of death, or an {@code unknown_} tag.
     */
    public String describeDeathCause() {
        return mortality.describeDeathCause(energy.getEnergy(), lifecycle.getAge(), lifecycle.getMaxAge());
    }

    // ========== Motion ==========

    @Override
    public double getX() {
        return x;
    }

    @Override
    public double getY() {
        return y;
    }

    public void moveTo(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void setVelocity(double vx, double vy) {
        this.vx = vx;
        this.vy = vy;
    }

    public double getSpeed() {
        return Math.hypot(vx, vy);
    }

    /**
     * Squared distance to another positioned thing.
     */
    public double distanceSquaredTo(Positioned other) {
        double dx = other.getX() - x;
        double dy = other.getY() - y;
        return dx * dx + dy * dy;
    }

    // ========== Object methods ==========

    @Override
    public String toString() {
        return String.format("Fish#%d[gen=%d, parent=%d, %s, %s, %s]",
                identity.id(), identity.generation(), identity.parentId(),
                lifecycle.getStage().label(), energy, mortality);
    }

    /**
     * Short string representation for lists.
     */
    public String toShortString() {
        return String.format("#%d[%s]", identity.id(), lifecycle.getStage().label());
    }
}
