package io.github.manjago.tidepool.energy;

import io.github.manjago.tidepool.agent.EnergyHolder;
import io.github.manjago.tidepool.agent.EnergyLedger;
import io.github.manjago.tidepool.agent.Mortal;
import io.github.manjago.tidepool.agent.Mortality;
import io.github.manjago.tidepool.agent.Positioned;
import io.github.manjago.tidepool.agent.Reproducible;
import io.github.manjago.tidepool.config.EnergySettings;
import io.github.manjago.tidepool.core.Bounds;
import io.github.manjago.tidepool.core.GameRng;
import io.github.manjago.tidepool.core.SpatialWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

/**
 * The one place where agent energy changes.
 *
 * Feeding, metabolism, combat, minigame results and reproduction transfers
 * all arrive here as a signed delta with a source tag.
 *
 * Gains that do not fit are never destroyed: the excess goes to the overflow
 * bank of a {@link Reproducible} agent up to {@code maxEnergy × bankMultiplier},
 * and what is left becomes food next to the agent. Losses bottom out at zero,
 * and reaching zero publishes an energy-depleted event to the agent's
 * {@link Mortality}, the only way starvation happens.
 */
public class EnergyDeltaRouter {

    private static final Logger log = LoggerFactory.getLogger(EnergyDeltaRouter.class);

    /** Spilled food lands within this distance of the agent on each axis. */
    static final double SPILL_SCATTER = 10.0;

    private final EnergySettings settings;
    private final SpatialWorld world;
    private final FoodSink foodSink;
    private final EnergyAccounting accounting;
    private final GameRng rng;
    private final LongSupplier clock;

    /**
     * @param clock current tick, used for state history
     */
    public EnergyDeltaRouter(EnergySettings settings,
                             SpatialWorld world,
                             FoodSink foodSink,
                             EnergyAccounting accounting,
                             GameRng rng,
                             LongSupplier clock) {
        this.settings = settings;
        this.world = world;
        this.foodSink = foodSink;
        this.accounting = accounting != null ? accounting : EnergyAccounting.NOOP;
        this.rng = rng;
        this.clock = clock;
    }

    /**
     * Apply a delta.
     *
     * @return change actually committed to the ledger; a cross-agent transfer
     *         should move exactly this much
     * @throws IllegalArgumentException if the amount is NaN or infinite
     */
    public double modifyEnergy(EnergyHolder agent, double amount, String source) {
        return modifyEnergyDetailed(agent, amount, source).applied();
    }

    /**
     * Apply a delta and report where every part of it went.
     *
     * @throws IllegalArgumentException if the amount is NaN or infinite
     */
    public EnergyChange modifyEnergyDetailed(EnergyHolder agent, double amount, String source) {
        if (!Double.isFinite(amount)) {
            throw new IllegalArgumentException("Energy delta must be finite: " + amount + " (" + source + ")");
        }
        EnergyLedger ledger = agent.getEnergyLedger();
        EnergyChange change = amount > 0
                ? applyGain(agent, ledger, amount)
                : applyLoss(agent, ledger, amount);

        report(source, change.applied());
        report(EnergySources.OVERFLOW_BANK, change.banked());
        report(EnergySources.OVERFLOW_FOOD, change.spilled());
        report(EnergySources.OVERFLOW_LOST, change.lost());
        return change;
    }

    private EnergyChange applyGain(EnergyHolder agent, EnergyLedger ledger, double amount) {
        double before = ledger.getEnergy();
        double max = ledger.getMaxEnergy();
        double room = max - before;

        if (amount <= room) {
            ledger.commit(Math.min(max, before + amount));
            energyRestored(agent);
            return EnergyChange.direct(amount, amount);
        }

        ledger.commit(max);
        energyRestored(agent);
        double excess = amount - room;

        double banked = 0.0;
        if (agent instanceof Reproducible reproducible) {
            banked = reproducible.getReproductionLedger()
                    .bankOverflow(excess, max * settings.bankMultiplier());
        }

        double remainder = excess - banked;
        double spilled = 0.0;
        double lost = 0.0;
        if (remainder > 0) {
            if (spill(agent, remainder)) {
                spilled = remainder;
            } else {
                lost = remainder;
            }
        }
        return new EnergyChange(amount, room, banked, spilled, lost);
    }

    private EnergyChange applyLoss(EnergyHolder agent, EnergyLedger ledger, double amount) {
        double before = ledger.getEnergy();
        double after = Math.max(0.0, before + amount);
        ledger.commit(after);

        if (after == 0.0) {
            if (agent instanceof Mortal mortal && mortal.getMortality().onEnergyDepleted(clock.getAsLong())) {
                log.debug("{} starved", agent);
            }
        } else {
            energyRestored(agent);
        }
        return EnergyChange.direct(amount, after - before);
    }

    private static void energyRestored(EnergyHolder agent) {
        if (agent instanceof Mortal mortal) {
            mortal.getMortality().onEnergyRestored();
        }
    }

    /**
     * Turn energy into food near the agent.
     *
     * @return false if the food sink failed
     */
    private boolean spill(EnergyHolder agent, double energy) {
        Bounds bounds = world.getBounds();
        double x;
        double y;
        if (agent instanceof Positioned positioned) {
            x = positioned.getX();
            y = positioned.getY();
        } else {
            x = (bounds.minX() + bounds.maxX()) / 2;
            y = (bounds.minY() + bounds.maxY()) / 2;
        }
        x = bounds.clampX(x + rng.nextDouble(-SPILL_SCATTER, SPILL_SCATTER));
        y = bounds.clampY(y + rng.nextDouble(-SPILL_SCATTER, SPILL_SCATTER));

        try {
            foodSink.spawnFood(x, y, energy);
            return true;
        } catch (RuntimeException e) {
            log.warn("Could not spill {} energy from {}: {}", String.format("%.2f", energy), agent, e.getMessage());
            return false;
        }
    }

    private void report(String source, double delta) {
        if (delta == 0.0) {
            return;
        }
        try {
            accounting.record(source, delta);
        } catch (RuntimeException e) {
            log.warn("Energy accounting failed for {} ({}): {}", source, delta, e.getMessage());
        }
    }
}
