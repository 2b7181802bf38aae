package io.github.manjago.tidepool.agent;

import io.github.manjago.tidepool.TestFixtures;
import io.github.manjago.tidepool.core.GameRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static io.github.manjago.tidepool.TestFixtures.COOLDOWN;
import static org.junit.jupiter.api.Assertions.*;

class ReproductionLedgerTest {

    private static final double EPS = 1e-9;

    private ReproductionLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new ReproductionLedger(TestFixtures.reproduction());
    }

    // ========== Overflow bank ==========

    @Nested
    @DisplayName("Overflow bank")
    class Bank {

        @Test
        @DisplayName("Deposits stop at the cap")
        void depositCapped() {
            assertEquals(100, ledger.bankOverflow(100, 150), EPS);
            assertEquals(50, ledger.bankOverflow(80, 150), EPS);
            assertEquals(0, ledger.bankOverflow(10, 150), EPS);
            assertEquals(150, ledger.getOverflowBank(), EPS);
        }

        @Test
        @DisplayName("Non-positive deposits are ignored")
        void nonPositiveDeposit() {
            assertEquals(0, ledger.bankOverflow(-5, 150));
            assertEquals(0, ledger.bankOverflow(0, 150));
            assertEquals(0, ledger.getOverflowBank());
        }

        @Test
        @DisplayName("Withdrawal never exceeds the balance")
        void withdraw() {
            ledger.bankOverflow(30, 150);

            assertEquals(20, ledger.consumeBank(20), EPS);
            assertEquals(10, ledger.consumeBank(50), EPS);
            assertEquals(0, ledger.consumeBank(50), EPS);
        }

        @Test
        @DisplayName("Refund puts a withdrawal back")
        void refund() {
            ledger.bankOverflow(60, 60);
            double taken = ledger.consumeBank(50);
            ledger.refundBank(taken);

            assertEquals(60, ledger.getOverflowBank(), EPS);
        }
    }

    // ========== Gating ==========

    @Nested
    @DisplayName("Gating")
    class Gating {

        @Test
        @DisplayName("Adult at 90% off cooldown can reproduce")
        void adultCanReproduce() {
            assertTrue(ledger.canReproduce(LifeStage.ADULT, 90, 100));
            assertFalse(ledger.canReproduce(LifeStage.ADULT, 89.9, 100));
        }

        @ParameterizedTest
        @EnumSource(value = LifeStage.class, names = {"BABY", "JUVENILE", "ELDER"})
        @DisplayName("Only adults reproduce")
        void onlyAdults(LifeStage stage) {
            assertFalse(ledger.canReproduce(stage, 100, 100));
            assertFalse(ledger.canAsexuallyReproduce(stage, 100, 100));
        }

        @Test
        @DisplayName("Asexual gate is exactly 95% of max")
        void asexualBoundary() {
            assertTrue(ledger.canAsexuallyReproduce(LifeStage.ADULT, 95.0, 100));
            assertFalse(ledger.canAsexuallyReproduce(LifeStage.ADULT, 94.9, 100));
        }

        @Test
        @DisplayName("Cooldown blocks reproduction")
        void cooldownBlocks() {
            ledger.setCooldown(1);
            assertFalse(ledger.canReproduce(LifeStage.ADULT, 100, 100));
            ledger.tickCooldown();
            assertTrue(ledger.canReproduce(LifeStage.ADULT, 100, 100));
        }
    }

    // ========== Asexual trigger ==========

    @Test
    @DisplayName("Trigger starts the cooldown and builds the offspring genome")
    void triggerAsexual() {
        Genome parent = new Genome(1.2, 0.9, 1.1, 0.005);
        AsexualOffspring offspring = ledger.triggerAsexual(parent, new DefaultGenetics(), new GameRng(1));

        assertEquals(COOLDOWN, ledger.getCooldown());
        assertEquals(parent, offspring.genome(), "mutation rate 0 copies the genome");
        assertEquals(0.30, offspring.energyTransferFraction());
    }

    // ========== Cooldown ==========

    @Nested
    @DisplayName("Cooldown")
    class Cooldown {

        @Test
        @DisplayName("Ticking stops at zero")
        void floorAtZero() {
            ledger.setCooldown(2);
            ledger.tickCooldown();
            ledger.tickCooldown();
            ledger.tickCooldown();
            assertEquals(0, ledger.getCooldown());
        }

        @Test
        @DisplayName("Negative cooldown is stored as zero")
        void negativeSet() {
            ledger.setCooldown(-4);
            assertEquals(0, ledger.getCooldown());
        }

        @Test
        @DisplayName("Starting a cooldown keeps a longer running one")
        void startKeepsLonger() {
            ledger.setCooldown(100);
            ledger.startCooldown();
            assertEquals(100, ledger.getCooldown());

            ledger.setCooldown(3);
            ledger.startCooldown();
            assertEquals(COOLDOWN, ledger.getCooldown());
            assertTrue(ledger.describeState().startsWith("Cooldown"));
        }
    }

    // ========== Credits ==========

    @Nested
    @DisplayName("Credits")
    class Credits {

        @Test
        @DisplayName("Credits accumulate and are consumed up to the balance")
        void consume() {
            ledger.addReproCredits(1.5);
            ledger.addReproCredits(-3);

            assertTrue(ledger.hasReproCredits(1.5));
            assertFalse(ledger.hasReproCredits(1.6));
            assertEquals(1.0, ledger.consumeReproCredits(1.0), EPS);
            assertEquals(0.5, ledger.consumeReproCredits(1.0), EPS);
            assertEquals(0.0, ledger.getReproCredits(), EPS);
        }
    }

    @Test
    @DisplayName("Restore rejects negative balances")
    void restore() {
        ledger.restore(12, 40, 2);
        assertEquals(12, ledger.getCooldown());
        assertEquals(40, ledger.getOverflowBank());
        assertEquals(2, ledger.getReproCredits());

        assertThrows(IllegalArgumentException.class, () -> ledger.restore(0, -1, 0));
    }
}
