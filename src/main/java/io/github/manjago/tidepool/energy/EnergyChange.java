package io.github.manjago.tidepool.energy;

/**
 * Where a requested energy delta ended up.
 *
 * {@code applied + banked + spilled + lost == requested}. For a negative
 * request only {@code applied} can be non-zero, and it may be smaller in
 * magnitude than the request when the ledger bottoms out at zero.
 *
 * @param requested amount asked for
 * @param applied   change committed to the ledger
 * @param banked    deposited in the overflow bank
 * @param spilled   turned into food
 * @param lost      could not be spilled (food sink failed)
 */
public record EnergyChange(double requested, double applied, double banked, double spilled, double lost) {

    public static EnergyChange direct(double requested, double applied) {
        return new EnergyChange(requested, applied, 0.0, 0.0, 0.0);
    }

    public boolean overflowed() {
        return banked > 0 || spilled > 0 || lost > 0;
    }
}
