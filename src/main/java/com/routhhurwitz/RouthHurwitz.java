package com.routhhurwitz;

import java.util.Objects;

/**
 * Routh-Hurwitz stability test: counts the roots of a real polynomial that lie
 * in the open right half plane without computing any root.
 *
 * <pre>
 *   RouthResult r = new RouthHurwitz().analyze(1, 2, 3, 4);   // s^3 + 2s^2 + 3s + 4
 *   r.isStable();   // true
 *   r.rhpPoles();   // 0
 * </pre>
 *
 * Instances hold only their immutable {@link RouthOptions} and may be shared
 * between threads.
 */
public final class RouthHurwitz {
    private final RouthOptions opts;

    public RouthHurwitz() { this(RouthOptions.defaults()); }

    public RouthHurwitz(RouthOptions opts) { this.opts = Objects.requireNonNull(opts, "options"); }

    public RouthOptions options() { return opts; }

    /**
     * @param coefficients highest power first, e.g. {@code 1, 2, 3, 4} for
     *                     {@code s^3 + 2s^2 + 3s + 4}
     * @throws InvalidInputException if the sequence does not describe a polynomial
     */
    public RouthResult analyze(double... coefficients) {
        Polynomial p = Polynomial.normalize(coefficients, opts);
        RouthTableBuilder builder = new RouthTableBuilder(opts);
        RouthTable table = builder.build(p);
        int rhp = SignChanges.count(table.firstColumn(), opts.zeroRowEpsilon);
        return new RouthResult(p, table, rhp, builder.notes());
    }

    /** Same as {@code new RouthHurwitz(opts).analyze(coefficients)}. */
    public static RouthResult analyze(double[] coefficients, RouthOptions opts) {
        return new RouthHurwitz(opts).analyze(coefficients);
    }
}
