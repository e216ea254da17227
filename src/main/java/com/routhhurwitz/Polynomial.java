package com.routhhurwitz;

import java.util.Arrays;

/**
 * Real polynomial in {@code s}, coefficients ordered from the highest power
 * down to the constant term. Instances only come out of
 * {@link #normalize(double[], RouthOptions)}, so the leading coefficient is
 * never (near-)zero.
 */
public final class Polynomial {
    private final double[] a;   // a[0] * s^n + ... + a[n]

    private Polynomial(double[] a) {
        this.a = a;
    }

    /**
     * Validates and canonicalizes a raw coefficient sequence: leading entries
     * within {@code zeroRowEpsilon} of zero are stripped and, when
     * {@code normalizeLeading} is set, every coefficient is divided by the
     * first one.
     *
     * @throws InvalidInputException if nothing usable is left
     */
    public static Polynomial normalize(double[] raw, RouthOptions opts) {
        if (raw == null || raw.length == 0)
            throw new InvalidInputException("Coefficient list must not be empty");
        for (int i = 0; i < raw.length; i++) {
            if (!Double.isFinite(raw[i]))
                throw new InvalidInputException("Coefficient " + i + " is not a finite number: " + raw[i]);
        }

        int lead = 0;
        while (lead < raw.length && opts.isZero(raw[lead])) lead++;
        if (lead == raw.length)
            throw new InvalidInputException("All coefficients are ~0; polynomial has no degree");

        double[] c = Arrays.copyOfRange(raw, lead, raw.length);
        if (opts.normalizeLeading) {
            double first = c[0];
            for (int i = 0; i < c.length; i++) c[i] = c[i] / first;
        }
        return new Polynomial(c);
    }

    public static Polynomial normalize(double[] raw) {
        return normalize(raw, RouthOptions.defaults());
    }

    public int degree() { return a.length - 1; }

    /** Coefficient at index {@code i} from the top (0 = leading). */
    public double coefficient(int i) { return a[i]; }

    /** Coefficient of {@code s^power}; zero outside {@code [0, degree]}. */
    public double coefficientOfPower(int power) {
        int idx = degree() - power;
        if (idx < 0 || idx >= a.length) return 0.0;
        return a[idx];
    }

    public double[] coefficients() { return Arrays.copyOf(a, a.length); }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Polynomial)) return false;
        return Arrays.equals(a, ((Polynomial) obj).a);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(a); }

    /** Readable form such as {@code s^3 + 2s^2 - 0.5s + 4}. */
    @Override
    public String toString() {
        return render(a);
    }

    static String render(double[] coeffs) {
        int n = coeffs.length - 1;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < coeffs.length; i++) {
            double c = coeffs[i];
            if (Math.abs(c) < 1e-10) continue;
            int p = n - i;
            double v = Math.abs(c);

            if (sb.length() == 0) {
                if (c < 0) sb.append('-');
            } else {
                sb.append(c < 0 ? " - " : " + ");
            }
            boolean unit = v == 1.0 && p > 0;
            if (!unit) sb.append(formatNumber(v));
            if (p == 1) sb.append('s');
            else if (p > 1) sb.append("s^").append(p);
        }
        return sb.length() == 0 ? "0" : sb.toString();
    }

    private static String formatNumber(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) return Long.toString((long) v);
        return Double.toString(v);
    }
}
