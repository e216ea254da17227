package com.routhhurwitz;

/** Sign-change count over the first column of a Routh table. */
public final class SignChanges {

    /** Stand-in for entries that are zero within tolerance; always positive. */
    static final double ZERO_SUBSTITUTE = 1e-15;

    private SignChanges(){}

    /**
     * Counts adjacent pairs with strictly opposite signs. Entries within
     * {@code tolerance} of zero are read as {@link #ZERO_SUBSTITUTE}, which
     * matches the positive epsilon used for zero pivots.
     */
    public static int count(double[] values, double tolerance) {
        int changes = 0;
        for (int k = 0; k + 1 < values.length; k++) {
            double x = clean(values[k], tolerance);
            double y = clean(values[k + 1], tolerance);
            if ((x > 0 && y < 0) || (x < 0 && y > 0)) changes++;
        }
        return changes;
    }

    private static double clean(double v, double tolerance) {
        return Math.abs(v) < tolerance ? ZERO_SUBSTITUTE : v;
    }
}
