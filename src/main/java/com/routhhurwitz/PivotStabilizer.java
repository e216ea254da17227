package com.routhhurwitz;

import java.util.List;

/** Keeps a (near-)zero first entry from being used as a divisor. */
final class PivotStabilizer {

    private PivotStabilizer(){}

    /**
     * Returns {@code row} itself when its pivot is usable, otherwise a copy
     * whose entry 0 is {@link RouthOptions#epsilon}. The table row is never
     * modified.
     */
    static double[] stabilize(double[] row, String label, RouthOptions opts, List<String> notes) {
        if (!opts.isZero(row[0])) return row;
        double[] copy = row.clone();
        copy[0] = opts.epsilon;
        notes.add("Row " + label + ": zero pivot replaced by epsilon=" + opts.epsilon);
        return copy;
    }
}
