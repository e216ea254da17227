package com.routhhurwitz;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out rows 0 and 1 from the coefficients and derives the rest with the
 * Routh cross-multiplication. Zero rows and zero pivots are resolved as they
 * are met and recorded in {@link #notes()}.
 *
 * <p>One builder per table; not shared between threads.
 */
final class RouthTableBuilder {
    private final RouthOptions opts;
    private final List<String> notes = new ArrayList<>();

    RouthTableBuilder(RouthOptions opts) {
        this.opts = opts;
    }

    List<String> notes() { return notes; }

    RouthTable build(Polynomial p) {
        final int n = p.degree();
        final int m = RowLayout.columnCount(n);
        final double[] a = p.coefficients();

        double[][] t = new double[n + 1][];
        t[0] = RowLayout.interleave(a, 0, m);
        if (n >= 1) t[1] = RowLayout.interleave(a, 1, m);

        for (int i = 2; i <= n; i++) {
            String label = "s^" + (n - i + 1);
            if (ZeroRowResolver.isZeroRow(t[i - 1], opts)) {
                t[i - 1] = ZeroRowResolver.resolve(t[i - 2], i, n, m, label, opts, notes);
            }
            double[] prev = PivotStabilizer.stabilize(t[i - 1], label, opts, notes);
            double[] prev2 = t[i - 2];

            double[] next = new double[m];
            double pivot = prev[0];
            for (int j = 0; j < m - 1; j++) {
                next[j] = (pivot * prev2[j + 1] - prev2[0] * prev[j + 1]) / pivot;
            }
            t[i] = next;
        }
        return new RouthTable(t);
    }
}
