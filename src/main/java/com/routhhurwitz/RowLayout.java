package com.routhhurwitz;

/**
 * Conversions between a full coefficient array (highest power first) and the
 * every-other-power layout of a Routh row. Used for the first two rows and
 * by the zero-row resolver.
 */
public final class RowLayout {

    private RowLayout(){}

    /** Number of entries in every row of the table for a polynomial of this degree. */
    public static int columnCount(int degree) {
        return degree / 2 + 1;
    }

    /**
     * Takes {@code poly[offset]}, {@code poly[offset+2]}, ... into a row of
     * length {@code m}, zero-padded.
     */
    public static double[] interleave(double[] poly, int offset, int m) {
        double[] row = new double[m];
        for (int j = 0, k = offset; j < m && k < poly.length; j++, k += 2) {
            row[j] = poly[k];
        }
        return row;
    }

    /** poly -> row: powers d, d-2, d-4, ... of a degree-d polynomial. */
    public static double[] polyToRow(double[] poly, int m) {
        return interleave(poly, 0, m);
    }

    /**
     * row -> poly: places {@code row[k]} at power {@code degree - 2k};
     * every other power is zero. For degree 4, {@code [a4, a2, a0]} becomes
     * {@code [a4, 0, a2, 0, a0]}.
     */
    public static double[] rowToPoly(double[] row, int degree) {
        double[] poly = new double[degree + 1];
        for (int k = 0; k < row.length && 2 * k <= degree; k++) {
            poly[2 * k] = row[k];
        }
        return poly;
    }

    /** d/ds of a polynomial given highest power first; a constant yields {@code [0]}. */
    public static double[] derivative(double[] poly) {
        int n = poly.length - 1;
        if (n <= 0) return new double[]{ 0.0 };
        double[] d = new double[n];
        for (int i = 0; i < n; i++) d[i] = poly[i] * (n - i);
        return d;
    }
}
