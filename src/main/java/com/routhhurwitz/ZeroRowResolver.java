package com.routhhurwitz;

import java.util.List;

/**
 * Replaces an all-zero row with the derivative of the auxiliary polynomial
 * read off the row above it. A zero row means the polynomial has a factor
 * whose roots are symmetric about the origin (for example a pair on the
 * imaginary axis); that factor is the auxiliary polynomial.
 */
final class ZeroRowResolver {

    private ZeroRowResolver(){}

    static boolean isZeroRow(double[] row, RouthOptions opts) {
        for (double x : row) if (!opts.isZero(x)) return false;
        return true;
    }

    /**
     * @param prev2  the row two above the row being computed
     * @param i      index of the row being computed; the zero row is {@code i - 1}
     * @param degree degree of the analysed polynomial
     * @param m      entries per row
     */
    static double[] resolve(double[] prev2, int i, int degree, int m, String label,
                            RouthOptions opts, List<String> notes) {
        int auxDegree = degree - (i - 2);
        double[] aux = RowLayout.rowToPoly(prev2, auxDegree);
        double[] replacement = RowLayout.polyToRow(RowLayout.derivative(aux), m);
        notes.add("Row " + label + " is all zero: replaced by the derivative of the auxiliary polynomial "
                + Polynomial.render(aux) + " (degree " + auxDegree + ")");
        return replacement;
    }
}
