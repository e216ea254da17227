package com.routhhurwitz;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one Routh-Hurwitz analysis. Immutable; array accessors return
 * copies.
 *
 * <p>{@code stable} is {@code rhpPoles == 0}. Roots on the imaginary axis
 * (a resolved zero row) do not make the result unstable and are not flagged
 * separately; the notes record that a zero row was met.
 */
public final class RouthResult {
    private final int order;
    private final double[] coefficients;
    private final RouthTable table;
    private final List<String> rowLabels;
    private final double[] firstColumn;
    private final int rhpPoles;
    private final List<String> notes;

    RouthResult(Polynomial polynomial, RouthTable table, int rhpPoles, List<String> notes) {
        this.order = polynomial.degree();
        this.coefficients = polynomial.coefficients();
        this.table = table;
        List<String> labels = new ArrayList<>(table.rows());
        for (int r = 0; r < table.rows(); r++) labels.add(table.label(r));
        this.rowLabels = Collections.unmodifiableList(labels);
        this.firstColumn = table.firstColumn();
        this.rhpPoles = rhpPoles;
        this.notes = Collections.unmodifiableList(new ArrayList<>(notes));
    }

    /** Degree of the normalized polynomial. */
    public int order() { return order; }

    /** Normalized coefficients, highest power first. */
    public double[] coefficients() { return Arrays.copyOf(coefficients, coefficients.length); }

    public RouthTable table() { return table; }

    /** {@code s^n} down to {@code s^0}, one per table row. */
    public List<String> rowLabels() { return rowLabels; }

    public double[] firstColumn() { return Arrays.copyOf(firstColumn, firstColumn.length); }

    /** Number of roots with strictly positive real part. */
    public int rhpPoles() { return rhpPoles; }

    public boolean isStable() { return rhpPoles == 0; }

    /** Pivot substitutions and zero-row resolutions, in the order they happened. */
    public List<String> notes() { return notes; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RouthResult)) return false;
        RouthResult o = (RouthResult) obj;
        return order == o.order && rhpPoles == o.rhpPoles
                && Arrays.equals(coefficients, o.coefficients)
                && table.equals(o.table)
                && notes.equals(o.notes);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(coefficients);
        h = h * 31 + table.hashCode();
        h = h * 31 + rhpPoles;
        return h * 31 + notes.hashCode();
    }

    @Override
    public String toString() {
        return "RouthResult(order=" + order + ", is_stable=" + isStable() + ", rhp_poles=" + rhpPoles + ")";
    }
}
