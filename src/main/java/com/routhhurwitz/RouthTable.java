package com.routhhurwitz;

import java.util.Arrays;

/**
 * Completed Routh array: {@code degree + 1} rows, each of
 * {@code floor(degree/2) + 1} entries. Rows and columns are indexed from
 * zero; row {@code i} belongs to power {@code s^(degree - i)}.
 * Read-only once built; accessors hand out copies.
 */
public final class RouthTable {
    private final int rows;
    private final int cols;
    private final double[][] data;

    RouthTable(double[][] data) {
        if (data.length == 0) throw new IllegalArgumentException("Empty table");
        this.rows = data.length;
        this.cols = data[0].length;
        this.data = new double[rows][];
        for (int i = 0; i < rows; i++) {
            if (data[i].length != cols)
                throw new IllegalArgumentException("Row " + i + " has " + data[i].length + " entries, expected " + cols);
            this.data[i] = Arrays.copyOf(data[i], cols);
        }
    }

    public int rows() { return rows; }
    public int cols() { return cols; }

    /** Degree of the polynomial the table was built from. */
    public int degree() { return rows - 1; }

    public double get(int r, int c) { return data[r][c]; }

    public double[] row(int r) { return Arrays.copyOf(data[r], cols); }

    /** Entry 0 of every row, top to bottom. */
    public double[] firstColumn() {
        double[] col = new double[rows];
        for (int i = 0; i < rows; i++) col[i] = data[i][0];
        return col;
    }

    /** {@code s^k} label of row {@code r}. */
    public String label(int r) { return "s^" + (degree() - r); }

    public double[][] toArray() {
        double[][] a = new double[rows][];
        for (int i = 0; i < rows; i++) a[i] = Arrays.copyOf(data[i], cols);
        return a;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RouthTable)) return false;
        return Arrays.deepEquals(data, ((RouthTable) obj).data);
    }

    @Override
    public int hashCode() { return Arrays.deepHashCode(data); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows; i++) {
            if (i > 0) sb.append(System.lineSeparator());
            sb.append(label(i)).append(' ').append(Arrays.toString(data[i]));
        }
        return sb.toString();
    }
}
