package com.routhhurwitz;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * Human-readable rendering of a {@link RouthResult}: the polynomial, the
 * table as an {@code s^k}-labelled grid, the first column, the sign-change
 * count and the verdict, followed by any notes.
 */
public final class RouthReportWriter {
    private static final String RULE = "============================================================";

    private final int precision;

    public RouthReportWriter() { this(4); }

    public RouthReportWriter(int precision) {
        if (precision < 0 || precision > 17) throw new IllegalArgumentException("precision must be in [0, 17]");
        this.precision = precision;
    }

    public String format(double v) {
        return String.format(Locale.ROOT, "%." + precision + "f", v);
    }

    /** Full report. {@code name} may be null. */
    public void write(PrintWriter out, String name, RouthResult r) {
        out.println(RULE);
        out.println("ROUTH-HURWITZ STABILITY ANALYSIS" + (name == null ? "" : " - " + name));
        out.println(RULE);
        out.println("Polynomial of order " + r.order() + ":");
        out.println("  " + Polynomial.render(r.coefficients()));
        out.println();
        out.println("Routh table:");
        writeTable(out, r.table());
        out.println();

        StringBuilder fc = new StringBuilder("First column: [");
        double[] col = r.firstColumn();
        for (int i = 0; i < col.length; i++) {
            if (i > 0) fc.append(", ");
            fc.append(format(col[i]));
        }
        out.println(fc.append(']'));
        out.println("Sign changes: " + r.rhpPoles());
        out.println("Right half-plane poles: " + r.rhpPoles());
        out.println(verdict(r));

        if (!r.notes().isEmpty()) {
            out.println("Notes:");
            for (String note : r.notes()) out.println("  - " + note);
        }
        out.flush();
    }

    /** One line per table row, one column per entry. */
    public void writeTable(PrintWriter out, RouthTable t) {
        int width = 10;
        for (int i = 0; i < t.rows(); i++)
            for (int j = 0; j < t.cols(); j++)
                width = Math.max(width, format(t.get(i, j)).length() + 2);
        int labelWidth = Math.max(6, ("s^" + t.degree()).length() + 1);

        StringBuilder header = new StringBuilder(pad("Row", labelWidth)).append('|');
        for (int j = 0; j < t.cols(); j++) header.append(pad(" Col " + (j + 1), width)).append('|');
        out.println(header);
        out.println("-".repeat(header.length()));

        for (int i = 0; i < t.rows(); i++) {
            StringBuilder sb = new StringBuilder(pad(t.label(i), labelWidth)).append('|');
            for (int j = 0; j < t.cols(); j++) sb.append(pad(" " + format(t.get(i, j)), width)).append('|');
            out.println(sb);
        }
    }

    /** Single line used in quiet mode. */
    public void writeSummary(PrintWriter out, String name, RouthResult r) {
        out.println((name == null ? Polynomial.render(r.coefficients()) : name) + ": " +
                (r.isStable() ? "STABLE" : "UNSTABLE") +
                " rhp_poles=" + r.rhpPoles() +
                (r.notes().isEmpty() ? "" : " notes=" + r.notes().size()));
        out.flush();
    }

    static String verdict(RouthResult r) {
        if (r.isStable()) return "RESULT: STABLE";
        return "RESULT: UNSTABLE (" + r.rhpPoles() + " right half-plane pole" + (r.rhpPoles() == 1 ? "" : "s") + ")";
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
