package com.routhhurwitz;

import java.util.List;

/** Counters printed after a run. */
public final class SweepStats {
    public int polynomials;
    public int stable;
    public int unstable;
    public int invalid;
    public int withNotes;

    public static SweepStats of(List<RouthSweep.Outcome> outcomes) {
        SweepStats st = new SweepStats();
        for (RouthSweep.Outcome o : outcomes) {
            st.polynomials++;
            if (!o.isValid()) { st.invalid++; continue; }
            if (o.result.isStable()) st.stable++; else st.unstable++;
            if (!o.result.notes().isEmpty()) st.withNotes++;
        }
        return st;
    }

    @Override
    public String toString() {
        return "*Totals: polynomials=" + polynomials +
                " stable=" + stable +
                " unstable=" + unstable +
                " invalid=" + invalid +
                " special_cases=" + withNotes;
    }
}
