package com.routhhurwitz;

import static org.junit.jupiter.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.jupiter.api.Test;

public class RouthReportWriterTest {

    private static String report(RouthReportWriter w, String name, double... coeffs) {
        StringWriter sw = new StringWriter();
        w.write(new PrintWriter(sw), name, new RouthHurwitz().analyze(coeffs));
        return sw.toString();
    }

    @Test
    public void testStableReport() {
        String out = report(new RouthReportWriter(), "plant", 1, 2, 3, 4);
        assertTrue(out.contains("ROUTH-HURWITZ STABILITY ANALYSIS - plant"));
        assertTrue(out.contains("Polynomial of order 3:"));
        assertTrue(out.contains("s^3 + 2s^2 + 3s + 4"));
        assertTrue(out.contains("First column: [1.0000, 2.0000, 1.0000, 4.0000]"));
        assertTrue(out.contains("Sign changes: 0"));
        assertTrue(out.contains("RESULT: STABLE"));
        assertFalse(out.contains("Notes:"));

        // one labelled line per row
        int rows = 0;
        for (String line : out.split("\\R")) if (line.startsWith("s^")) rows++;
        assertEquals(4, rows);
    }

    @Test
    public void testUnstableReportWithNotes() {
        String out = report(new RouthReportWriter(2), null, 1, 1, 2, 2, 3);
        assertTrue(out.contains("RESULT: UNSTABLE (2 right half-plane poles)"));
        assertTrue(out.contains("Notes:"));
        assertTrue(out.contains("zero pivot"));
        assertTrue(out.contains("First column: [1.00, 1.00, 0.00, "));
    }

    @Test
    public void testTableGrid() {
        StringWriter sw = new StringWriter();
        new RouthReportWriter(1).writeTable(new PrintWriter(sw, true), new RouthHurwitz().analyze(1, 2, 3, 4).table());
        String[] lines = sw.toString().split("\\R");
        assertTrue(lines[0].startsWith("Row"));
        assertTrue(lines[0].contains("Col 1") && lines[0].contains("Col 2"));
        assertTrue(lines[1].matches("-+"));
        assertTrue(lines[2].startsWith("s^3"));
        assertTrue(lines[2].contains("1.0") && lines[2].contains("3.0"));
        assertTrue(lines[5].startsWith("s^0"));
    }

    @Test
    public void testSummaryLine() {
        StringWriter sw = new StringWriter();
        RouthReportWriter w = new RouthReportWriter();
        w.writeSummary(new PrintWriter(sw), "plant", new RouthHurwitz().analyze(1, -2, 2));
        assertEquals("plant: UNSTABLE rhp_poles=2", sw.toString().trim());

        sw = new StringWriter();
        w.writeSummary(new PrintWriter(sw), null, new RouthHurwitz().analyze(1, 0, 2, 0, 1));
        assertEquals("s^4 + 2s^2 + 1: STABLE rhp_poles=0 notes=2", sw.toString().trim());
    }

    @Test
    public void testPrecisionBounds() {
        assertThrows(IllegalArgumentException.class, () -> new RouthReportWriter(-1));
        assertEquals("0.333", new RouthReportWriter(3).format(1.0 / 3.0));
    }
}
