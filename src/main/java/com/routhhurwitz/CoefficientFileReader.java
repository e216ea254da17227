package com.routhhurwitz;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a batch of polynomials, one per line:
 * <pre>
 *   # comment
 *   * comment
 *   plant: 1 2 3 4
 *   s^2 - 2s + 2
 * </pre>
 * Blank lines and lines starting with {@code *} or {@code #} are skipped.
 * An optional {@code name:} prefix labels the entry; otherwise it is named
 * after its line number.
 */
public final class CoefficientFileReader {

    /** One polynomial from the input. */
    public static final class Entry {
        public final String name;
        public final int line;
        public final double[] coefficients;

        public Entry(String name, int line, double[] coefficients) {
            this.name = name;
            this.line = line;
            this.coefficients = coefficients;
        }
    }

    private CoefficientFileReader(){}

    public static List<Entry> read(Path path) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(br);
        }
    }

    public static List<Entry> read(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        List<Entry> out = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            lineNo++;
            String t = line.trim();
            if (t.isEmpty()) continue;
            if (t.startsWith("*") || t.startsWith("#")) continue;

            String name = "line " + lineNo;
            int colon = t.indexOf(':');
            if (colon >= 0) {
                String label = t.substring(0, colon).trim();
                if (label.isEmpty()) throw new IOException("Empty name before ':' on line " + lineNo);
                name = label;
                t = t.substring(colon + 1).trim();
            }
            try {
                out.add(new Entry(name, lineNo, CoefficientParser.parse(t)));
            } catch (IllegalArgumentException e) {
                throw new IOException("Line " + lineNo + ": " + e.getMessage(), e);
            }
        }
        return out;
    }
}
