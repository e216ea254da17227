package com.routhhurwitz;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;

/** Runs the command-line driver with captured output streams. */
public class RouthDriverTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return new RouthDriver(out, err).run(args);
    }

    private String out() { return outBytes.toString(StandardCharsets.UTF_8); }
    private String err() { return errBytes.toString(StandardCharsets.UTF_8); }

    @Test
    public void testInlineCoefficients() {
        assertEquals(0, run("1", "2", "3", "4"));
        assertTrue(out().contains("RESULT: STABLE"));
        assertTrue(out().contains("*Totals: polynomials=1 stable=1 unstable=0 invalid=0"));
        assertTrue(out().contains("*elapsed time:"));
        assertEquals("", err());
    }

    @Test
    public void testPolyExpression() {
        assertEquals(0, run("-quiet", "-poly", "s^2 - 2s + 2"));
        assertTrue(out().contains("s^2 - 2s + 2: UNSTABLE rhp_poles=2"), out());
    }

    @Test
    public void testInvalidPolynomialExitsWithOne() {
        assertEquals(1, run("0", "0", "0"));
        assertTrue(err().contains("invalid polynomial"), err());
        assertTrue(out().contains("invalid=1"));
    }

    @Test
    public void testArgumentErrorExitsWithTwo() {
        assertEquals(2, run());
        assertTrue(err().contains("Usage: routh"));
        assertTrue(err().contains("Argument error:"));

        assertEquals(2, run("-bogus"));
    }

    @Test
    public void testBatchFileOnThreads() throws IOException {
        Path temp = Files.createTempFile("routh-batch", ".txt");
        Files.writeString(temp, String.join(System.lineSeparator(),
                "# candidates",
                "a: 1 2 3 4",
                "b: 1 -2 2",
                "c: 1 0 2 0 1",
                "d: 0 0",
                ""));

        assertEquals(1, run("-threads", "2", "-quiet", "-file", temp.toString()));
        String out = out();
        assertTrue(out.contains("a: STABLE rhp_poles=0"), out);
        assertTrue(out.contains("b: UNSTABLE rhp_poles=2"), out);
        assertTrue(out.contains("c: STABLE rhp_poles=0 notes=2"), out);
        assertTrue(out.indexOf("a: ") < out.indexOf("b: ") && out.indexOf("b: ") < out.indexOf("c: "));
        assertTrue(out.contains("*Totals: polynomials=4 stable=2 unstable=1 invalid=1"), out);
        assertTrue(err().contains("d: invalid polynomial"), err());

        Files.deleteIfExists(temp);
    }

    @Test
    public void testMissingFile() {
        assertEquals(1, run("-file", "/nonexistent/routh-input.txt"));
        assertTrue(err().contains("File not found"), err());
    }

    @Test
    public void testMalformedFile() throws IOException {
        Path temp = Files.createTempFile("routh-bad", ".txt");
        Files.writeString(temp, "1 2 3\nnot a polynomial\n");
        assertEquals(1, run("-file", temp.toString()));
        assertTrue(err().contains("Line 2"), err());
        Files.deleteIfExists(temp);
    }
}
