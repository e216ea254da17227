package com.routhhurwitz;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line driver:
 *  - parse arguments (delegates to OptionsParser)
 *  - collect the polynomials (inline, -poly, or a -file batch)
 *  - run them through a RouthSweep
 *  - print one report per polynomial, totals and elapsed time
 *
 * Exit codes: 0 all polynomials analysed, 1 I/O error or an invalid
 * polynomial, 2 argument error.
 */
public final class RouthDriver {
    private final PrintStream out;
    private final PrintStream err;

    public RouthDriver(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public int run(String[] args) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage(err);
            err.println("Argument error: " + e.getMessage());
            return 2;
        }

        final Instant t0 = Instant.now();
        try {
            // 1) Collect input
            List<String> names = new ArrayList<>();
            List<double[]> inputs = new ArrayList<>();
            if (parsed.inputPath != null) {
                for (CoefficientFileReader.Entry e : CoefficientFileReader.read(Paths.get(parsed.inputPath))) {
                    names.add(e.name);
                    inputs.add(e.coefficients);
                }
            } else {
                names.add(null);
                inputs.add(parsed.coefficients);
            }

            // 2) Analyse
            RouthSweep sweep = new RouthSweep(new RouthHurwitz(parsed.options), parsed.threads);
            List<RouthSweep.Outcome> outcomes = sweep.analyzeAll(inputs);

            // 3) Report
            RouthReportWriter writer = new RouthReportWriter(parsed.precision);
            PrintWriter pw = new PrintWriter(out, true);
            for (RouthSweep.Outcome o : outcomes) {
                String name = names.get(o.index);
                if (!o.isValid()) {
                    err.println((name == null ? "" : name + ": ") + "invalid polynomial: " + o.error);
                    continue;
                }
                if (parsed.quiet) writer.writeSummary(pw, name, o.result);
                else writer.write(pw, name, o.result);
            }
            pw.flush();

            SweepStats stats = SweepStats.of(outcomes);
            double secs = Duration.between(t0, Instant.now()).toMillis() / 1000.0;
            out.println(stats);
            out.printf("*elapsed time: %.3f seconds%n", secs);

            return stats.invalid == 0 ? 0 : 1;
        } catch (NoSuchFileException e) {
            err.println("File not found: " + parsed.inputPath);
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("*interrupted");
            return 1;
        }
    }

    static void usage(PrintStream err) {
        err.println(
                "Usage: routh [options] <c_n> ... <c_0>\n" +
                "       routh [options] -poly \"s^3 + 2s^2 + 3s + 4\"\n" +
                "       routh [options] -file <input-file>\n" +
                "Coefficients run from the highest power down to the constant term.\n" +
                "Options:\n" +
                "  -eps X         substitute for a zero pivot (default 1e-6)\n" +
                "  -zerotol X     values below X count as zero (default 1e-12)\n" +
                "  -nonormalize   keep the leading coefficient as given\n" +
                "  -precision N   digits after the decimal point in reports (default 4)\n" +
                "  -threads N     analyse a -file batch on N threads\n" +
                "  -quiet         one verdict line per polynomial\n"
        );
    }
}
