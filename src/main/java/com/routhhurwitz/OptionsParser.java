package com.routhhurwitz;

import java.util.*;

public final class OptionsParser {

    public static final class Parsed {
        public final RouthOptions options;
        public final double[] coefficients;   // inline list or -poly, null with -file
        public final String inputPath;        // -file, null otherwise
        public final int threads;
        public final int precision;
        public final boolean quiet;

        private Parsed(RouthOptions o, double[] c, String p, int t, int prec, boolean q){
            options=o; coefficients=c; inputPath=p; threads=t; precision=prec; quiet=q;
        }
    }

    public static Parsed parse(String[] args){
        RouthOptions.Builder b = RouthOptions.builder();
        List<String> numbers = new ArrayList<>();
        String expr = null, input = null;
        int threads = 1, precision = 4;
        boolean quiet = false;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-eps":
                case "-epsilon": b.epsilon(Double.parseDouble(next(args, ++i, a))); break;
                case "-zerotol": b.zeroRowEpsilon(Double.parseDouble(next(args, ++i, a))); break;
                case "-nonormalize": b.normalizeLeading(false); break;
                case "-threads": threads = Math.max(1, Integer.parseInt(next(args, ++i, a))); break;
                case "-precision": precision = Integer.parseInt(next(args, ++i, a)); break;
                case "-quiet": quiet = true; break;
                case "-poly": {
                    if (expr != null) throw new IllegalArgumentException("Multiple -poly expressions");
                    expr = next(args, ++i, a);
                    break;
                }
                case "-file": {
                    String path = next(args, ++i, a);
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + path);
                    input = path;
                    break;
                }
                default:
                    // "-2" is a coefficient, "-x" is an option
                    for (String tok : nextCSV(a)) {
                        if (!CoefficientParser.isNumber(tok)) {
                            if (tok.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                            throw new IllegalArgumentException("Not a coefficient: " + tok);
                        }
                        numbers.add(tok);
                    }
            }
        }
        if (precision < 0 || precision > 17) throw new IllegalArgumentException("-precision must be in [0, 17]");

        int sources = (numbers.isEmpty() ? 0 : 1) + (expr == null ? 0 : 1) + (input == null ? 0 : 1);
        if (sources == 0) throw new IllegalArgumentException("Missing coefficients, -poly or -file");
        if (sources > 1) throw new IllegalArgumentException("Give only one of: coefficients, -poly, -file");

        double[] coeffs = null;
        if (!numbers.isEmpty()) coeffs = CoefficientParser.parseList(String.join(" ", numbers));
        else if (expr != null) coeffs = CoefficientParser.parseExpression(expr);

        return new Parsed(b.build(), coeffs, input, threads, precision, quiet);
    }

    private static String next(String[] args, int i, String option){
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }

    private static List<String> nextCSV(String s){
        String[] parts = s.split(",");
        List<String> out = new ArrayList<>(parts.length);
        for (String p : parts) {
            String t = p.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }
}
