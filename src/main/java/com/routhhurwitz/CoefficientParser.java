package com.routhhurwitz;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Reads a coefficient sequence from text. Two forms are accepted:
 * <ul>
 *   <li>a list of numbers separated by whitespace and/or commas, highest
 *       power first: {@code 1 2 3 4}, {@code [1, -2, 2]}, {@code 1 1/2 3e-2}</li>
 *   <li>a polynomial in {@code s}: {@code s^3 + 2s^2 - 0.5s + 4},
 *       {@code 2*s**2 + 1}. Repeated powers are summed, missing ones are zero.</li>
 * </ul>
 * A number is a decimal or scientific literal, or a ratio {@code a/b}.
 */
public final class CoefficientParser {

    private static final Pattern NUMBER =
            Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?(/[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?)?");

    /** Highest power accepted in an expression. */
    static final int MAX_POWER = 10_000;

    private CoefficientParser(){}

    /** True if {@code token} is a single number in one of the accepted forms. */
    public static boolean isNumber(String token) {
        return NUMBER.matcher(token.trim()).matches();
    }

    public static double[] parse(String text) {
        String t = text.trim();
        if (t.isEmpty()) throw new IllegalArgumentException("No coefficients given");
        if (t.toLowerCase(Locale.ROOT).indexOf('s') >= 0) return parseExpression(t);
        return parseList(t);
    }

    /** Whitespace/comma separated numbers, optionally wrapped in brackets. */
    public static double[] parseList(String text) {
        String t = text.trim();
        if (t.startsWith("[") && t.endsWith("]")) t = t.substring(1, t.length() - 1);
        List<Double> out = new ArrayList<>();
        for (String tok : t.split("[\\s,;]+")) {
            if (tok.isEmpty()) continue;
            out.add(parseNumber(tok));
        }
        if (out.isEmpty()) throw new IllegalArgumentException("No coefficients given");
        double[] a = new double[out.size()];
        for (int i = 0; i < a.length; i++) a[i] = out.get(i);
        return a;
    }

    /** Parse "a/b" or "a". */
    public static double parseNumber(String token) {
        String t = token.trim();
        if (!isNumber(t)) throw new IllegalArgumentException("Not a number: '" + token + "'");
        int slash = t.indexOf('/');
        if (slash < 0) return Double.parseDouble(t);
        double num = Double.parseDouble(t.substring(0, slash));
        double den = Double.parseDouble(t.substring(slash + 1));
        if (den == 0.0) throw new IllegalArgumentException("Zero denominator in '" + token + "'");
        return num / den;
    }

    /** Polynomial expression in {@code s}, returned highest power first. */
    public static double[] parseExpression(String text) {
        String e = text.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
        if (e.isEmpty()) throw new IllegalArgumentException("Empty polynomial expression");

        TreeMap<Integer, Double> byPower = new TreeMap<>();
        int start = 0;
        for (int i = 1; i <= e.length(); i++) {
            boolean atEnd = i == e.length();
            if (!atEnd) {
                char c = e.charAt(i);
                char before = e.charAt(i - 1);
                boolean split = (c == '+' || c == '-') && "e^*/".indexOf(before) < 0;
                if (!split) continue;
            }
            addTerm(e.substring(start, i), byPower, text);
            start = i;
        }

        int degree = byPower.lastKey();
        double[] a = new double[degree + 1];
        byPower.forEach((p, c) -> a[degree - p] += c);
        return a;
    }

    private static void addTerm(String term, TreeMap<Integer, Double> byPower, String source) {
        String body = term;
        double sign = 1.0;
        if (body.startsWith("+")) body = body.substring(1);
        else if (body.startsWith("-")) { sign = -1.0; body = body.substring(1); }
        if (body.isEmpty()) throw new IllegalArgumentException("Dangling sign in '" + source + "'");

        int s = body.indexOf('s');
        if (s < 0) {
            byPower.merge(0, sign * parseNumber(body), Double::sum);
            return;
        }
        if (body.indexOf('s', s + 1) >= 0)
            throw new IllegalArgumentException("Term '" + term + "' uses s more than once");

        String coef = body.substring(0, s);
        if (coef.endsWith("*")) coef = coef.substring(0, coef.length() - 1);
        double c = coef.isEmpty() ? 1.0 : parseNumber(coef);

        String rest = body.substring(s + 1);
        int power;
        if (rest.isEmpty()) {
            power = 1;
        } else {
            String exp;
            if (rest.startsWith("^")) exp = rest.substring(1);
            else if (rest.startsWith("**")) exp = rest.substring(2);
            else throw new IllegalArgumentException("Bad power in term '" + term + "'");
            if (!exp.matches("\\d+")) throw new IllegalArgumentException("Power must be a non-negative integer in term '" + term + "'");
            if (exp.length() > 5 || Integer.parseInt(exp) > MAX_POWER)
                throw new IllegalArgumentException("Power exceeds " + MAX_POWER + " in term '" + term + "'");
            power = Integer.parseInt(exp);
        }
        byPower.merge(power, sign * c, Double::sum);
    }
}
