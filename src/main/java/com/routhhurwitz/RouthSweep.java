package com.routhhurwitz;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs one {@link RouthHurwitz} engine over many coefficient sequences, for
 * example the candidate characteristic polynomials of a gain sweep.
 * Results come back in input order. An invalid sequence yields an
 * {@link Outcome} carrying the error instead of stopping the sweep.
 */
public final class RouthSweep {

    /** Result or error for one input. Exactly one of the two is non-null. */
    public static final class Outcome {
        public final int index;
        public final RouthResult result;
        public final String error;

        private Outcome(int index, RouthResult result, String error) {
            this.index = index;
            this.result = result;
            this.error = error;
        }

        public boolean isValid() { return result != null; }
    }

    private final RouthHurwitz engine;
    private final int threads;

    public RouthSweep(RouthHurwitz engine, int threads) {
        this.engine = engine;
        this.threads = Math.max(1, threads);
    }

    public int threads() { return threads; }

    public List<Outcome> analyzeAll(List<double[]> inputs) throws InterruptedException {
        List<Outcome> out = new ArrayList<>(inputs.size());
        if (threads == 1 || inputs.size() < 2) {
            for (int i = 0; i < inputs.size(); i++) out.add(analyzeOne(i, inputs.get(i)));
            return out;
        }

        List<Callable<Outcome>> tasks = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            final int idx = i;
            final double[] coeffs = inputs.get(i);
            tasks.add(() -> analyzeOne(idx, coeffs));
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, inputs.size()));
        try {
            for (Future<Outcome> f : pool.invokeAll(tasks)) {
                try {
                    out.add(f.get());
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Routh analysis failed: " + e.getCause(), e.getCause());
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return out;
    }

    private Outcome analyzeOne(int index, double[] coeffs) {
        try {
            return new Outcome(index, engine.analyze(coeffs), null);
        } catch (InvalidInputException e) {
            return new Outcome(index, null, e.getMessage());
        }
    }
}
