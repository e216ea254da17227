package com.routhhurwitz;

/**
 * Immutable engine configuration. One instance is passed to every
 * {@link RouthHurwitz#analyze} call; nothing is held globally.
 */
public final class RouthOptions {
    public static final double DEFAULT_EPSILON = 1e-6;
    public static final double DEFAULT_ZERO_ROW_EPSILON = 1e-12;

    private static final RouthOptions DEFAULTS = new Builder().build();

    public final double epsilon;            // substitute for a zero pivot
    public final double zeroRowEpsilon;     // |x| below this counts as zero
    public final boolean normalizeLeading;  // divide through by the leading coefficient

    private RouthOptions(Builder b) {
        this.epsilon = b.epsilon;
        this.zeroRowEpsilon = b.zeroRowEpsilon;
        this.normalizeLeading = b.normalizeLeading;
    }

    public static RouthOptions defaults() { return DEFAULTS; }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder().epsilon(epsilon).zeroRowEpsilon(zeroRowEpsilon).normalizeLeading(normalizeLeading);
    }

    boolean isZero(double x) { return Math.abs(x) < zeroRowEpsilon; }

    @Override
    public String toString() {
        return "RouthOptions{epsilon=" + epsilon +
                ", zeroRowEpsilon=" + zeroRowEpsilon +
                ", normalizeLeading=" + normalizeLeading + "}";
    }

    public static final class Builder {
        private double epsilon = DEFAULT_EPSILON;
        private double zeroRowEpsilon = DEFAULT_ZERO_ROW_EPSILON;
        private boolean normalizeLeading = true;

        public Builder epsilon(double v){ this.epsilon = requirePositive("epsilon", v); return this; }
        public Builder zeroRowEpsilon(double v){ this.zeroRowEpsilon = requirePositive("zeroRowEpsilon", v); return this; }
        public Builder normalizeLeading(boolean v){ this.normalizeLeading = v; return this; }
        public RouthOptions build(){ return new RouthOptions(this); }

        private static double requirePositive(String name, double v) {
            if (!(v > 0) || Double.isInfinite(v))
                throw new IllegalArgumentException(name + " must be a positive finite number, got " + v);
            return v;
        }
    }
}
