package com.codelogickeep.agent.coverage.model;

/**
 * Missed/covered pair for one coverage metric.
 */
public record Counter(long missed, long covered) {

    public static final Counter EMPTY = new Counter(0, 0);

    public Counter {
        if (missed < 0 || covered < 0) {
            throw new IllegalArgumentException(
                    "Counter values must be non-negative: missed=" + missed + ", covered=" + covered);
        }
    }

    public long total() {
        return missed + covered;
    }

    public boolean hasData() {
        return total() > 0;
    }

    /**
     * Covered ratio in [0, 1]; 0.0 when nothing was measured.
     */
    public double ratio() {
        long total = total();
        return total == 0 ? 0.0 : (double) covered / total;
    }

    public Counter plus(Counter other) {
        if (other == null || !other.hasData()) {
            return this;
        }
        return new Counter(missed + other.missed, covered + other.covered);
    }
}
