package com.retailinsight.common.segment;

/**
 * Distribution statistics over the finite prices of one product set.
 * Exposed so callers and tests can see which classification branch applied.
 */
public record PriceThresholds(
    double p25,
    double p75,
    double min,
    double max
) {
    public boolean percentilesDistinct() {
        return Double.compare(p25, p75) != 0;
    }

    public boolean uniform() {
        return Double.compare(min, max) == 0;
    }

    public double midpoint() {
        return (min + max) / 2.0;
    }
}
