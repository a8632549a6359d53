package com.retailinsight.common.segment;

import com.retailinsight.common.model.PriceSegment;
import com.retailinsight.common.model.ProductRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pure stateless classifier that tags every product of a set with a relative
 * {@link PriceSegment}.
 *
 * <p>Thresholds are recomputed on each call from the finite prices of the given set, so the
 * same price can land in different tiers in different sets.
 *
 * <p>Classification rules (evaluated in order):
 * <ol>
 *   <li>no finite price in the set           → {@link PriceSegment#UNDEFINED} for all</li>
 *   <li>p25 ≠ p75: price ≤ p25 → LOW, ≤ p75 → MEDIUM, else HIGH</li>
 *   <li>p25 = p75, min ≠ max: price &lt; midpoint(min, max) → LOW, else HIGH
 *       (two tiers only, no MEDIUM)</li>
 *   <li>min = max                            → MEDIUM for all</li>
 * </ol>
 * A row whose own price is not finite is {@link PriceSegment#UNDEFINED} in every branch.
 *
 * <p>No logging. No side-effects. Never throws.
 */
public final class PriceSegmentClassifier {

    static final double LOWER_QUANTILE = 0.25;
    static final double UPPER_QUANTILE = 0.75;

    private PriceSegmentClassifier() {}

    /**
     * Returns new rows carrying their tier; input rows are left untouched.
     *
     * @param products current product set; {@code null} is treated as empty
     */
    public static List<ProductRow> classify(List<ProductRow> products) {
        if (products == null || products.isEmpty()) {
            return List.of();
        }
        Optional<PriceThresholds> thresholds = thresholds(products);
        List<ProductRow> tagged = new ArrayList<>(products.size());
        for (ProductRow row : products) {
            PriceSegment segment = thresholds
                .map(t -> segmentOf(row.price(), t))
                .orElse(PriceSegment.UNDEFINED);
            tagged.add(row.withSegment(segment));
        }
        return tagged;
    }

    /** Percentiles and range over finite prices; empty when there are none. */
    public static Optional<PriceThresholds> thresholds(List<ProductRow> products) {
        double[] prices = products.stream()
            .mapToDouble(ProductRow::price)
            .filter(Double::isFinite)
            .sorted()
            .toArray();
        if (prices.length == 0) {
            return Optional.empty();
        }
        return Optional.of(new PriceThresholds(
            quantile(prices, LOWER_QUANTILE),
            quantile(prices, UPPER_QUANTILE),
            prices[0],
            prices[prices.length - 1]
        ));
    }

    /** Tier of a single price against precomputed thresholds. */
    public static PriceSegment segmentOf(double price, PriceThresholds t) {
        if (!Double.isFinite(price)) {
            return PriceSegment.UNDEFINED;
        }
        if (t.percentilesDistinct()) {
            if (price <= t.p25()) return PriceSegment.LOW;
            if (price <= t.p75()) return PriceSegment.MEDIUM;
            return PriceSegment.HIGH;
        }
        if (t.uniform()) {
            return PriceSegment.MEDIUM;
        }
        return price < t.midpoint() ? PriceSegment.LOW : PriceSegment.HIGH;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    /**
     * Quantile with linear interpolation between the two closest ranks.
     *
     * @param sorted ascending, non-empty
     */
    static double quantile(double[] sorted, double q) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
