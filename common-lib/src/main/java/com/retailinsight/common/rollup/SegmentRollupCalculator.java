package com.retailinsight.common.rollup;

import com.retailinsight.common.model.DisplayMode;
import com.retailinsight.common.model.ModeMetrics;
import com.retailinsight.common.model.PriceSegment;
import com.retailinsight.common.model.ProductRow;
import com.retailinsight.common.model.SegmentSummary;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups a (possibly windowed) product set by price tier and computes per-tier totals and
 * percentage shares for the active {@link DisplayMode}.
 *
 * <p>The result always has exactly three rows in {@link PriceSegment#DISPLAY_ORDER};
 * tiers absent from the input are synthesized with zeros. Rows tagged
 * {@link PriceSegment#UNDEFINED} belong to no slice and do not count towards the totals.
 *
 * <p>{@code share = part / total × 100}, rounded to one decimal; 0 when the total is 0.
 */
public final class SegmentRollupCalculator {

    private SegmentRollupCalculator() {}

    public static List<SegmentSummary> rollup(List<ProductRow> products, DisplayMode mode) {
        Objects.requireNonNull(mode, "mode");

        Map<PriceSegment, double[]> sums = new EnumMap<>(PriceSegment.class);
        for (PriceSegment segment : PriceSegment.DISPLAY_ORDER) {
            sums.put(segment, new double[2]);
        }
        if (products != null) {
            for (ProductRow row : products) {
                double[] acc = sums.get(row.segment());
                if (acc == null) continue;
                ModeMetrics metrics = mode.metricsOf(row);
                acc[0] += metrics.quantity();
                acc[1] += metrics.value();
            }
        }

        double totalQuantity = 0.0;
        double totalValue = 0.0;
        for (double[] acc : sums.values()) {
            totalQuantity += acc[0];
            totalValue += acc[1];
        }

        List<SegmentSummary> summaries = new ArrayList<>(PriceSegment.DISPLAY_ORDER.size());
        for (PriceSegment segment : PriceSegment.DISPLAY_ORDER) {
            double[] acc = sums.get(segment);
            summaries.add(new SegmentSummary(
                segment,
                acc[0],
                acc[1],
                share(acc[1], totalValue),
                share(acc[0], totalQuantity)
            ));
        }
        return summaries;
    }

    static double share(double part, double total) {
        if (total <= 0) {
            return 0.0;
        }
        return Math.round(part / total * 1000.0) / 10.0;
    }
}
