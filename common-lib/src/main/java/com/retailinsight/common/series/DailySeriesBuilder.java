package com.retailinsight.common.series;

import com.retailinsight.common.model.DateRange;
import com.retailinsight.common.model.DisplayMode;
import com.retailinsight.common.model.MovementEntry;
import com.retailinsight.common.model.ProductRow;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds the per-day series for the active mode over the movements inside a date range.
 *
 * <p>Per date: quantity is the sum of the mode's per-entry quantity (floor at zero); the
 * price is the mean product price across contributing entries; value is their product
 * truncated to a whole number. Dates are ascending; dates without entries are omitted.
 */
public final class DailySeriesBuilder {

    private DailySeriesBuilder() {}

    public static List<DailyPoint> build(List<ProductRow> products, DateRange range, DisplayMode mode) {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(mode, "mode");
        if (products == null || products.isEmpty()) {
            return List.of();
        }

        // date → {quantity, priceSum, entryCount}
        Map<LocalDate, double[]> byDate = new TreeMap<>();
        for (ProductRow row : products) {
            for (MovementEntry entry : row.movements()) {
                if (!range.contains(entry.date())) continue;
                double[] acc = byDate.computeIfAbsent(entry.date(), d -> new double[3]);
                double quantity = mode.quantityOf(entry);
                acc[0] += Double.isFinite(quantity) && quantity > 0 ? quantity : 0.0;
                acc[1] += row.price();
                acc[2] += 1;
            }
        }

        List<DailyPoint> points = new ArrayList<>(byDate.size());
        byDate.forEach((date, acc) -> {
            double averagePrice = acc[1] / acc[2];
            long value = Math.max(0L, (long) (acc[0] * averagePrice));
            points.add(new DailyPoint(date, acc[0], averagePrice, value));
        });
        return points;
    }
}
