package com.retailinsight.common.window;

import com.retailinsight.common.aggregate.MovementAggregator;
import com.retailinsight.common.aggregate.MovementTotals;
import com.retailinsight.common.model.DateRange;
import com.retailinsight.common.model.InventoryMetrics;
import com.retailinsight.common.model.MovementEntry;
import com.retailinsight.common.model.ProductRow;
import com.retailinsight.common.model.SalesMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recomputes per-product sales and inventory metrics restricted to an inclusive date range.
 *
 * <p>For every row the movement list is cut to {@code start <= date <= end} and
 * {@code quantitySold}, {@code stockRemaining}, {@code revenue} and {@code stockRevenue} are
 * recomputed from the cut list only, with the same floor-at-zero policy as the lifetime
 * totals ({@link MovementAggregator}). Lifetime totals and the segment are carried over
 * untouched; the input snapshot is never modified.
 *
 * <p>{@code start > end} is not an error: every row ends up with no movements and zero metrics.
 *
 * <p>A row whose recomputation throws keeps its pre-filter values and its id is reported in
 * {@link WindowResult#fallbackIds()}. The batch never aborts.
 */
public final class WindowRecomputationEngine {

    private WindowRecomputationEngine() {}

    public static WindowResult recompute(List<ProductRow> products, DateRange range) {
        Objects.requireNonNull(range, "range");
        if (products == null || products.isEmpty()) {
            return new WindowResult(List.of(), List.of());
        }
        List<ProductRow> rows = new ArrayList<>(products.size());
        List<String> fallbacks = new ArrayList<>();
        for (ProductRow row : products) {
            try {
                rows.add(recomputeRow(row, range));
            } catch (RuntimeException e) {
                rows.add(row);
                fallbacks.add(row.id());
            }
        }
        return new WindowResult(rows, fallbacks);
    }

    static ProductRow recomputeRow(ProductRow row, DateRange range) {
        List<MovementEntry> inWindow = new ArrayList<>();
        for (MovementEntry entry : row.movements()) {
            if (range.contains(entry.date())) {
                inWindow.add(entry);
            }
        }
        MovementTotals totals = MovementAggregator.sum(inWindow);
        return row.withWindow(
            inWindow,
            new SalesMetrics(totals.sold(), MovementAggregator.revenue(row.price(), totals.sold())),
            new InventoryMetrics(totals.stockIncreased(), MovementAggregator.revenue(row.price(), totals.stockIncreased()))
        );
    }
}
