package com.retailinsight.common.window;

import com.retailinsight.common.model.ProductRow;

import java.util.List;

/**
 * Output of {@link WindowRecomputationEngine#recompute}.
 *
 * @param rows            one row per input row, same order
 * @param fallbackIds     ids of rows whose recomputation failed and which kept their
 *                        pre-filter values
 */
public record WindowResult(
    List<ProductRow> rows,
    List<String> fallbackIds
) {
    public WindowResult {
        rows = List.copyOf(rows);
        fallbackIds = List.copyOf(fallbackIds);
    }

    public int fallbackCount() {
        return fallbackIds.size();
    }

    /** {@code true} when no row has a single movement inside the window. */
    public boolean hasNoMovements() {
        return rows.stream().allMatch(r -> r.movements().isEmpty());
    }
}
