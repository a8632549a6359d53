package com.retailinsight.common.aggregate;

import com.retailinsight.common.model.MovementEntry;

import java.util.List;

/**
 * Pure stateless summation of a product's movement list into sold / stock-increased totals.
 *
 * <p>Each entry contributes {@code max(0, value)}: a negative quantity in source data is a
 * zero contribution, not a reversing adjustment. Non-finite values also contribute zero.
 * Sums are rounded to 0 decimals after summation.
 *
 * <p>Used for lifetime totals at load time and, unchanged, for windowed totals, so that a
 * window covering the whole history reproduces the lifetime figures exactly.
 */
public final class MovementAggregator {

    private MovementAggregator() {}

    public static MovementTotals sum(List<MovementEntry> movements) {
        if (movements == null || movements.isEmpty()) {
            return MovementTotals.ZERO;
        }
        double sold = 0.0;
        double increased = 0.0;
        for (MovementEntry entry : movements) {
            sold      += floorAtZero(entry.stockDecreased());
            increased += floorAtZero(entry.stockIncreased());
        }
        return new MovementTotals(roundWhole(sold), roundWhole(increased));
    }

    /** {@code round(price × quantity)}, never negative. */
    public static double revenue(double price, double quantity) {
        return floorAtZero(roundWhole(price * quantity));
    }

    static double floorAtZero(double value) {
        return Double.isFinite(value) && value > 0 ? value : 0.0;
    }

    static double roundWhole(double value) {
        return Math.rint(value);
    }
}
