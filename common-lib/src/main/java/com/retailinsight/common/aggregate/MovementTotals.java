package com.retailinsight.common.aggregate;

/**
 * Output of {@link MovementAggregator#sum}. Both values are non-negative whole numbers.
 *
 * @param sold           units out (sum of {@code stock_decreased})
 * @param stockIncreased units in (sum of {@code stock_increased})
 */
public record MovementTotals(double sold, double stockIncreased) {

    public static final MovementTotals ZERO = new MovementTotals(0, 0);
}
