package com.retailinsight.common.model;

import java.util.List;

/**
 * One product of the analytical table.
 *
 * <p>Lifetime totals ({@code totalSold}, {@code totalStockIncreased}) are fixed at load time.
 * {@code sales} and {@code inventory} start equal to the lifetime figures and are replaced by
 * windowed figures on every recomputation. Instances are never mutated; the {@code with*}
 * methods return copies.
 *
 * @param price     rounded to 0 decimals, never below 1000
 * @param movements validated movements, at most 50, in source order
 */
public record ProductRow(
    String id,
    String name,
    String category,
    double price,
    String promotion,
    List<MovementEntry> movements,
    double totalSold,
    double totalStockIncreased,
    SalesMetrics sales,
    InventoryMetrics inventory,
    PriceSegment segment
) {
    public ProductRow {
        movements = movements == null ? List.of() : List.copyOf(movements);
        sales     = sales == null ? SalesMetrics.ZERO : sales;
        inventory = inventory == null ? InventoryMetrics.ZERO : inventory;
        segment   = segment == null ? PriceSegment.UNDEFINED : segment;
    }

    public ProductRow withSegment(PriceSegment newSegment) {
        return new ProductRow(id, name, category, price, promotion, movements,
            totalSold, totalStockIncreased, sales, inventory, newSegment);
    }

    public ProductRow withWindow(List<MovementEntry> windowMovements,
                                 SalesMetrics windowSales,
                                 InventoryMetrics windowInventory) {
        return new ProductRow(id, name, category, price, promotion, windowMovements,
            totalSold, totalStockIncreased, windowSales, windowInventory, segment);
    }
}
