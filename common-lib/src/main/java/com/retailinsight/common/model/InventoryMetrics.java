package com.retailinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inventory-mode metric pair of a {@link ProductRow}.
 */
public record InventoryMetrics(
    @JsonProperty("stock_remaining") double stockRemaining,
    @JsonProperty("stock_revenue")   double stockRevenue
) implements ModeMetrics {

    public static final InventoryMetrics ZERO = new InventoryMetrics(0, 0);

    @Override
    public double quantity() {
        return stockRemaining;
    }

    @Override
    public double value() {
        return stockRevenue;
    }
}
