package com.retailinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sales-mode metric pair of a {@link ProductRow}.
 */
public record SalesMetrics(
    @JsonProperty("quantity_sold") double quantitySold,
    @JsonProperty("revenue")       double revenue
) implements ModeMetrics {

    public static final SalesMetrics ZERO = new SalesMetrics(0, 0);

    @Override
    public double quantity() {
        return quantitySold;
    }

    @Override
    public double value() {
        return revenue;
    }
}
