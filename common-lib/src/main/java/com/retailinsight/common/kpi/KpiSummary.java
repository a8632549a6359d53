package com.retailinsight.common.kpi;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Headline figures for the active display mode.
 *
 * @param topProduct name of the product with the largest mode quantity; {@code null} when
 *                   the quantity total is 0
 */
public record KpiSummary(
    @JsonProperty("totalValue")    double totalValue,
    @JsonProperty("totalQuantity") double totalQuantity,
    @JsonProperty("averagePrice")  double averagePrice,
    @JsonProperty("topProduct")    String topProduct
) {
    public static final KpiSummary EMPTY = new KpiSummary(0, 0, 0, null);
}
