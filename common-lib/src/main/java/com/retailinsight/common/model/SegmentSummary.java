package com.retailinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One slice of the per-tier rollup. In inventory mode {@code quantitySold} carries the
 * stock added and {@code revenue} the stock revenue, so consumers render one shape.
 */
public record SegmentSummary(
    @JsonProperty("segment")       PriceSegment segment,
    @JsonProperty("quantity_sold") double quantitySold,
    @JsonProperty("revenue")       double revenue,
    @JsonProperty("revenue_pct")   double revenuePct,
    @JsonProperty("quantity_pct")  double quantityPct
) {
    public static SegmentSummary empty(PriceSegment segment) {
        return new SegmentSummary(segment, 0, 0, 0.0, 0.0);
    }

    @JsonProperty("label")
    public String label() {
        return segment.label();
    }
}
