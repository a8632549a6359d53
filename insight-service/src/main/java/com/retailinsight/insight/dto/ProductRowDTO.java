package com.retailinsight.insight.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.retailinsight.common.model.MovementEntry;
import com.retailinsight.common.model.PriceSegment;
import com.retailinsight.common.model.ProductRow;

import java.util.List;

/**
 * Flat product table row handed to the presentation layer.
 */
public record ProductRowDTO(
    @JsonProperty("id")                    String id,
    @JsonProperty("name")                  String name,
    @JsonProperty("category")              String category,
    @JsonProperty("price")                 double price,
    @JsonProperty("promotion")             String promotion,
    @JsonProperty("total_sold")            double totalSold,
    @JsonProperty("revenue")               double revenue,
    @JsonProperty("total_stock_increased") double totalStockIncreased,
    @JsonProperty("stock_revenue")         double stockRevenue,
    @JsonProperty("movements")             List<MovementEntry> movements,
    @JsonProperty("segment")               PriceSegment segment,
    @JsonProperty("segment_label")         String segmentLabel,
    @JsonProperty("quantity_sold")         double quantitySold,
    @JsonProperty("stock_remaining")       double stockRemaining
) {
    public static ProductRowDTO from(ProductRow row) {
        return new ProductRowDTO(
            row.id(), row.name(), row.category(), row.price(), row.promotion(),
            row.totalSold(), row.sales().revenue(),
            row.totalStockIncreased(), row.inventory().stockRevenue(),
            row.movements(), row.segment(), row.segment().label(),
            row.sales().quantitySold(), row.inventory().stockRemaining()
        );
    }
}
