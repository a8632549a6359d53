package com.retailinsight.common.kpi;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.retailinsight.common.model.DisplayMode;
import com.retailinsight.common.model.ProductRow;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Best and slowest movers among products with a positive mode quantity.
 * Ties keep input order.
 */
public record ProductRanking(
    @JsonProperty("top")  List<RankedProduct> top,
    @JsonProperty("slow") List<RankedProduct> slow
) {
    public static final int DEFAULT_LIMIT = 5;

    public record RankedProduct(
        @JsonProperty("id")       String id,
        @JsonProperty("name")     String name,
        @JsonProperty("quantity") double quantity
    ) {}

    public static ProductRanking of(List<ProductRow> products, DisplayMode mode) {
        return of(products, mode, DEFAULT_LIMIT);
    }

    public static ProductRanking of(List<ProductRow> products, DisplayMode mode, int limit) {
        Objects.requireNonNull(mode, "mode");
        if (products == null || products.isEmpty()) {
            return new ProductRanking(List.of(), List.of());
        }
        List<RankedProduct> moving = products.stream()
            .filter(row -> mode.metricsOf(row).quantity() > 0)
            .map(row -> new RankedProduct(row.id(), row.name(), mode.metricsOf(row).quantity()))
            .toList();

        Comparator<RankedProduct> byQuantity = Comparator.comparingDouble(RankedProduct::quantity);
        List<RankedProduct> top = moving.stream()
            .sorted(byQuantity.reversed())
            .limit(limit)
            .toList();
        List<RankedProduct> slow = moving.stream()
            .sorted(byQuantity)
            .limit(limit)
            .toList();
        return new ProductRanking(top, slow);
    }
}
