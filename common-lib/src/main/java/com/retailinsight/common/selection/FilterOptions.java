package com.retailinsight.common.selection;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.retailinsight.common.model.PriceSegment;
import com.retailinsight.common.model.ProductRow;

import java.util.List;
import java.util.Objects;

/**
 * Values offered by the cascading filter controls.
 *
 * <p>Categories come from the whole set; segments from the rows left after the category
 * choice; product names from the rows left after category and segment.
 */
public record FilterOptions(
    @JsonProperty("categories") List<String> categories,
    @JsonProperty("segments")   List<PriceSegment> segments,
    @JsonProperty("products")   List<String> products
) {
    public static FilterOptions of(List<ProductRow> rows, String category, PriceSegment segment) {
        List<ProductRow> byCategory = new ProductSelection(category, null, null).apply(rows);
        List<ProductRow> bySegment  = new ProductSelection(category, segment, null).apply(rows);

        List<String> categories = rows.stream()
            .map(ProductRow::category)
            .distinct()
            .sorted()
            .toList();
        List<PriceSegment> segments = byCategory.stream()
            .map(ProductRow::segment)
            .filter(Objects::nonNull)
            .distinct()
            .sorted()
            .toList();
        List<String> products = bySegment.stream()
            .map(ProductRow::name)
            .distinct()
            .sorted()
            .toList();
        return new FilterOptions(categories, segments, products);
    }
}
