package com.retailinsight.common.selection;

import com.retailinsight.common.model.PriceSegment;
import com.retailinsight.common.model.ProductRow;

import java.util.List;

/**
 * Category / tier / product-name filter applied to a snapshot before windowing.
 *
 * <p>A {@code null} (or blank) criterion means "all". Criteria are applied in the order
 * category → segment → product name, matching the cascade of the filter controls.
 */
public record ProductSelection(
    String category,
    PriceSegment segment,
    String productName
) {
    public static final ProductSelection ALL = new ProductSelection(null, null, null);

    public ProductSelection {
        category = blankToNull(category);
        productName = blankToNull(productName);
    }

    public boolean matches(ProductRow row) {
        return (category == null || category.equals(row.category()))
            && (segment == null || segment == row.segment())
            && (productName == null || productName.equals(row.name()));
    }

    public List<ProductRow> apply(List<ProductRow> rows) {
        if (rows == null) return List.of();
        return rows.stream().filter(this::matches).toList();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
