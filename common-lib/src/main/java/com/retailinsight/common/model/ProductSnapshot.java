package com.retailinsight.common.model;

import java.util.List;

/**
 * Immutable result of one load: classified product rows plus their date bounds.
 * Shared read-only between every recomputation until the cache replaces it.
 *
 * @param skippedRecords raw records rejected by the normalizer (invalid price)
 */
public record ProductSnapshot(
    List<ProductRow> products,
    DateBounds dateBounds,
    int skippedRecords
) {
    public ProductSnapshot {
        products = products == null ? List.of() : List.copyOf(products);
        dateBounds = dateBounds == null ? DateBounds.DEFAULT : dateBounds;
    }

    public boolean isEmpty() {
        return products.isEmpty();
    }
}
