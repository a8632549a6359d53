package com.retailinsight.insight.source;

import com.retailinsight.common.model.RawProductRecord;

import java.util.List;

/**
 * Maps a {@link ProductDocument} to the engine's {@link RawProductRecord} without validating
 * anything beyond Java types: text fields are stringified, a non-list history becomes
 * {@code null}. Validation is the normalizer's job.
 */
public final class ProductDocumentMapper {

    private ProductDocumentMapper() {}

    public static RawProductRecord toRawRecord(ProductDocument doc) {
        return new RawProductRecord(
            doc.getId(),
            text(doc.getName()),
            text(doc.getCategory()),
            doc.getPrice(),
            text(doc.getPromotion()),
            doc.getStockHistory() instanceof List<?> history ? history : null
        );
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
