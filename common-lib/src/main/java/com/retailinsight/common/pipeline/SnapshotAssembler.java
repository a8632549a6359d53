package com.retailinsight.common.pipeline;

import com.retailinsight.common.model.DateBounds;
import com.retailinsight.common.model.ProductRow;
import com.retailinsight.common.model.ProductSnapshot;
import com.retailinsight.common.model.RawProductRecord;
import com.retailinsight.common.normalize.ProductRecordNormalizer;
import com.retailinsight.common.segment.PriceSegmentClassifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Load-time half of the engine: normalize every raw record (lifetime totals included),
 * classify the resulting set by price tier, and observe the date bounds.
 *
 * <p>Runs once per data load. The returned snapshot is immutable and is what every
 * subsequent window recomputation reads.
 */
public final class SnapshotAssembler {

    private SnapshotAssembler() {}

    public static ProductSnapshot assemble(Iterable<RawProductRecord> records) {
        List<ProductRow> rows = new ArrayList<>();
        int skipped = 0;
        if (records != null) {
            for (RawProductRecord raw : records) {
                Optional<ProductRow> row = ProductRecordNormalizer.normalize(raw);
                if (row.isPresent()) {
                    rows.add(row.get());
                } else {
                    skipped++;
                }
            }
        }
        List<ProductRow> classified = PriceSegmentClassifier.classify(rows);
        return new ProductSnapshot(classified, DateBounds.observe(classified), skipped);
    }
}
