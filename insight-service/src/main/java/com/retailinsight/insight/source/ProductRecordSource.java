package com.retailinsight.insight.source;

import com.retailinsight.common.model.RawProductRecord;
import reactor.core.publisher.Flux;

/**
 * Strategy interface for the product data source. The live implementation reads MongoDB;
 * tests plug in in-memory records.
 *
 * <p>Contract: records are pre-filtered to {@code 0 < price < 1e9} and carry at most
 * {@value #FETCH_HISTORY_LIMIT} history entries.
 */
public interface ProductRecordSource {

    int FETCH_HISTORY_LIMIT = 100;

    /** Stable name of the source, used as the snapshot cache key. */
    String identity();

    /** Emits every product record; errors with {@code SourceUnavailableException} when unreachable. */
    Flux<RawProductRecord> fetchAll();
}
