package com.retailinsight.insight.service;

import com.retailinsight.common.model.ProductSnapshot;
import com.retailinsight.common.pipeline.SnapshotAssembler;
import com.retailinsight.insight.cache.CachedSnapshot;
import com.retailinsight.insight.cache.SnapshotCache;
import com.retailinsight.insight.source.ProductRecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Loads the product snapshot: normalize → lifetime totals → price tiers, once per TTL window.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Check {@link SnapshotCache} for a non-expired entry under the source identity.</li>
 *   <li>On hit → return the cached snapshot (no query).</li>
 *   <li>On miss → fetch every record from {@link ProductRecordSource}, assemble the snapshot,
 *       store it and return it.</li>
 * </ol>
 *
 * <p>A source failure propagates to the caller and nothing is cached.
 */
@Service
public class ProductSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(ProductSnapshotService.class);

    private final ProductRecordSource source;
    private final SnapshotCache cache;

    public ProductSnapshotService(ProductRecordSource source, SnapshotCache cache) {
        this.source = source;
        this.cache  = cache;
    }

    public Mono<ProductSnapshot> getSnapshot() {
        String key = source.identity();

        return Mono.defer(() -> {
            CachedSnapshot cached = cache.get(key);

            if (cached != null) {
                log.info("CACHE_HIT key={} fetchedAt={}", key, cached.fetchedAt());
                return Mono.just(cached.snapshot());
            }

            log.info("CACHE_MISS key={}", key);
            return source.fetchAll()
                .collectList()
                .map(SnapshotAssembler::assemble)
                .doOnSuccess(snapshot -> {
                    log.info("SNAPSHOT_LOADED key={} products={} skipped={} dates={}..{}",
                             key, snapshot.products().size(), snapshot.skippedRecords(),
                             snapshot.dateBounds().min(), snapshot.dateBounds().max());
                    if (snapshot.isEmpty()) {
                        log.warn("SNAPSHOT_EMPTY key={} skipped={}", key, snapshot.skippedRecords());
                    }
                    cache.put(key, snapshot);
                });
        });
    }

    /** Drops the cached snapshot so the next request reloads from the source. */
    public void invalidate() {
        cache.evict(source.identity());
    }
}
