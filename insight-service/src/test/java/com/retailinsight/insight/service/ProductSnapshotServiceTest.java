package com.retailinsight.insight.service;

import com.retailinsight.common.model.ProductSnapshot;
import com.retailinsight.insight.InMemoryProductRecordSource;
import com.retailinsight.insight.MutableClock;
import com.retailinsight.insight.cache.SnapshotCache;
import com.retailinsight.insight.exception.SourceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ProductSnapshotServiceTest {

    private MutableClock clock;
    private SnapshotCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-05-01T08:00:00Z"));
        cache = new SnapshotCache(Duration.ofMinutes(10), clock);
    }

    @Test
    @DisplayName("second call within TTL is served from cache")
    void cachedWithinTtl() {
        InMemoryProductRecordSource source = InMemoryProductRecordSource.of(InMemoryProductRecordSource.sampleRecords());
        ProductSnapshotService service = new ProductSnapshotService(source, cache);

        ProductSnapshot first = service.getSnapshot().block();
        clock.advance(Duration.ofMinutes(9));
        ProductSnapshot second = service.getSnapshot().block();

        assertSame(first, second);
        assertEquals(1, source.fetchCount());
        assertEquals(2, first.products().size());
    }

    @Test
    @DisplayName("expired entry triggers a refetch")
    void refetchAfterTtl() {
        InMemoryProductRecordSource source = InMemoryProductRecordSource.of(InMemoryProductRecordSource.sampleRecords());
        ProductSnapshotService service = new ProductSnapshotService(source, cache);

        service.getSnapshot().block();
        clock.advance(Duration.ofMinutes(10));
        service.getSnapshot().block();

        assertEquals(2, source.fetchCount());
    }

    @Test
    @DisplayName("invalidate forces the next call to reload")
    void invalidate() {
        InMemoryProductRecordSource source = InMemoryProductRecordSource.of(InMemoryProductRecordSource.sampleRecords());
        ProductSnapshotService service = new ProductSnapshotService(source, cache);

        service.getSnapshot().block();
        service.invalidate();
        service.getSnapshot().block();

        assertEquals(2, source.fetchCount());
    }

    @Test
    @DisplayName("source failure propagates and nothing is cached")
    void failureNotCached() {
        InMemoryProductRecordSource source = InMemoryProductRecordSource.failing(
            new SourceUnavailableException("memory:products", "down", new RuntimeException("refused")));
        ProductSnapshotService service = new ProductSnapshotService(source, cache);

        assertThrows(SourceUnavailableException.class, () -> service.getSnapshot().block());
        assertNull(cache.get(source.identity()));
    }
}
