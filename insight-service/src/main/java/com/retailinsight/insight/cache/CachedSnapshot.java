package com.retailinsight.insight.cache;

import com.retailinsight.common.model.ProductSnapshot;

import java.time.Instant;

/**
 * Immutable cache entry: one loaded {@link ProductSnapshot} and the instant it was fetched.
 * Expiry is decided by {@link SnapshotCache#isExpired(CachedSnapshot)}.
 */
public record CachedSnapshot(
    ProductSnapshot snapshot,
    Instant fetchedAt
) {}
