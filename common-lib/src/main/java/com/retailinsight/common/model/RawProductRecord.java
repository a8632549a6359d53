package com.retailinsight.common.model;

import java.util.List;

/**
 * Product record as delivered by the data source, before any validation.
 *
 * <p>Every field may be {@code null}. {@code price} is kept as the raw value (usually a
 * {@link Number}); {@code stockHistory} elements are expected to be maps with the keys
 * {@code date}, {@code stock_decreased} and {@code stock_increased}, but nothing is assumed.
 */
public record RawProductRecord(
    String id,
    String name,
    String category,
    Object price,
    String promotion,
    List<?> stockHistory
) {}
