package com.retailinsight.common.model;

/**
 * Common read view over {@link SalesMetrics} and {@link InventoryMetrics}, so rollups and
 * KPIs can be written once and parameterized by {@link DisplayMode}.
 */
public interface ModeMetrics {

    /** Units sold (sales) or units added to stock (inventory). */
    double quantity();

    /** {@code price × quantity}, rounded to 0 decimals. */
    double value();
}
