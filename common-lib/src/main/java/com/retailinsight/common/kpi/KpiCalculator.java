package com.retailinsight.common.kpi;

import com.retailinsight.common.model.DisplayMode;
import com.retailinsight.common.model.ModeMetrics;
import com.retailinsight.common.model.ProductRow;

import java.util.List;
import java.util.Objects;

/**
 * Computes the dashboard headline figures for a product set.
 *
 * <p>Average price only counts products active in the mode: quantity sold {@code > 0} in
 * {@link DisplayMode#SALES}, stock revenue {@code > 0} in {@link DisplayMode#INVENTORY}.
 */
public final class KpiCalculator {

    private KpiCalculator() {}

    public static KpiSummary compute(List<ProductRow> products, DisplayMode mode) {
        Objects.requireNonNull(mode, "mode");
        if (products == null || products.isEmpty()) {
            return KpiSummary.EMPTY;
        }

        double totalValue = 0.0;
        double totalQuantity = 0.0;
        double activePriceSum = 0.0;
        int activeCount = 0;
        ProductRow top = null;

        for (ProductRow row : products) {
            ModeMetrics metrics = mode.metricsOf(row);
            totalValue += metrics.value();
            totalQuantity += metrics.quantity();

            boolean active = mode == DisplayMode.SALES ? metrics.quantity() > 0 : metrics.value() > 0;
            if (active) {
                activePriceSum += row.price();
                activeCount++;
            }
            if (top == null || metrics.quantity() > mode.metricsOf(top).quantity()) {
                top = row;
            }
        }

        double averagePrice = activeCount > 0 ? activePriceSum / activeCount : 0.0;
        String topProduct = totalQuantity > 0 ? top.name() : null;
        return new KpiSummary(totalValue, totalQuantity, averagePrice, topProduct);
    }
}
