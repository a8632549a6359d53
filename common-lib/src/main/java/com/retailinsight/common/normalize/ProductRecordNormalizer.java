package com.retailinsight.common.normalize;

import com.retailinsight.common.aggregate.MovementAggregator;
import com.retailinsight.common.aggregate.MovementTotals;
import com.retailinsight.common.model.InventoryMetrics;
import com.retailinsight.common.model.MovementEntry;
import com.retailinsight.common.model.PriceSegment;
import com.retailinsight.common.model.ProductRow;
import com.retailinsight.common.model.RawProductRecord;
import com.retailinsight.common.model.SalesMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pure transform of one {@link RawProductRecord} into a canonical {@link ProductRow}.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>Price: rejected when missing, non-numeric, non-finite, {@code <= 0} or
 *       {@code >= 1e9}. The source already filters these; the check repeats here.
 *       Accepted prices are rounded to 0 decimals and floored at {@value #MIN_PRICE}.</li>
 *   <li>History: only the first {@value #MAX_MOVEMENTS} raw elements are considered
 *       (the source adapter has already cut at 100).</li>
 *   <li>Each element is parsed by {@link MovementEntryParser}; malformed ones are dropped
 *       without affecting the rest of the record.</li>
 *   <li>Lifetime totals via {@link MovementAggregator}; the initial sales/inventory metrics
 *       equal the lifetime figures.</li>
 * </ol>
 *
 * <p>Text fields default to {@code ""}. The segment stays {@link PriceSegment#UNDEFINED}
 * until classification. Never throws.
 */
public final class ProductRecordNormalizer {

    public static final double MIN_PRICE = 1000;
    public static final double MAX_PRICE_EXCLUSIVE = 1_000_000_000;
    public static final int MAX_MOVEMENTS = 50;

    private ProductRecordNormalizer() {}

    public static Optional<ProductRow> normalize(RawProductRecord raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Double rawPrice = validPrice(raw.price());
        if (rawPrice == null) {
            return Optional.empty();
        }
        double price = Math.max(MIN_PRICE, Math.rint(rawPrice));

        List<MovementEntry> movements = parseMovements(raw.stockHistory());
        MovementTotals totals = MovementAggregator.sum(movements);

        return Optional.of(new ProductRow(
            textOrEmpty(raw.id()),
            textOrEmpty(raw.name()),
            textOrEmpty(raw.category()),
            price,
            textOrEmpty(raw.promotion()),
            movements,
            totals.sold(),
            totals.stockIncreased(),
            new SalesMetrics(totals.sold(), MovementAggregator.revenue(price, totals.sold())),
            new InventoryMetrics(totals.stockIncreased(), MovementAggregator.revenue(price, totals.stockIncreased())),
            PriceSegment.UNDEFINED
        ));
    }

    static Double validPrice(Object raw) {
        if (!(raw instanceof Number number)) {
            return null;
        }
        double value = number.doubleValue();
        if (!Double.isFinite(value) || value <= 0 || value >= MAX_PRICE_EXCLUSIVE) {
            return null;
        }
        return value;
    }

    static List<MovementEntry> parseMovements(List<?> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        List<?> retained = history.subList(0, Math.min(MAX_MOVEMENTS, history.size()));
        List<MovementEntry> parsed = new ArrayList<>(retained.size());
        for (Object element : retained) {
            MovementEntryParser.parse(element).ifPresent(parsed::add);
        }
        return parsed;
    }

    private static String textOrEmpty(String value) {
        return value == null ? "" : value;
    }
}
