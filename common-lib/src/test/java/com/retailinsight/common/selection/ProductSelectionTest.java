package com.retailinsight.common.selection;

import com.retailinsight.common.model.PriceSegment;
import com.retailinsight.common.model.ProductRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.retailinsight.common.TestRows.row;
import static org.junit.jupiter.api.Assertions.*;

class ProductSelectionTest {

    private final List<ProductRow> rows = List.of(
        row("1", "Dairy", 1000, PriceSegment.LOW, List.of()),
        row("2", "Dairy", 5000, PriceSegment.HIGH, List.of()),
        row("3", "Bakery", 3000, PriceSegment.MEDIUM, List.of()),
        row("4", "Bakery", 1000, PriceSegment.LOW, List.of()));

    private static List<String> ids(List<ProductRow> rows) {
        return rows.stream().map(ProductRow::id).toList();
    }

    @Test
    @DisplayName("ALL keeps every row")
    void all() {
        assertEquals(List.of("1", "2", "3", "4"), ids(ProductSelection.ALL.apply(rows)));
    }

    @Test
    @DisplayName("blank criteria mean all")
    void blankIsAll() {
        assertEquals(ProductSelection.ALL, new ProductSelection("  ", null, ""));
    }

    @Test
    @DisplayName("category and segment combine")
    void categoryAndSegment() {
        assertEquals(List.of("1"), ids(new ProductSelection("Dairy", PriceSegment.LOW, null).apply(rows)));
        assertEquals(List.of("1", "4"), ids(new ProductSelection(null, PriceSegment.LOW, null).apply(rows)));
    }

    @Test
    @DisplayName("product name filter")
    void productName() {
        assertEquals(List.of("3"), ids(new ProductSelection(null, null, "Product 3").apply(rows)));
    }

    @Test
    @DisplayName("no match → empty list")
    void noMatch() {
        assertTrue(new ProductSelection("Frozen", null, null).apply(rows).isEmpty());
    }

    @Test
    @DisplayName("filter options cascade: segments follow category, products follow both")
    void filterOptions() {
        FilterOptions options = FilterOptions.of(rows, "Dairy", PriceSegment.HIGH);
        assertEquals(List.of("Bakery", "Dairy"), options.categories());
        assertEquals(List.of(PriceSegment.LOW, PriceSegment.HIGH), options.segments());
        assertEquals(List.of("Product 2"), options.products());
    }
}
