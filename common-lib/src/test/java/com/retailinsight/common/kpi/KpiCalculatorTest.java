package com.retailinsight.common.kpi;

import com.retailinsight.common.model.DisplayMode;
import com.retailinsight.common.model.PriceSegment;
import com.retailinsight.common.model.ProductRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.retailinsight.common.TestRows.move;
import static com.retailinsight.common.TestRows.row;
import static org.junit.jupiter.api.Assertions.*;

class KpiCalculatorTest {

    private final List<ProductRow> rows = List.of(
        row("1", "c", 1000, PriceSegment.LOW, List.of(move("2025-03-10", 5, 0))),
        row("2", "c", 5000, PriceSegment.HIGH, List.of(move("2025-04-01", 3, 2))),
        row("3", "c", 9000, PriceSegment.HIGH, List.of()));

    @Nested
    @DisplayName("compute()")
    class ComputeTests {

        @Test
        @DisplayName("sales mode totals, average over selling products, top seller")
        void salesMode() {
            KpiSummary kpis = KpiCalculator.compute(rows, DisplayMode.SALES);
            assertEquals(20_000.0, kpis.totalValue());
            assertEquals(8.0, kpis.totalQuantity());
            assertEquals(3000.0, kpis.averagePrice());
            assertEquals("Product 1", kpis.topProduct());
        }

        @Test
        @DisplayName("inventory mode reads stock figures")
        void inventoryMode() {
            KpiSummary kpis = KpiCalculator.compute(rows, DisplayMode.INVENTORY);
            assertEquals(10_000.0, kpis.totalValue());
            assertEquals(2.0, kpis.totalQuantity());
            assertEquals(5000.0, kpis.averagePrice());
            assertEquals("Product 2", kpis.topProduct());
        }

        @Test
        @DisplayName("no activity → zero average and no top product")
        void noActivity() {
            KpiSummary kpis = KpiCalculator.compute(List.of(rows.get(2)), DisplayMode.SALES);
            assertEquals(0.0, kpis.averagePrice());
            assertNull(kpis.topProduct());
        }

        @Test
        @DisplayName("empty set → EMPTY")
        void empty() {
            assertEquals(KpiSummary.EMPTY, KpiCalculator.compute(List.of(), DisplayMode.SALES));
        }
    }

    @Nested
    @DisplayName("ProductRanking.of()")
    class RankingTests {

        @Test
        @DisplayName("only moving products are ranked; top descending, slow ascending")
        void ranks() {
            ProductRanking ranking = ProductRanking.of(rows, DisplayMode.SALES);
            assertEquals(List.of("1", "2"), ranking.top().stream().map(ProductRanking.RankedProduct::id).toList());
            assertEquals(List.of("2", "1"), ranking.slow().stream().map(ProductRanking.RankedProduct::id).toList());
        }

        @Test
        @DisplayName("limit caps both lists")
        void limit() {
            ProductRanking ranking = ProductRanking.of(rows, DisplayMode.SALES, 1);
            assertEquals(1, ranking.top().size());
            assertEquals(1, ranking.slow().size());
            assertEquals(5.0, ranking.top().get(0).quantity());
        }
    }
}
