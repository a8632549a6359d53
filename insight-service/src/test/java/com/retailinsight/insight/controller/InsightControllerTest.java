package com.retailinsight.insight.controller;

import com.retailinsight.insight.InMemoryProductRecordSource;
import com.retailinsight.insight.MutableClock;
import com.retailinsight.insight.cache.SnapshotCache;
import com.retailinsight.insight.exception.InvalidQueryException;
import com.retailinsight.insight.exception.SourceUnavailableException;
import com.retailinsight.insight.service.DashboardService;
import com.retailinsight.insight.service.ProductSnapshotService;
import com.retailinsight.insight.source.ProductRecordSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class InsightControllerTest {

    private static WebTestClient clientFor(ProductRecordSource source) {
        SnapshotCache cache = new SnapshotCache(Duration.ofMinutes(10), new MutableClock(Instant.parse("2025-05-01T08:00:00Z")));
        ProductSnapshotService snapshots = new ProductSnapshotService(source, cache);
        InsightController controller = new InsightController(new DashboardService(snapshots), snapshots);
        return WebTestClient.bindToController(controller).build();
    }

    private final WebTestClient client = clientFor(
        InMemoryProductRecordSource.of(InMemoryProductRecordSource.sampleRecords()));

    @Nested
    @DisplayName("GET /dashboard")
    class DashboardTests {

        @Test
        @DisplayName("200 with the product table in snake_case columns")
        void ok() {
            client.get().uri("/api/v1/insights/dashboard?start=2025-03-01&end=2025-03-31")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state").isEqualTo("DATA")
                .jsonPath("$.range.start").isEqualTo("2025-03-01")
                .jsonPath("$.segments.length()").isEqualTo(3)
                .jsonPath("$.products[0].total_sold").isEqualTo(5.0)
                .jsonPath("$.products[0].quantity_sold").isEqualTo(5.0)
                .jsonPath("$.products[1].quantity_sold").isEqualTo(0.0)
                .jsonPath("$.products[0].segment_label").isEqualTo("Thấp");
        }

        @Test
        @DisplayName("localized mode and segment labels are accepted")
        void localizedParams() {
            client.get().uri(b -> b.path("/api/v1/insights/dashboard")
                    .queryParam("mode", "Tồn kho")
                    .queryParam("segment", "Cao")
                    .build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.mode").isEqualTo("INVENTORY")
                .jsonPath("$.products.length()").isEqualTo(1)
                .jsonPath("$.products[0].name").isEqualTo("Cheese");
        }

        @Test
        @DisplayName("no movement in range → 200 with EMPTY state")
        void empty() {
            client.get().uri("/api/v1/insights/dashboard?start=2024-01-01&end=2024-01-31")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state").isEqualTo("EMPTY")
                .jsonPath("$.kpis.totalQuantity").isEqualTo(0.0);
        }

        @Test
        @DisplayName("unknown mode → 400")
        void badMode() {
            client.get().uri("/api/v1/insights/dashboard?mode=both")
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("unparsable date → 400")
        void badDate() {
            client.get().uri("/api/v1/insights/dashboard?start=05/03/2025")
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("source down → 503")
        void sourceDown() {
            WebTestClient down = clientFor(InMemoryProductRecordSource.failing(
                new SourceUnavailableException("memory:products", "down", new RuntimeException("refused"))));
            down.get().uri("/api/v1/insights/dashboard")
                .exchange()
                .expectStatus().isEqualTo(503);
        }
    }

    @Test
    @DisplayName("GET /filters returns options and date bounds")
    void filters() {
        client.get().uri("/api/v1/insights/filters?category=Dairy")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.options.categories[0]").isEqualTo("Dairy")
            .jsonPath("$.dateBounds.min_date").isEqualTo("2025-03-10")
            .jsonPath("$.defaultWindow.end").isEqualTo("2025-04-01");
    }

    @Test
    @DisplayName("GET /filters with an unknown segment → 400")
    void filtersBadSegment() {
        client.get().uri("/api/v1/insights/filters?segment=premium")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("POST /snapshot/invalidate → 204")
    void invalidate() {
        client.post().uri("/api/v1/insights/snapshot/invalidate")
            .exchange()
            .expectStatus().isNoContent();
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        client.get().uri("/api/v1/insights/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }

    @Nested
    @DisplayName("parameter parsing")
    class ParsingTests {

        @Test
        @DisplayName("blank segment and date mean absent")
        void blanks() {
            assertNull(InsightController.parseSegment(" "));
            assertNull(InsightController.parseDate("start", ""));
        }

        @Test
        @DisplayName("errors name the offending parameter")
        void namesParameter() {
            InvalidQueryException e = assertThrows(InvalidQueryException.class,
                () -> InsightController.parseDate("end", "2025-13-01"));
            assertEquals("end", e.getParameter());
            assertEquals(LocalDate.of(2025, 3, 5), InsightController.parseDate("start", "2025-03-05"));
        }
    }
}
