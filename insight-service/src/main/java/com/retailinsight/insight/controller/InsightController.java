package com.retailinsight.insight.controller;

import com.retailinsight.common.model.DisplayMode;
import com.retailinsight.common.model.PriceSegment;
import com.retailinsight.common.selection.ProductSelection;
import com.retailinsight.insight.dto.DashboardViewDTO;
import com.retailinsight.insight.dto.FiltersDTO;
import com.retailinsight.insight.exception.InsightException;
import com.retailinsight.insight.exception.InvalidQueryException;
import com.retailinsight.insight.model.DashboardQuery;
import com.retailinsight.insight.service.DashboardService;
import com.retailinsight.insight.service.ProductSnapshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Read-only API consumed by the dashboard front end.
 *
 * <p>400 for unparsable parameters, 503 when the data source is unavailable. An empty
 * selection is a 200 with {@code state = EMPTY}.
 */
@RestController
@RequestMapping("/api/v1/insights")
public class InsightController {

    private static final Logger log = LoggerFactory.getLogger(InsightController.class);

    private final DashboardService dashboardService;
    private final ProductSnapshotService snapshotService;

    public InsightController(DashboardService dashboardService, ProductSnapshotService snapshotService) {
        this.dashboardService = dashboardService;
        this.snapshotService  = snapshotService;
    }

    @GetMapping("/dashboard")
    public Mono<ResponseEntity<DashboardViewDTO>> dashboard(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String segment,
            @RequestParam(required = false) String product,
            @RequestParam(defaultValue = "SALES") String mode,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end) {
        log.info("Dashboard query received. category={} segment={} product={} mode={} start={} end={}",
                 category, segment, product, mode, start, end);
        return Mono.defer(() -> {
                DashboardQuery query = new DashboardQuery(
                    new ProductSelection(category, parseSegment(segment), product),
                    parseMode(mode),
                    parseDate("start", start),
                    parseDate("end", end));
                return dashboardService.getDashboard(query);
            })
            .map(ResponseEntity::ok)
            .onErrorResume(InsightException.class, e -> Mono.just(InsightController.<DashboardViewDTO>failure(e)));
    }

    @GetMapping("/filters")
    public Mono<ResponseEntity<FiltersDTO>> filters(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String segment) {
        log.info("Filter options query received. category={} segment={}", category, segment);
        return Mono.defer(() -> dashboardService.getFilters(category, parseSegment(segment)))
            .map(ResponseEntity::ok)
            .onErrorResume(InsightException.class, e -> Mono.just(InsightController.<FiltersDTO>failure(e)));
    }

    @PostMapping("/snapshot/invalidate")
    public Mono<ResponseEntity<Void>> invalidate() {
        log.info("Snapshot invalidation requested");
        snapshotService.invalidate();
        return Mono.just(ResponseEntity.noContent().<Void>build());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    private static <T> ResponseEntity<T> failure(InsightException e) {
        if (e.getKind() == InsightException.Kind.INVALID_QUERY) {
            log.warn("Rejected query. reason={}", e.getMessage());
        }
        return ResponseEntity.status(e.getKind().status()).build();
    }

    // ── parameter parsing ─────────────────────────────────────────────────

    static PriceSegment parseSegment(String text) {
        if (text == null || text.isBlank()) return null;
        PriceSegment segment = PriceSegment.fromText(text);
        if (segment == null) {
            throw new InvalidQueryException("segment", "Unknown segment: " + text);
        }
        return segment;
    }

    static DisplayMode parseMode(String text) {
        DisplayMode mode = DisplayMode.fromText(text);
        if (mode == null) {
            throw new InvalidQueryException("mode", "Unknown display mode: " + text);
        }
        return mode;
    }

    static LocalDate parseDate(String parameter, String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidQueryException(parameter, "Expected YYYY-MM-DD but got: " + text);
        }
    }
}
