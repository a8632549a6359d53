package com.retailinsight.insight.service;

import com.retailinsight.common.kpi.KpiCalculator;
import com.retailinsight.common.kpi.ProductRanking;
import com.retailinsight.common.model.DateRange;
import com.retailinsight.common.model.PriceSegment;
import com.retailinsight.common.model.ProductRow;
import com.retailinsight.common.model.ProductSnapshot;
import com.retailinsight.common.rollup.SegmentRollupCalculator;
import com.retailinsight.common.selection.FilterOptions;
import com.retailinsight.common.series.DailySeriesBuilder;
import com.retailinsight.common.window.WindowRecomputationEngine;
import com.retailinsight.common.window.WindowResult;
import com.retailinsight.insight.dto.DashboardViewDTO;
import com.retailinsight.insight.dto.FiltersDTO;
import com.retailinsight.insight.dto.ProductRowDTO;
import com.retailinsight.insight.model.DashboardQuery;
import com.retailinsight.insight.model.ResultState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Per-request recomputation over the cached snapshot: selection → date window → rollup,
 * KPIs, ranking and daily series. Pure with respect to the snapshot; nothing is written back.
 */
@Service
public class DashboardService {

    private static final Logger log = LoggerFactory.getLogger(DashboardService.class);

    private final ProductSnapshotService snapshotService;

    public DashboardService(ProductSnapshotService snapshotService) {
        this.snapshotService = snapshotService;
    }

    public Mono<DashboardViewDTO> getDashboard(DashboardQuery query) {
        return snapshotService.getSnapshot()
            .map(snapshot -> compose(snapshot, query));
    }

    public Mono<FiltersDTO> getFilters(String category, PriceSegment segment) {
        return snapshotService.getSnapshot()
            .map(snapshot -> new FiltersDTO(
                FilterOptions.of(snapshot.products(), category, segment),
                snapshot.dateBounds(),
                snapshot.dateBounds().defaultWindow()));
    }

    DashboardViewDTO compose(ProductSnapshot snapshot, DashboardQuery query) {
        List<ProductRow> selected = query.selection().apply(snapshot.products());
        DateRange range = query.resolveRange(snapshot.dateBounds());

        WindowResult window = WindowRecomputationEngine.recompute(selected, range);
        if (window.fallbackCount() > 0) {
            log.warn("WINDOW_FALLBACK count={} ids={} range={}..{}",
                     window.fallbackCount(), window.fallbackIds(), range.start(), range.end());
        }
        List<ProductRow> rows = window.rows();

        ResultState state = rows.isEmpty() || window.hasNoMovements() ? ResultState.EMPTY : ResultState.DATA;
        log.debug("DASHBOARD_COMPOSED mode={} selected={} state={} range={}..{}",
                  query.mode(), rows.size(), state, range.start(), range.end());

        return new DashboardViewDTO(
            state,
            query.mode(),
            range,
            snapshot.dateBounds(),
            KpiCalculator.compute(rows, query.mode()),
            SegmentRollupCalculator.rollup(rows, query.mode()),
            ProductRanking.of(rows, query.mode()),
            DailySeriesBuilder.build(rows, range, query.mode()),
            rows.stream().map(ProductRowDTO::from).toList(),
            window.fallbackCount()
        );
    }
}
