package com.retailinsight.insight.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.retailinsight.common.kpi.KpiSummary;
import com.retailinsight.common.kpi.ProductRanking;
import com.retailinsight.common.model.DateBounds;
import com.retailinsight.common.model.DateRange;
import com.retailinsight.common.model.DisplayMode;
import com.retailinsight.common.model.SegmentSummary;
import com.retailinsight.common.series.DailyPoint;
import com.retailinsight.insight.model.ResultState;

import java.util.List;

/**
 * Everything one dashboard render needs, recomputed from the cached snapshot per request.
 *
 * @param fallbackCount rows whose window recomputation failed and kept lifetime values
 */
public record DashboardViewDTO(
    @JsonProperty("state")         ResultState state,
    @JsonProperty("mode")          DisplayMode mode,
    @JsonProperty("range")         DateRange range,
    @JsonProperty("dateBounds")    DateBounds dateBounds,
    @JsonProperty("kpis")          KpiSummary kpis,
    @JsonProperty("segments")      List<SegmentSummary> segments,
    @JsonProperty("ranking")       ProductRanking ranking,
    @JsonProperty("daily")         List<DailyPoint> daily,
    @JsonProperty("products")      List<ProductRowDTO> products,
    @JsonProperty("fallbackCount") int fallbackCount
) {}
