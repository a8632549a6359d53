package com.retailinsight.insight.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.retailinsight.common.model.DateBounds;
import com.retailinsight.common.model.DateRange;
import com.retailinsight.common.selection.FilterOptions;

/**
 * Filter control contents: option lists, selectable date bounds and the pre-selected window.
 */
public record FiltersDTO(
    @JsonProperty("options")       FilterOptions options,
    @JsonProperty("dateBounds")    DateBounds dateBounds,
    @JsonProperty("defaultWindow") DateRange defaultWindow
) {}
