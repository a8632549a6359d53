package com.retailinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One dated stock movement of a product. Only validated entries exist as instances;
 * malformed raw entries are dropped by the normalizer.
 */
public record MovementEntry(
    @JsonProperty("date")            LocalDate date,
    @JsonProperty("stock_decreased") double stockDecreased,
    @JsonProperty("stock_increased") double stockIncreased
) {}
