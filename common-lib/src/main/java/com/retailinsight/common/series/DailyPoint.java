package com.retailinsight.common.series;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One day of the time series. {@code value = trunc(quantity × averagePrice)}, never negative.
 */
public record DailyPoint(
    @JsonProperty("date")         LocalDate date,
    @JsonProperty("quantity")     double quantity,
    @JsonProperty("averagePrice") double averagePrice,
    @JsonProperty("value")        long value
) {}
