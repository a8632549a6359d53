package com.retailinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Inclusive calendar date range. {@code start > end} is allowed and contains nothing.
 */
public record DateRange(
    @JsonProperty("start") LocalDate start,
    @JsonProperty("end")   LocalDate end
) {
    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }
}
