package com.retailinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Observed min/max movement date of a snapshot, and the default filter window derived from it.
 */
public record DateBounds(
    @JsonProperty("min_date") LocalDate min,
    @JsonProperty("max_date") LocalDate max
) {
    public DateBounds {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
    }

    /** Used when the snapshot carries no dated movement at all. */
    public static final DateBounds DEFAULT = new DateBounds(LocalDate.of(2025, 3, 5), LocalDate.of(2025, 5, 25));

    static final LocalDate DEFAULT_WINDOW_START = LocalDate.of(2025, 3, 5);
    static final LocalDate DEFAULT_WINDOW_END   = LocalDate.of(2025, 5, 18);

    /** Min/max over every retained movement of every row, or {@link #DEFAULT}. */
    public static DateBounds observe(List<ProductRow> rows) {
        LocalDate min = null;
        LocalDate max = null;
        for (ProductRow row : rows) {
            for (MovementEntry entry : row.movements()) {
                LocalDate d = entry.date();
                if (min == null || d.isBefore(min)) min = d;
                if (max == null || d.isAfter(max))  max = d;
            }
        }
        return min == null ? DEFAULT : new DateBounds(min, max);
    }

    /** Pre-selected window: clipped to {@code [2025-03-05, 2025-05-18]} when the data allows. */
    public DateRange defaultWindow() {
        LocalDate start = min.isAfter(DEFAULT_WINDOW_START) ? min : DEFAULT_WINDOW_START;
        LocalDate end   = max.isBefore(DEFAULT_WINDOW_END) ? max : DEFAULT_WINDOW_END;
        return DateRange.of(start, end);
    }
}
