package com.retailinsight.insight.model;

import com.retailinsight.common.model.DateBounds;
import com.retailinsight.common.model.DateRange;
import com.retailinsight.common.model.DisplayMode;
import com.retailinsight.common.selection.ProductSelection;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One dashboard request: product selection, explicit display mode and an optional date window.
 * A missing {@code start} or {@code end} falls back to the snapshot's default window.
 */
public record DashboardQuery(
    ProductSelection selection,
    DisplayMode mode,
    LocalDate start,
    LocalDate end
) {
    public DashboardQuery {
        selection = selection == null ? ProductSelection.ALL : selection;
        Objects.requireNonNull(mode, "mode");
    }

    public DateRange resolveRange(DateBounds bounds) {
        DateRange fallback = bounds.defaultWindow();
        return DateRange.of(
            start != null ? start : fallback.start(),
            end != null ? end : fallback.end());
    }
}
