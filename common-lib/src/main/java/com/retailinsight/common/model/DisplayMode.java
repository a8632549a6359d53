package com.retailinsight.common.model;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Selects which derived metric pair is active for rollups, KPIs, rankings and daily series.
 *
 * <p>Always passed explicitly; never inferred from the shape of the data.
 */
public enum DisplayMode {
    SALES("Bán hàng"),
    INVENTORY("Tồn kho");

    private final String label;

    DisplayMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Returns the metric pair of {@code row} that this mode reads. */
    public ModeMetrics metricsOf(ProductRow row) {
        return this == SALES ? row.sales() : row.inventory();
    }

    /** Per-entry quantity this mode reads from a single movement. */
    public double quantityOf(MovementEntry entry) {
        return this == SALES ? entry.stockDecreased() : entry.stockIncreased();
    }

    /**
     * Resolves an enum name or a localized label.
     *
     * @return the matching mode, or {@code null} when nothing matches
     */
    public static DisplayMode fromText(String text) {
        if (text == null || text.isBlank()) return null;
        String wanted = Normalizer.normalize(text.trim(), Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        for (DisplayMode mode : values()) {
            String label = Normalizer.normalize(mode.label, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
            if (mode.name().equalsIgnoreCase(wanted) || label.equals(wanted)) {
                return mode;
            }
        }
        return null;
    }
}
