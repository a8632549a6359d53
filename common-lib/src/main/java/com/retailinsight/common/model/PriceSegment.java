package com.retailinsight.common.model;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;

/**
 * Relative price tier assigned by {@link com.retailinsight.common.segment.PriceSegmentClassifier}.
 *
 * <p>Tiers are distribution-relative (percentiles of the current product set), not absolute
 * price bands. {@link #UNDEFINED} is the fallback when no usable price exists.
 *
 * <p>The localized label is what the dashboard displays and what query parameters may carry.
 */
public enum PriceSegment {
    LOW("Thấp"),
    MEDIUM("Trung bình"),
    HIGH("Cao"),
    UNDEFINED("Không xác định");

    /** Fixed display order of the three known tiers. */
    public static final List<PriceSegment> DISPLAY_ORDER = List.of(LOW, MEDIUM, HIGH);

    private final String label;

    PriceSegment(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves an enum name or a localized label, ignoring case and surrounding whitespace.
     *
     * @return the matching segment, or {@code null} when nothing matches
     */
    public static PriceSegment fromText(String text) {
        if (text == null || text.isBlank()) return null;
        String wanted = normalize(text);
        for (PriceSegment segment : values()) {
            if (segment.name().equalsIgnoreCase(wanted) || normalize(segment.label).equals(wanted)) {
                return segment;
            }
        }
        return null;
    }

    private static String normalize(String text) {
        return Normalizer.normalize(text.trim(), Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
    }
}
