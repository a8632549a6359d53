package com.retailinsight.common.normalize;

import com.retailinsight.common.model.MovementEntry;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Map;
import java.util.Optional;

/**
 * Parses one raw {@code stock_history} element into a {@link MovementEntry}.
 *
 * <p>Accepted shape: a map with a {@code date} string in strict {@code YYYY-MM-DD} form.
 * Quantities may be numbers or numeric strings; a missing or null quantity counts as 0.
 * Anything else (non-map element, missing/unparsable/non-string date, non-numeric
 * quantity) yields {@link Optional#empty()}. Never throws.
 */
public final class MovementEntryParser {

    static final DateTimeFormatter DATE_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private MovementEntryParser() {}

    public static Optional<MovementEntry> parse(Object raw) {
        if (!(raw instanceof Map<?, ?> fields)) {
            return Optional.empty();
        }
        LocalDate date = parseDate(fields.get("date"));
        if (date == null) {
            return Optional.empty();
        }
        Double decreased = parseQuantity(fields.get("stock_decreased"));
        Double increased = parseQuantity(fields.get("stock_increased"));
        if (decreased == null || increased == null) {
            return Optional.empty();
        }
        return Optional.of(new MovementEntry(date, decreased, increased));
    }

    static LocalDate parseDate(Object raw) {
        if (!(raw instanceof String text)) {
            return null;
        }
        try {
            return LocalDate.parse(text, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Returns the numeric value, 0.0 for absent, or {@code null} when not a number. */
    static Double parseQuantity(Object raw) {
        if (raw == null) {
            return 0.0;
        }
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
