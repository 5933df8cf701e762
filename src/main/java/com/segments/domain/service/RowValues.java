package com.segments.domain.service;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Null-coalescing reads of raw store values.
 *
 * Null (no rows, absent column) and empty strings read as zero. Counts come out as
 * longs, averages as doubles.
 */
@Slf4j
final class RowValues {

    private RowValues() {
    }

    static Optional<Map<String, Object>> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    static long asLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        String text = value.toString().strip();
        if (text.isEmpty()) {
            return 0L;
        }
        try {
            return new BigDecimal(text).longValue();
        } catch (NumberFormatException e) {
            log.warn("Non-numeric activity value '{}' read as 0", text);
            return 0L;
        }
    }

    static double asDouble(Object value) {
        if (value == null) {
            return 0.0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        String text = value.toString().strip();
        return text.isEmpty() ? 0.0 : Double.parseDouble(text);
    }

    /**
     * Segment label of a row; a NULL segment is reported as the empty label.
     */
    static String label(Object value) {
        return value == null ? "" : value.toString();
    }

    static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
