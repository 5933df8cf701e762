package com.segments.domain.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * One reporting period, backed by a physical column such as {@code 2024-01-01 - 2024-01-07}.
 */
@Value
public class WeekColumn {

    /** Physical column name exactly as introspected, quotes included. */
    String raw;

    /** Display label: the raw name without wrapping quotes. */
    String label;

    LocalDate startDate;
    LocalDate endDate;

    /**
     * True when this week starts on/after {@code start} and ends on/before {@code end}.
     * A null bound is open.
     */
    public boolean within(LocalDate start, LocalDate end) {
        return (start == null || !startDate.isBefore(start))
                && (end == null || !endDate.isAfter(end));
    }
}
