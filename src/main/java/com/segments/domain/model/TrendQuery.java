package com.segments.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Request for a multi-segment trend.
 *
 * Week selection: weeks inside [start, end] (either bound optional), capped to the
 * most recent {@code weeks}; if nothing falls inside the range, the most recent
 * {@code weeks} of the whole catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendQuery {

    public static final int DEFAULT_WEEKS = 12;
    public static final int MAX_WEEKS = 52;

    private List<String> segments;
    private LocalDate start;
    private LocalDate end;
    private Integer weeks;

    // Defaults
    public Integer getWeeks() {
        if (weeks == null || weeks <= 0) {
            return DEFAULT_WEEKS;
        }
        return Math.min(weeks, MAX_WEEKS);
    }

    public boolean hasSegmentFilter() {
        return segments != null && !segments.isEmpty();
    }
}
