package com.segments.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

/**
 * One week of a trend: the week's column summed per segment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentTrendPoint {

    private String label;
    private LocalDate startDate;
    private LocalDate endDate;
    private Map<String, Long> totals;
}
