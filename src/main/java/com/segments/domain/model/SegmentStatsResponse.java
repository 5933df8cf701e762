package com.segments.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Segment breakdown of a table.
 *
 * The per-category totals only cover labels that map to a {@link Category};
 * unrecognized labels are listed under {@code segments} but counted nowhere else
 * except {@code totalUsers}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentStatsResponse {

    private List<String> categories;
    private List<SegmentCounts> segments;
    private Map<String, Long> totals;
    private long totalUsers;
}
