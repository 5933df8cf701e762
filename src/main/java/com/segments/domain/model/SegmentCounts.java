package com.segments.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Counts for one observed segment label, keyed by category.
 * Unrecognized labels carry all-zero counts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentCounts {

    private String segment;
    private Map<String, Long> counts;
}
