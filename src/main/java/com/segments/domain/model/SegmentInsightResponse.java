package com.segments.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentInsightResponse {

    private String segment;
    private SegmentInsightMetrics metrics;
    private List<TimelinePoint> recentActivity;
}
