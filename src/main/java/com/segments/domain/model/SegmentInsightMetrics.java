package com.segments.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentInsightMetrics {

    private long userCount;
    private double avgCashBalance;
    private double avgTotalContests;
    private double avgIplContests;
    private double avgHighestIplScore;
    private double avgDaysSinceRegistration;

    // share of users with any activity in the last (up to) four weeks
    private double recentActiveShare;
}
