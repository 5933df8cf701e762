package com.segments.domain.query;

import com.segments.domain.schema.ResolvedColumn;
import lombok.Builder;
import lombok.Value;

/**
 * Optional metric columns averaged by the segment insight query.
 */
@Value
@Builder
public class InsightColumns {

    ResolvedColumn cashBalance;
    ResolvedColumn totalContests;
    ResolvedColumn iplContests;
    ResolvedColumn highestIplScore;
    ResolvedColumn registeredDate;
}
